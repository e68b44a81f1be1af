package com.ddm.metis.codec;

import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.DataSourceType;
import com.ddm.metis.defined.TableDefinition;
import com.ddm.metis.defined.ViewDefinition;
import com.ddm.metis.utils.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据产品编解码，额外支持"契约文档"格式：
 *
 * <pre>{@code
 * metadata:
 *   name: Finance Data
 *   domain: Finance
 *   owner: Finance Team
 * tables:
 *   - name: fi_star_schema
 *     columns:
 *       - {name: amount, type: DECIMAL}
 * views:
 *   - name: revenue_view
 *     sql_definition: SELECT ...
 * }</pre>
 *
 * <p>{@code tables} / {@code views} 可以是列表（按 {@code name} 建键）或映射；
 * 文档没有 {@code metadata} 块时按普通实体节点解码。
 *
 * @author metis
 * @since 1.0
 */
public class DataProductCodec extends EntityCodec<DataProduct> {

    public static final List<String> PROMOTED = List.of("id", "name", "domain", "owner", "version");

    public DataProductCodec() {
        super(DataProduct.class, PROMOTED);
    }

    @Override
    public DataProduct decodeDocument(JsonNode root, String documentId) {
        if (root == null || !root.isObject() || !root.has("metadata")) {
            return decode(root, documentId);
        }
        JsonNode meta = root.get("metadata");
        String name = text(meta, "name", "Unnamed Data Product");
        String domain = text(meta, "domain", "Finance");
        String id = documentId != null ? documentId : Identifiers.slug(name);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (meta.isObject()) {
            metadata.putAll(EntityCodecs.JSON.convertValue(meta, Map.class));
        }
        JsonNode fallbackDims = root.get("fallback_group_by_dimensions");
        if (fallbackDims != null && fallbackDims.isArray()) {
            metadata.put("fallback_group_by_dimensions", EntityCodecs.JSON.convertValue(fallbackDims, List.class));
        }
        String sourceSystem = text(meta, "source_system", text(root, "source_system", null));

        return new DataProduct(
                id,
                name,
                domain,
                text(meta, "description", "Data product for " + domain),
                text(meta, "owner", domain + " Team"),
                text(meta, "version", "1.0.0"),
                tables(root.get("tables")),
                views(root.get("views")),
                strings(root.get("related_business_processes")),
                strings(meta.get("tags")),
                sourceSystem,
                metadata);
    }

    private Map<String, TableDefinition> tables(JsonNode raw) {
        Map<String, TableDefinition> tables = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : named(raw).entrySet()) {
            String tableName = e.getKey();
            JsonNode def = e.getValue();
            Map<String, String> columns = new LinkedHashMap<>();
            JsonNode cols = def.get("columns");
            if (cols != null && cols.isArray()) {
                for (JsonNode col : cols) {
                    String colName = text(col, "name", null);
                    String colType = text(col, "type", null);
                    if (colName != null && colType != null) columns.put(colName, colType);
                }
            }
            Map<String, String> foreignKeys = new LinkedHashMap<>();
            JsonNode fks = def.get("foreign_keys");
            if (fks != null && fks.isObject()) {
                fks.fields().forEachRemaining(fk -> foreignKeys.put(fk.getKey(), fk.getValue().asText()));
            }
            tables.put(tableName, new TableDefinition(
                    tableName,
                    text(def, "description", "Table " + tableName),
                    DataSourceType.of(text(def, "data_source_type", "csv")),
                    text(def, "data_source_path", null),
                    columns,
                    strings(def.get("primary_keys")),
                    foreignKeys));
        }
        return tables;
    }

    private Map<String, ViewDefinition> views(JsonNode raw) {
        Map<String, ViewDefinition> views = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : named(raw).entrySet()) {
            String viewName = e.getKey();
            JsonNode def = e.getValue();
            views.put(viewName, new ViewDefinition(
                    viewName,
                    text(def, "description", "View " + viewName),
                    text(def, "sql_definition", "SELECT * FROM " + viewName),
                    strings(def.get("depends_on"))));
        }
        return views;
    }

    /**
     * 列表按元素的 {@code name} 建键，映射原样返回；无名元素被丢弃。
     */
    private static Map<String, JsonNode> named(JsonNode raw) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        if (raw == null || raw.isNull()) return out;
        if (raw.isArray()) {
            for (JsonNode entry : raw) {
                String n = text(entry, "name", null);
                if (n != null) out.put(n, entry);
            }
        } else if (raw.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), e.getValue().isObject() ? e.getValue() : new ObjectNode(EntityCodecs.JSON.getNodeFactory()));
            }
        }
        return out;
    }

    private static List<String> strings(JsonNode raw) {
        List<String> out = new ArrayList<>();
        if (raw != null && raw.isArray()) {
            raw.forEach(n -> out.add(n.asText()));
        }
        return out;
    }

    private static String text(JsonNode node, String field, String fallback) {
        if (node == null) return fallback;
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? fallback : v.asText();
    }
}
