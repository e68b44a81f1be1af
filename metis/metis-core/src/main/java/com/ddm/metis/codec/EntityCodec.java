package com.ddm.metis.codec;

import com.ddm.metis.defined.RegistryEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实体的序列化边界：编码/解码均为纯函数，提升列（promoted columns）由声明给出。
 *
 * <p><strong>两层存储模型：</strong>
 * <ul>
 *   <li>载荷：完整实体编码为 JSON，存入 {@code definition} 列</li>
 *   <li>提升列：从编码结果中抽取的标量字段（id、name、domain 等），用于索引查询</li>
 *   <li>读取时先解码载荷，再用非空的提升列逐字段覆盖，提升列对其覆盖的字段具有权威性</li>
 * </ul>
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public class EntityCodec<T extends RegistryEntity> {

    private final Class<T> type;
    private final List<String> promotedFields;

    public EntityCodec(Class<T> type, List<String> promotedFields) {
        this.type = type;
        this.promotedFields = List.copyOf(promotedFields);
    }

    public Class<T> type() {
        return type;
    }

    /**
     * 声明的提升字段（与数据库列名相同）。
     */
    public List<String> promotedFields() {
        return promotedFields;
    }

    public ObjectNode encode(T entity) {
        return EntityCodecs.JSON.valueToTree(entity);
    }

    public String encodeToString(T entity) {
        return encode(entity).toString();
    }

    /**
     * 抽取提升字段，缺失或为 null 的字段不出现在结果中。
     */
    public Map<String, Object> promote(T entity) {
        ObjectNode node = encode(entity);
        Map<String, Object> columns = new LinkedHashMap<>();
        for (String field : promotedFields) {
            JsonNode v = node.get(field);
            if (v != null && !v.isNull()) {
                columns.put(field, v.isValueNode() ? v.asText() : v.toString());
            }
        }
        return columns;
    }

    /**
     * 解码单个实体节点。
     *
     * @throws IllegalArgumentException 节点不是对象，或不能构成合法实体
     */
    public T decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " record: expected an object");
        }
        try {
            T entity = EntityCodecs.JSON.treeToValue(node, type);
            if (entity == null) {
                throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " record: empty");
            }
            return entity;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " record: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * 解码节点，节点缺少 {@code id} 时使用 {@code defaultId}。
     */
    public T decode(JsonNode node, String defaultId) {
        if (defaultId != null && node instanceof ObjectNode object && !object.hasNonNull("id")) {
            ObjectNode copy = object.deepCopy();
            copy.put("id", defaultId);
            return decode(copy);
        }
        return decode(node);
    }

    /**
     * 两层解码：载荷 + 提升列覆盖。
     *
     * @param payload  {@code definition} 列内容，可以为 null 或空
     * @param promoted 提升列的值（列名 → 值），值为 null 的列被忽略
     */
    public T decode(String payload, Map<String, ?> promoted) {
        ObjectNode node;
        if (payload == null || payload.isBlank()) {
            node = EntityCodecs.JSON.createObjectNode();
        } else {
            try {
                JsonNode parsed = EntityCodecs.JSON.readTree(payload);
                if (!(parsed instanceof ObjectNode object)) {
                    throw new IllegalArgumentException("Malformed " + type.getSimpleName()
                            + " payload: expected a JSON object");
                }
                node = object;
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " payload: "
                        + e.getOriginalMessage(), e);
            }
        }
        for (String field : promotedFields) {
            Object value = promoted.get(field);
            if (value != null) {
                node.put(field, String.valueOf(value));
            }
        }
        return decode(node);
    }

    /**
     * 解码一个完整文档（{@link DocumentLayout.Kind#CONTRACT} 布局），缺省实现等同于
     * {@link #decode(JsonNode, String)}。
     */
    public T decodeDocument(JsonNode root, String documentId) {
        return decode(root, documentId);
    }
}
