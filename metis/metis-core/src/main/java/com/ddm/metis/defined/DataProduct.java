package com.ddm.metis.defined;

import com.ddm.metis.utils.Identifiers;
import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 数据产品契约。
 *
 * <p><strong>字段说明：</strong>
 * <ul>
 *   <li>{@code tables} / {@code views}：以名称为键的表、视图定义（保持声明顺序）</li>
 *   <li>{@code relatedBusinessProcesses}：关联的业务流程 id</li>
 *   <li>{@code version}：契约版本，缺省 {@code 1.0.0}</li>
 *   <li>{@code sourceSystem}：承载数据的系统，缺省 {@code duckdb}</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public record DataProduct(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("owner") String owner,
        @JsonProperty("version") String version,
        @JsonProperty("tables") Map<String, TableDefinition> tables,
        @JsonProperty("views") Map<String, ViewDefinition> views,
        @JsonProperty("related_business_processes") List<String> relatedBusinessProcesses,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("source_system") String sourceSystem,
        @JsonProperty("metadata") Map<String, Object> metadata) implements RegistryEntity {

    public DataProduct {
        if (Identifiers.isBlank(id)) {
            throw new IllegalArgumentException("DataProduct id must not be blank");
        }
        name = Values.orDefault(name, Identifiers.humanize(id));
        version = Values.orDefault(version, "1.0.0");
        tables = Values.map(tables);
        views = Values.map(views);
        relatedBusinessProcesses = Values.list(relatedBusinessProcesses);
        tags = Values.list(tags);
        sourceSystem = Values.orDefault(sourceSystem, "duckdb");
        metadata = Values.map(metadata);
    }

    @Override
    public String legacyId() {
        return Identifiers.legacyId(name);
    }

    public Optional<TableDefinition> table(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public Optional<ViewDefinition> view(String viewName) {
        return Optional.ofNullable(views.get(viewName));
    }
}
