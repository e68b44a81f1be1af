package com.ddm.metis.defined;

import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 数据产品中的表定义：列名到类型的映射、主键与外键（列名 → 引用）。
 *
 * @author metis
 * @since 1.0
 */
public record TableDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("data_source_type") DataSourceType dataSourceType,
        @JsonProperty("data_source_path") String dataSourcePath,
        @JsonProperty("column_schema") Map<String, String> columnSchema,
        @JsonProperty("primary_keys") List<String> primaryKeys,
        @JsonProperty("foreign_keys") Map<String, String> foreignKeys) {

    public TableDefinition {
        dataSourceType = Values.orDefault(dataSourceType, DataSourceType.CSV);
        columnSchema = Values.map(columnSchema);
        primaryKeys = Values.list(primaryKeys);
        foreignKeys = Values.map(foreignKeys);
    }
}
