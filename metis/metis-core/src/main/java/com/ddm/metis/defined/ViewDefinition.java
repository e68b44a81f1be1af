package com.ddm.metis.defined;

import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 数据产品中的视图定义：派生查询及其依赖的表/视图。
 *
 * @author metis
 * @since 1.0
 */
public record ViewDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("sql_definition") String sqlDefinition,
        @JsonProperty("depends_on") List<String> dependsOn) {

    public ViewDefinition {
        dependsOn = Values.list(dependsOn);
    }
}
