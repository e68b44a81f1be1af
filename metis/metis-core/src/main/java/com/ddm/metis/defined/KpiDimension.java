package com.ddm.metis.defined;

import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * KPI 分析维度，{@code values} 为允许的取值（可为空，表示不限）。
 *
 * @author metis
 * @since 1.0
 */
public record KpiDimension(
        @JsonProperty("name") String name,
        @JsonProperty("field") String field,
        @JsonProperty("description") String description,
        @JsonProperty("values") List<String> values) {

    public KpiDimension {
        values = Values.list(values);
    }
}
