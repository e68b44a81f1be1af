package com.ddm.metis.defined;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * KPI 阈值：按对比口径给出绿/黄/红边界。
 *
 * <p>{@code inverseLogic=true} 表示"越低越好"：取值不高于绿线为绿，不高于黄线为黄，其余为红。
 * 否则取值不低于绿线为绿，不低于黄线为黄，其余为红。
 *
 * @author metis
 * @since 1.0
 */
public record KpiThreshold(
        @JsonProperty("comparison_type") ComparisonType comparisonType,
        @JsonProperty("green_threshold") Double greenThreshold,
        @JsonProperty("yellow_threshold") Double yellowThreshold,
        @JsonProperty("red_threshold") Double redThreshold,
        @JsonProperty("inverse_logic") boolean inverseLogic) {

    public KpiThreshold {
        Objects.requireNonNull(comparisonType, "comparison_type");
    }

    public static KpiThreshold of(ComparisonType type, Double green, Double yellow, Double red) {
        return new KpiThreshold(type, green, yellow, red, false);
    }

    /**
     * 评估取值，从不抛出异常。
     */
    public KpiStatus evaluate(double value) {
        if (Double.isNaN(value)) return KpiStatus.NEUTRAL;
        if (greenThreshold == null && yellowThreshold == null && redThreshold == null) {
            return KpiStatus.NEUTRAL;
        }
        if (inverseLogic) {
            if (greenThreshold != null && value <= greenThreshold) return KpiStatus.GREEN;
            if (yellowThreshold != null && value <= yellowThreshold) return KpiStatus.YELLOW;
        } else {
            if (greenThreshold != null && value >= greenThreshold) return KpiStatus.GREEN;
            if (yellowThreshold != null && value >= yellowThreshold) return KpiStatus.YELLOW;
        }
        return KpiStatus.RED;
    }
}
