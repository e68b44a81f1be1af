package com.ddm.metis.defined;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * KPI 取值相对阈值的评估结果。
 *
 * @author metis
 * @since 1.0
 */
public enum KpiStatus {
    GREEN,
    YELLOW,
    RED,
    /** 存在阈值但无法给出判断（未设任何边界，或取值为 NaN） */
    NEUTRAL,
    /** 该对比口径没有阈值 */
    UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
