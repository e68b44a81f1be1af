package com.ddm.metis.defined;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * KPI 阈值的对比口径。
 *
 * @author metis
 * @since 1.0
 */
public enum ComparisonType {
    QOQ("qoq"),
    YOY("yoy"),
    MOM("mom"),
    TARGET("target"),
    BUDGET("budget");

    private final String code;

    ComparisonType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * 按编码或枚举名解析（不区分大小写），同时接受 {@code vs_target} / {@code vs_budget} 写法。
     *
     * @throws IllegalArgumentException 无法识别时
     */
    @JsonCreator
    public static ComparisonType of(String raw) {
        if (raw == null) throw new IllegalArgumentException("comparison type must not be null");
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("vs_")) v = v.substring(3);
        for (ComparisonType t : values()) {
            if (t.code.equals(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        throw new IllegalArgumentException("Unknown comparison type: " + raw);
    }
}
