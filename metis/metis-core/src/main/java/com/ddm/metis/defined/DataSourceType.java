package com.ddm.metis.defined;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 数据表的来源类型，未识别的值归为 {@link #OTHER}。
 *
 * @author metis
 * @since 1.0
 */
public enum DataSourceType {
    CSV, DATABASE, API, SERVICE, OTHER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DataSourceType of(String raw) {
        if (raw == null) return OTHER;
        for (DataSourceType t : values()) {
            if (t.name().equalsIgnoreCase(raw.trim())) return t;
        }
        return OTHER;
    }
}
