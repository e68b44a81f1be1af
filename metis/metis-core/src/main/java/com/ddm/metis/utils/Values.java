package com.ddm.metis.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 实体记录的集合规整：null 变为空集合，结果不可变并保留原有顺序。
 *
 * @author metis
 * @since 1.0
 */
public final class Values {

    private Values() {
    }

    public static <T> List<T> list(Collection<T> values) {
        if (values == null || values.isEmpty()) return List.of();
        List<T> copy = new ArrayList<>(values.size());
        for (T v : values) {
            if (v != null) copy.add(v);
        }
        return Collections.unmodifiableList(copy);
    }

    public static <K, V> Map<K, V> map(Map<K, V> values) {
        if (values == null || values.isEmpty()) return Map.of();
        Map<K, V> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null) copy.put(k, v);
        });
        return Collections.unmodifiableMap(copy);
    }

    public static <T> T orDefault(T value, T fallback) {
        return Objects.requireNonNullElse(value, fallback);
    }

    public static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
