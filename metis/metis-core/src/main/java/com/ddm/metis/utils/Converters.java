package com.ddm.metis.utils;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * 宽松类型转换，用于配置项解析和 {@code findByAttribute} 的值比较。
 *
 * <p>转换失败时返回 null（或调用方给出的默认值），不抛出异常。
 *
 * @author metis
 * @since 1.0
 */
public final class Converters {

    private Converters() {
    }

    /**
     * 判断字段值是否与查询值匹配：
     * <ul>
     *   <li>字段为集合时测试成员关系</li>
     *   <li>否则测试相等；数字按数值比较，布尔按语义比较，其余按字符串比较</li>
     * </ul>
     */
    public static boolean matches(Object fieldValue, Object query) {
        if (fieldValue instanceof Collection<?> values) {
            for (Object v : values) {
                if (scalarEquals(v, query)) return true;
            }
            return false;
        }
        return scalarEquals(fieldValue, query);
    }

    private static boolean scalarEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number || b instanceof Number) {
            BigDecimal x = toDecimal(a);
            BigDecimal y = toDecimal(b);
            return x != null && y != null && x.compareTo(y) == 0;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return Objects.equals(toBoolean(a, null), toBoolean(b, null));
        }
        return String.valueOf(a).equals(String.valueOf(b));
    }

    public static BigDecimal toDecimal(Object raw) {
        if (raw == null) return null;
        if (raw instanceof BigDecimal d) return d;
        try {
            return new BigDecimal(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 布尔解析：{@code true/1/yes/on} 为真，{@code false/0/no/off} 为假，其余返回默认值。
     */
    public static Boolean toBoolean(Object raw, Boolean defaultValue) {
        if (raw == null) return defaultValue;
        if (raw instanceof Boolean b) return b;
        return switch (String.valueOf(raw).trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> defaultValue;
        };
    }

    public static int toInt(Object raw, int defaultValue) {
        BigDecimal d = toDecimal(raw);
        return d == null ? defaultValue : d.intValue();
    }

    /**
     * 支持：纯数字=秒；或带单位的简写（ms/s/m）；或 ISO-8601（PT5S）。
     */
    public static Duration toDuration(Object raw, Duration defaultValue) {
        if (raw == null) return defaultValue;
        if (raw instanceof Duration d) return d;
        try {
            String v = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
            if (v.isEmpty()) return defaultValue;
            if (v.startsWith("p")) return Duration.parse(v.toUpperCase(Locale.ROOT));
            if (v.matches("^\\d+(\\.\\d+)?$")) {
                return Duration.ofMillis((long) (Double.parseDouble(v) * 1000L));
            }
            if (v.endsWith("ms")) return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2)));
            if (v.endsWith("s")) return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1)));
            if (v.endsWith("m")) return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1)));
            return defaultValue;
        } catch (RuntimeException e) {
            return defaultValue;
        }
    }
}
