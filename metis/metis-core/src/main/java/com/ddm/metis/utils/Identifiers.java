package com.ddm.metis.utils;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 标识符推导工具：旧式标识（legacy id）、slug 与可读名称之间的确定性转换。
 *
 * <p>所有方法都是纯函数，输入为 null 时返回 null。
 *
 * @author metis
 * @since 1.0
 */
public final class Identifiers {

    private Identifiers() {
    }

    /**
     * 旧命名体系下的标识：名称转大写，空格与连字符替换为下划线。
     * <p>例如 {@code "Cash Flow Management"} → {@code "CASH_FLOW_MANAGEMENT"}。
     */
    public static String legacyId(String name) {
        if (name == null) return null;
        return name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    /**
     * 小写 slug：{@code "Budget vs. Actuals"} → {@code "budget_vs._actuals"}。
     */
    public static String slug(String text) {
        if (text == null) return null;
        return text.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    /**
     * 把 snake_case / 大写标识还原为首字母大写的名称：{@code "GROSS_MARGIN"} → {@code "Gross Margin"}。
     */
    public static String humanize(String id) {
        if (id == null) return null;
        return Arrays.stream(id.trim().split("[_\\s]+"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT)
                        + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    /**
     * camelCase 转 snake_case，已是 snake_case 的名称原样返回。
     */
    public static String snakeCase(String name) {
        if (name == null) return null;
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_') sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
