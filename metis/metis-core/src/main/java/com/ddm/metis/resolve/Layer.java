package com.ddm.metis.resolve;

import com.ddm.metis.codec.EntityCodecs;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * 配置层。
 *
 * <p>默认层（{@code fillOnly=true}）只补齐下层缺失或为空的字段，并向按键合并的列表追加缺失的键；
 * 覆盖层（{@code fillOnly=false}）按字段规则覆盖下层。
 *
 * @param name     层名称，用于日志
 * @param values   该层给出的字段（snake_case）
 * @param fillOnly 是否只补齐缺失字段
 * @author metis
 * @since 1.0
 */
public record Layer(String name, ObjectNode values, boolean fillOnly) {

    public static Layer defaults(String name, Map<String, ?> values) {
        return new Layer(name, toNode(values), true);
    }

    public static Layer overrides(String name, Map<String, ?> values) {
        return new Layer(name, toNode(values), false);
    }

    private static ObjectNode toNode(Map<String, ?> values) {
        return values == null ? EntityCodecs.JSON.createObjectNode() : EntityCodecs.JSON.valueToTree(values);
    }
}
