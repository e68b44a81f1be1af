package com.ddm.metis.resolve;

/**
 * 字段合并规则。
 *
 * <ul>
 *   <li>{@link #REPLACE}：浅替换，整个字段值被上层取代</li>
 *   <li>{@link #UNION}：列表并集，保留已有顺序，追加新值</li>
 *   <li>{@link #UNION_BY_KEY}：对象列表按键字段合并，键相同者被上层替换，新键追加</li>
 *   <li>{@link #MERGE_MAP}：映射逐键浅合并</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public enum MergeRule {
    REPLACE,
    UNION,
    UNION_BY_KEY,
    MERGE_MAP
}
