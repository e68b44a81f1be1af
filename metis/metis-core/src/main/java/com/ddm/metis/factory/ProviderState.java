package com.ddm.metis.factory;

/**
 * 单个 Provider 的状态快照。
 *
 * @param initialized 是否已从配置的数据源成功初始化
 * @param origin      当前数据来源（{@code database}、{@code remote}、{@code file}、{@code memory}、
 *                    {@code defaults}、{@code none}）
 * @param size        当前实体数量
 * @param error       最近一次初始化失败的原因，成功时为 null
 * @author metis
 * @since 1.0
 */
public record ProviderState(boolean initialized, String origin, int size, String error) {
}
