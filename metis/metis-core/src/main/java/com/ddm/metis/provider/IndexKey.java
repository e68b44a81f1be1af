package com.ddm.metis.provider;

import com.ddm.metis.defined.RegistryEntity;

import java.util.Collection;
import java.util.function.Function;

/**
 * 二级索引声明：从实体中抽取若干查找键。
 *
 * @param name            索引名（如 {@code legacy_id}、{@code display_name}）
 * @param keys            键抽取函数，返回值中的 null / 空白键被忽略
 * @param caseInsensitive 是否按小写建键与查找
 * @author metis
 * @since 1.0
 */
public record IndexKey<T extends RegistryEntity>(String name,
                                                 Function<T, Collection<String>> keys,
                                                 boolean caseInsensitive) {

    public static <T extends RegistryEntity> IndexKey<T> exact(String name, Function<T, Collection<String>> keys) {
        return new IndexKey<>(name, keys, false);
    }

    public static <T extends RegistryEntity> IndexKey<T> ignoreCase(String name, Function<T, Collection<String>> keys) {
        return new IndexKey<>(name, keys, true);
    }
}
