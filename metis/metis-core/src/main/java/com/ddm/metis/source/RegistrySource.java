package com.ddm.metis.source;

import com.ddm.metis.defined.RegistryEntity;

import java.util.List;

/**
 * 注册表数据源：把一种存储介质转换为实体列表。
 *
 * <p><strong>职责：</strong>
 * <ul>
 *   <li>一次性读取全部实体（{@link #loadAll()}），结果顺序即写入索引的顺序</li>
 *   <li>单条记录格式错误时记录日志并跳过，不影响其余记录</li>
 *   <li>整个数据源不可达时抛出 {@link RegistrySourceException}，由 Provider 的回退链处理</li>
 *   <li>以 {@link #type()} 标识自身类型（{@code memory}、{@code file}、{@code database}、{@code remote}）</li>
 * </ul>
 *
 * <p><strong>注意事项：</strong>
 * <ul>
 *   <li>实现类应该是线程安全的</li>
 *   <li>远程实现必须带有有界超时，且内部不做重试</li>
 * </ul>
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public interface RegistrySource<T extends RegistryEntity> extends AutoCloseable {

    String type();

    /**
     * 读取全部实体。
     *
     * @return 实体列表，不为 null
     * @throws RegistrySourceException 数据源不可达
     */
    List<T> loadAll();

    /**
     * 释放数据源持有的资源，默认无操作。
     */
    @Override
    default void close() {
    }
}
