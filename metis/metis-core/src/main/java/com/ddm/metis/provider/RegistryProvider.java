package com.ddm.metis.provider;

import com.ddm.metis.defined.RegistryEntity;

import java.util.List;
import java.util.Optional;

/**
 * 注册表 Provider：持有一类实体的内存索引，对外提供统一访问契约。
 *
 * <p><strong>统一契约：</strong>
 * <ul>
 *   <li>{@link #load()}：从配置的回退链加载数据，数据源不可达不会抛出</li>
 *   <li>{@link #get(String)}：依次按主 id、旧式 id、展示名称、不区分大小写的名称查找</li>
 *   <li>{@link #getAll()}：按插入顺序返回全部实体</li>
 *   <li>{@link #findByAttribute(String, Object)}：列表字段测成员关系，其余测相等</li>
 *   <li>{@link #register(RegistryEntity)} / {@link #upsert(RegistryEntity)} / {@link #delete(String)}：写操作</li>
 * </ul>
 *
 * <p><strong>并发模型：</strong>写操作在 Provider 内串行化；读操作无锁，且只会观察到完整的索引快照。
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public interface RegistryProvider<T extends RegistryEntity> extends AutoCloseable {

    /**
     * 注册表名称，如 {@code kpi}。
     */
    String name();

    Class<T> entityType();

    /**
     * 加载索引。已加载时为空操作。
     *
     * @throws RegistryLoadException 回退链全部失败且默认数据不可用
     */
    void load();

    /**
     * 丢弃当前索引并重新加载。
     */
    void reload();

    /**
     * 以内置默认数据替换索引。
     *
     * @return 默认数据被禁用时返回 false
     */
    boolean loadDefaults();

    boolean isLoaded();

    /**
     * 当前数据的来源：数据源类型（{@code database}、{@code remote}、{@code file}、{@code memory}）、
     * {@code defaults}，或尚未加载时的 {@code none}。
     */
    String origin();

    Optional<T> get(String key);

    List<T> getAll();

    List<T> findByAttribute(String attribute, Object value);

    /**
     * 注册新实体。
     *
     * @return id 已存在时返回 false，已存储的实体保持不变
     */
    boolean register(T entity);

    /**
     * 插入或替换实体。Provider 尚未加载时先执行加载，写入落在加载结果之上。
     */
    T upsert(T entity);

    /**
     * 从主索引与全部二级索引中移除。
     *
     * @return id 不存在时返回 false
     */
    boolean delete(String id);

    int size();

    @Override
    default void close() {
    }
}
