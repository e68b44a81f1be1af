package com.ddm.metis.source;

import com.ddm.metis.defined.RegistryEntity;

import java.util.Collection;

/**
 * 支持写入的数据源（数据库、远程存储），用于 Provider 的写穿。
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public interface WritableRegistrySource<T extends RegistryEntity> extends RegistrySource<T> {

    /**
     * 按键字段插入或覆盖一条记录。
     *
     * @throws RegistrySourceException 写入失败
     */
    void upsert(T entity);

    /**
     * 按 id 删除记录。
     *
     * @return 是否有记录被删除
     * @throws RegistrySourceException 删除失败
     */
    boolean delete(String id);

    /**
     * 删除全部记录，仅用于"清空后重新灌入"的流程。
     */
    void truncate();

    default void upsertAll(Collection<T> entities) {
        for (T e : entities) {
            upsert(e);
        }
    }
}
