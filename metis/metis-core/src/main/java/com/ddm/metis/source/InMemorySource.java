package com.ddm.metis.source;

import com.ddm.metis.defined.RegistryEntity;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * 进程内数据源：复制一份已构造好的实体集合（内置默认值、测试夹具）。
 *
 * @author metis
 * @since 1.0
 */
public class InMemorySource<T extends RegistryEntity> implements RegistrySource<T> {

    private final Supplier<? extends Collection<T>> supplier;

    public InMemorySource(Supplier<? extends Collection<T>> supplier) {
        this.supplier = supplier;
    }

    public static <T extends RegistryEntity> InMemorySource<T> of(Collection<T> entities) {
        List<T> copy = List.copyOf(entities);
        return new InMemorySource<>(() -> copy);
    }

    @Override
    public String type() {
        return "memory";
    }

    @Override
    public List<T> loadAll() {
        Collection<T> entities = supplier.get();
        return entities == null ? List.of() : List.copyOf(entities);
    }
}
