package com.ddm.metis.provider;

import com.ddm.metis.defined.RegistryEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 不可变的索引快照：主索引（id → 实体）加若干二级索引（键 → id）。
 *
 * <p>每次写操作都从主索引整体重建二级索引后替换快照，读者只会看到完整的旧快照或完整的新快照；
 * 二级索引中的每个 id 必然存在于主索引，且键由当前值推导。同一键被多个实体占用时，插入顺序靠后者生效。
 *
 * @author metis
 * @since 1.0
 */
final class RegistryIndex<T extends RegistryEntity> {

    private final Map<String, T> primary;
    private final Map<String, String> primaryIgnoreCase;
    private final List<IndexKey<T>> keys;
    private final Map<String, Map<String, String>> secondary;

    private RegistryIndex(Map<String, T> primary, List<IndexKey<T>> keys) {
        this.primary = Collections.unmodifiableMap(primary);
        this.keys = keys;
        Map<String, String> lowerIds = new LinkedHashMap<>();
        Map<String, Map<String, String>> sec = new LinkedHashMap<>();
        for (IndexKey<T> key : keys) {
            sec.put(key.name(), new LinkedHashMap<>());
        }
        for (T entity : primary.values()) {
            lowerIds.put(entity.id().toLowerCase(Locale.ROOT), entity.id());
            for (IndexKey<T> key : keys) {
                Collection<String> values = key.keys().apply(entity);
                if (values == null) continue;
                Map<String, String> target = sec.get(key.name());
                for (String v : values) {
                    if (v == null || v.isBlank()) continue;
                    target.put(key.caseInsensitive() ? v.toLowerCase(Locale.ROOT) : v, entity.id());
                }
            }
        }
        sec.replaceAll((k, v) -> Collections.unmodifiableMap(v));
        this.primaryIgnoreCase = Collections.unmodifiableMap(lowerIds);
        this.secondary = Collections.unmodifiableMap(sec);
    }

    static <T extends RegistryEntity> RegistryIndex<T> empty(List<IndexKey<T>> keys) {
        return new RegistryIndex<>(new LinkedHashMap<>(), keys);
    }

    /**
     * 按顺序建立索引，id 重复时后者覆盖前者（保留首次出现的位置）。
     */
    static <T extends RegistryEntity> RegistryIndex<T> of(Collection<T> entities, List<IndexKey<T>> keys) {
        Map<String, T> primary = new LinkedHashMap<>();
        for (T e : entities) {
            primary.put(e.id(), e);
        }
        return new RegistryIndex<>(primary, keys);
    }

    RegistryIndex<T> with(T entity) {
        Map<String, T> next = new LinkedHashMap<>(primary);
        next.put(entity.id(), entity);
        return new RegistryIndex<>(next, keys);
    }

    RegistryIndex<T> without(String id) {
        Map<String, T> next = new LinkedHashMap<>(primary);
        next.remove(id);
        return new RegistryIndex<>(next, keys);
    }

    boolean contains(String id) {
        return primary.containsKey(id);
    }

    int size() {
        return primary.size();
    }

    List<T> values() {
        return List.copyOf(primary.values());
    }

    /**
     * 查找顺序：主 id → 精确二级索引（按声明顺序）→ 不区分大小写的 id → 不区分大小写的二级索引。
     */
    T lookup(String key) {
        if (key == null) return null;
        T hit = primary.get(key);
        if (hit != null) return hit;
        for (IndexKey<T> k : keys) {
            if (k.caseInsensitive()) continue;
            String id = secondary.get(k.name()).get(key);
            if (id != null) return primary.get(id);
        }
        String lower = key.toLowerCase(Locale.ROOT);
        String id = primaryIgnoreCase.get(lower);
        if (id != null) return primary.get(id);
        for (IndexKey<T> k : keys) {
            if (!k.caseInsensitive()) continue;
            id = secondary.get(k.name()).get(lower);
            if (id != null) return primary.get(id);
        }
        return null;
    }

    /**
     * 二级索引的只读视图（键 → id），索引不存在时返回空映射。
     */
    Map<String, String> secondary(String indexName) {
        return secondary.getOrDefault(indexName, Map.of());
    }

    List<IndexKey<T>> keys() {
        return keys;
    }

    List<String> indexNames() {
        List<String> names = new ArrayList<>();
        keys.forEach(k -> names.add(k.name()));
        return names;
    }

    T byId(String id) {
        return primary.get(id);
    }
}
