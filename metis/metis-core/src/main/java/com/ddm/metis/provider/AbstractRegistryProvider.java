package com.ddm.metis.provider;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.codec.EntityCodecs;
import com.ddm.metis.defined.RegistryEntity;
import com.ddm.metis.source.RegistrySource;
import com.ddm.metis.source.RegistrySourceException;
import com.ddm.metis.source.WritableRegistrySource;
import com.ddm.metis.utils.Converters;
import com.ddm.metis.utils.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Provider 的通用实现：回退链加载、不可变索引快照、写穿与属性查询。
 *
 * <p><strong>加载流程：</strong>
 * <ol>
 *   <li>按顺序尝试每个数据源（如 remote → file），第一个成功的结果写入索引</li>
 *   <li>数据源抛出的异常只记录告警，继续尝试下一个</li>
 *   <li>全部失败时加载内置默认数据；默认数据被禁用或构造失败时抛出 {@link RegistryLoadException}</li>
 * </ol>
 *
 * <p><strong>写穿规则：</strong>仅当当前数据来自一个可写数据源时，写操作先落到该数据源，成功后再替换索引；
 * 数据来自回退文件或默认数据时只修改内存索引。尚未加载的 Provider 在第一次写操作前先执行 {@link #load()}。
 *
 * <p>子类提供实体的默认数据与额外的二级索引；旧式 id、展示名称、名称三个索引由本类统一声明。
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public abstract class AbstractRegistryProvider<T extends RegistryEntity> implements RegistryProvider<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRegistryProvider.class);

    public static final String ORIGIN_NONE = "none";
    public static final String ORIGIN_DEFAULTS = "defaults";

    private static final long ATTRIBUTE_VIEW_CACHE_SIZE = 10_000;

    private final String name;
    private final EntityCodec<T> codec;
    private final List<RegistrySource<T>> sources;
    private final boolean defaultsEnabled;
    private final List<IndexKey<T>> indexKeys;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * 实体的编码视图，供属性查询复用。按对象身份弱引用持有，实体被替换后自然失效。
     */
    private final LoadingCache<T, ObjectNode> attributeViews;

    private volatile RegistryIndex<T> index;
    private volatile boolean loaded;
    private volatile String origin = ORIGIN_NONE;
    private volatile WritableRegistrySource<T> store;

    protected AbstractRegistryProvider(String name, EntityCodec<T> codec, List<RegistrySource<T>> sources,
                                       boolean defaultsEnabled, List<IndexKey<T>> extraKeys) {
        this.name = name;
        this.codec = codec;
        this.sources = List.copyOf(sources);
        this.defaultsEnabled = defaultsEnabled;
        List<IndexKey<T>> keys = new ArrayList<>();
        keys.add(IndexKey.exact("legacy_id", e -> single(e.legacyId())));
        keys.add(IndexKey.exact("display_name", e -> single(e.displayName())));
        keys.add(IndexKey.ignoreCase("name", e -> single(e.name())));
        keys.addAll(extraKeys);
        this.indexKeys = List.copyOf(keys);
        this.index = RegistryIndex.empty(indexKeys);
        this.attributeViews = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(ATTRIBUTE_VIEW_CACHE_SIZE)
                .build(codec::encode);
    }

    protected static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }

    /**
     * 内置默认数据，每次调用返回新列表。
     */
    protected abstract List<T> defaults();

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<T> entityType() {
        return codec.type();
    }

    public EntityCodec<T> codec() {
        return codec;
    }

    public List<RegistrySource<T>> sources() {
        return sources;
    }

    @Override
    public void load() {
        writeLock.lock();
        try {
            if (loaded) {
                log.debug("Registry '{}' already loaded ({} entries from {}), skipping", name, index.size(), origin);
                return;
            }
            for (RegistrySource<T> source : sources) {
                try {
                    List<T> entities = source.loadAll();
                    install(entities, source.type());
                    store = source instanceof WritableRegistrySource<T> w ? w : null;
                    return;
                } catch (RuntimeException e) {
                    log.warn("Registry '{}' source '{}' unavailable, falling back: {}", name, source.type(), e.getMessage());
                }
            }
            if (!defaultsEnabled) {
                index = RegistryIndex.empty(indexKeys);
                origin = ORIGIN_NONE;
                store = null;
                throw new RegistryLoadException("No source available for registry '" + name + "' and defaults are disabled");
            }
            installDefaults();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void reload() {
        writeLock.lock();
        try {
            loaded = false;
            load();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean loadDefaults() {
        if (!defaultsEnabled) {
            return false;
        }
        writeLock.lock();
        try {
            installDefaults();
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    private void installDefaults() {
        List<T> entities;
        try {
            entities = defaults();
        } catch (RuntimeException e) {
            throw new RegistryLoadException("Could not construct defaults for registry '" + name + "'", e);
        }
        install(entities, ORIGIN_DEFAULTS);
        store = null;
    }

    private void install(List<T> entities, String from) {
        index = RegistryIndex.of(entities, indexKeys);
        origin = from;
        loaded = true;
        log.info("Loaded {} entries into registry '{}' from {}", index.size(), name, from);
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    @Override
    public String origin() {
        return origin;
    }

    @Override
    public Optional<T> get(String key) {
        return Optional.ofNullable(index.lookup(key));
    }

    @Override
    public List<T> getAll() {
        return index.values();
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public List<T> findByAttribute(String attribute, Object value) {
        String field = Identifiers.snakeCase(attribute);
        List<T> matches = new ArrayList<>();
        for (T entity : index.values()) {
            if (Converters.matches(attributeValue(entity, field), value)) {
                matches.add(entity);
            }
        }
        return matches;
    }

    /**
     * 读取实体的某个字段（snake_case 名称），列表字段返回集合。子类可提供派生属性。
     */
    protected Object attributeValue(T entity, String field) {
        JsonNode node = attributeViews.get(entity).get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>(node.size());
            node.forEach(n -> values.add(scalar(n)));
            return values;
        }
        return scalar(node);
    }

    private static Object scalar(JsonNode node) {
        if (node.isNumber()) return node.numberValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isValueNode()) return node.asText();
        return EntityCodecs.JSON.convertValue(node, Object.class);
    }

    @Override
    public boolean register(T entity) {
        writeLock.lock();
        try {
            ensureLoaded();
            if (index.contains(entity.id())) {
                log.debug("Registry '{}' already contains {}, register refused", name, entity.id());
                return false;
            }
            persist(entity);
            index = index.with(entity);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public T upsert(T entity) {
        writeLock.lock();
        try {
            ensureLoaded();
            persist(entity);
            index = index.with(entity);
            return entity;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        writeLock.lock();
        try {
            ensureLoaded();
            if (!index.contains(id)) {
                return false;
            }
            WritableRegistrySource<T> s = store;
            if (s != null) {
                s.delete(id);
            }
            index = index.without(id);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 清空并以给定实体重新灌入（写穿到可写数据源）。
     *
     * <p>数据源写入中途失败时，索引按数据源的实际内容重建；数据源也无法读取时 Provider 回到未加载状态。
     *
     * @throws RegistrySourceException 数据源清空或写入失败
     */
    public void reseed(Collection<T> entities) {
        writeLock.lock();
        try {
            ensureLoaded();
            WritableRegistrySource<T> s = store;
            if (s != null) {
                try {
                    s.truncate();
                    s.upsertAll(entities);
                } catch (RuntimeException e) {
                    resyncFrom(s);
                    throw new RegistrySourceException("Reseed of registry '" + name + "' failed on " + s.type(), e);
                }
            }
            index = RegistryIndex.of(entities, indexKeys);
            loaded = true;
            log.info("Reseeded registry '{}' with {} entries", name, index.size());
        } finally {
            writeLock.unlock();
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            load();
        }
    }

    private void resyncFrom(WritableRegistrySource<T> s) {
        try {
            install(s.loadAll(), s.type());
        } catch (RuntimeException e) {
            log.error("Registry '{}' could not be re-read from {} after a failed reseed, marking unloaded", name, s.type(), e);
            index = RegistryIndex.empty(indexKeys);
            origin = ORIGIN_NONE;
            store = null;
            loaded = false;
        }
    }

    private void persist(T entity) {
        WritableRegistrySource<T> s = store;
        if (s != null) {
            s.upsert(entity);
        }
    }

    /**
     * 当前快照，仅供同包测试检查索引一致性。
     */
    RegistryIndex<T> index() {
        return index;
    }

    /**
     * 子类按二级索引名直接查找 id。
     */
    protected Optional<T> lookupIn(String indexName, String key) {
        RegistryIndex<T> snapshot = index;
        String id = snapshot.secondary(indexName).get(key);
        return Optional.ofNullable(id == null ? null : snapshot.byId(id));
    }

    @Override
    public void close() {
        for (RegistrySource<T> source : sources) {
            try {
                source.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close source '{}' of registry '{}'", source.type(), name, e);
            }
        }
    }
}
