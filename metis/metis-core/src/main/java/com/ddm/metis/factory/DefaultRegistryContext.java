package com.ddm.metis.factory;

import com.ddm.metis.defined.RegistryEntity;
import com.ddm.metis.provider.BusinessGlossaryProvider;
import com.ddm.metis.provider.BusinessProcessProvider;
import com.ddm.metis.provider.DataProductProvider;
import com.ddm.metis.provider.KpiProvider;
import com.ddm.metis.provider.PrincipalProfileProvider;
import com.ddm.metis.provider.RegistryProvider;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 默认的注册表上下文实现。
 *
 * <p><strong>初始化策略：</strong>
 * <ul>
 *   <li>按注册顺序逐个调用 {@code load()}，不并行，保证回退决策与日志顺序确定</li>
 *   <li>{@code load()} 抛出异常时记录失败，并尝试该 Provider 自身的默认数据；其余 Provider 不受影响</li>
 *   <li>再次调用 {@link #initialize()} 只会重试尚未初始化的 Provider</li>
 * </ul>
 *
 * <p><strong>线程安全：</strong>注册与初始化在上下文锁内执行；状态表与 Provider 表可被并发读取。
 *
 * @see RegistryContext
 * @author metis
 * @since 1.0
 */
public class DefaultRegistryContext implements RegistryContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultRegistryContext.class);

    /**
     * 内置注册表名称 → 默认 Provider 构造器（仅使用内置默认数据）。
     */
    private static final Map<String, Supplier<RegistryProvider<?>>> WELL_KNOWN = Map.of(
            BusinessProcessProvider.NAME, BusinessProcessProvider::new,
            KpiProvider.NAME, KpiProvider::new,
            PrincipalProfileProvider.NAME, PrincipalProfileProvider::new,
            DataProductProvider.NAME, DataProductProvider::new,
            BusinessGlossaryProvider.NAME, BusinessGlossaryProvider::new);

    private final Map<String, RegistryProvider<?>> providers = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Boolean> status = new ConcurrentHashMap<>();
    private final Map<String, String> errors = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean registerProvider(String name, RegistryProvider<?> provider) {
        RegistryProvider<?> existing = providers.get(name);
        if (existing == provider) {
            return false;
        }
        if (existing != null) {
            if (Boolean.TRUE.equals(status.get(name))) {
                log.warn("Refusing to replace initialized provider '{}'", name);
                return false;
            }
            log.info("Replacing uninitialized provider '{}'", name);
            existing.close();
        }
        providers.put(name, provider);
        status.put(name, false);
        errors.remove(name);
        log.debug("Registered provider '{}' ({})", name, provider.getClass().getSimpleName());
        return true;
    }

    @Override
    public synchronized void initialize() {
        Map<String, RegistryProvider<?>> snapshot;
        synchronized (providers) {
            snapshot = new LinkedHashMap<>(providers);
        }
        for (Map.Entry<String, RegistryProvider<?>> e : snapshot.entrySet()) {
            if (Boolean.TRUE.equals(status.get(e.getKey()))) {
                continue;
            }
            initializeOne(e.getKey(), e.getValue());
        }
        log.info("Registry context initialized: {}", providerStatus());
    }

    private void initializeOne(String name, RegistryProvider<?> provider) {
        try {
            provider.load();
            status.put(name, true);
            errors.remove(name);
        } catch (RuntimeException e) {
            status.put(name, false);
            errors.put(name, String.valueOf(e.getMessage()));
            log.error("Failed to initialize provider '{}'", name, e);
            try {
                if (provider.loadDefaults()) {
                    log.warn("Provider '{}' is serving built-in defaults", name);
                }
            } catch (RuntimeException fallback) {
                log.error("Default fallback failed for provider '{}'", name, fallback);
            }
        }
    }

    @Override
    public Optional<RegistryProvider<?>> provider(String name) {
        RegistryProvider<?> existing = providers.get(name);
        if (existing != null) {
            return Optional.of(existing);
        }
        Supplier<RegistryProvider<?>> factory = WELL_KNOWN.get(name);
        if (factory == null) {
            return Optional.empty();
        }
        synchronized (this) {
            existing = providers.get(name);
            if (existing != null) {
                return Optional.of(existing);
            }
            RegistryProvider<?> created = factory.get();
            providers.put(name, created);
            status.put(name, false);
            initializeOne(name, created);
            log.info("Lazily created default provider '{}'", name);
            return Optional.of(created);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends RegistryEntity> Optional<RegistryProvider<T>> provider(String name, Class<T> type) {
        return provider(name).map(p -> {
            if (!type.isAssignableFrom(p.entityType())) {
                throw new IllegalArgumentException("Provider '" + name + "' holds "
                        + p.entityType().getSimpleName() + ", not " + type.getSimpleName());
            }
            return (RegistryProvider<T>) p;
        });
    }

    @Override
    public BusinessProcessProvider businessProcesses() {
        return typed(BusinessProcessProvider.NAME, BusinessProcessProvider.class);
    }

    @Override
    public KpiProvider kpis() {
        return typed(KpiProvider.NAME, KpiProvider.class);
    }

    @Override
    public PrincipalProfileProvider principals() {
        return typed(PrincipalProfileProvider.NAME, PrincipalProfileProvider.class);
    }

    @Override
    public DataProductProvider dataProducts() {
        return typed(DataProductProvider.NAME, DataProductProvider.class);
    }

    @Override
    public BusinessGlossaryProvider glossary() {
        return typed(BusinessGlossaryProvider.NAME, BusinessGlossaryProvider.class);
    }

    private <P extends RegistryProvider<?>> P typed(String name, Class<P> type) {
        RegistryProvider<?> p = provider(name)
                .orElseThrow(() -> new IllegalStateException("No provider registered under '" + name + "'"));
        if (!type.isInstance(p)) {
            throw new IllegalStateException("Provider '" + name + "' is a " + p.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(p);
    }

    @Override
    public Map<String, Boolean> providerStatus() {
        Map<String, Boolean> snapshot = new LinkedHashMap<>();
        synchronized (providers) {
            providers.keySet().forEach(name -> snapshot.put(name, status.getOrDefault(name, false)));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    public Map<String, ProviderState> providerStates() {
        Map<String, ProviderState> snapshot = new LinkedHashMap<>();
        synchronized (providers) {
            providers.forEach((name, p) -> snapshot.put(name, new ProviderState(
                    status.getOrDefault(name, false), p.origin(), p.size(), errors.get(name))));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * 关闭所有 Provider，释放数据源资源。
     */
    @PreDestroy
    @Override
    public void close() {
        synchronized (providers) {
            providers.forEach((name, p) -> {
                try {
                    p.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close provider '{}'", name, e);
                }
            });
        }
    }
}
