package com.ddm.metis.factory;

import com.ddm.metis.defined.RegistryEntity;
import com.ddm.metis.provider.BusinessGlossaryProvider;
import com.ddm.metis.provider.BusinessProcessProvider;
import com.ddm.metis.provider.DataProductProvider;
import com.ddm.metis.provider.KpiProvider;
import com.ddm.metis.provider.PrincipalProfileProvider;
import com.ddm.metis.provider.RegistryProvider;

import java.util.Map;
import java.util.Optional;

/**
 * 注册表上下文：按名称持有 Provider，驱动初始化并记录每个 Provider 的状态。
 *
 * <p>在组合根（应用启动处）构造一次，再注入到所有需要注册表访问的地方；
 * "每个进程一个注册表"由只构造一个上下文来保证，而不是依赖全局单例。
 *
 * <p><strong>契约：</strong>
 * <ul>
 *   <li>{@link #registerProvider(String, RegistryProvider)}：先注册者生效，已初始化的 Provider 不可被替换</li>
 *   <li>{@link #initialize()}：依次加载尚未初始化的 Provider，失败互相隔离</li>
 *   <li>{@link #provider(String)}：五个内置名称在未注册时按默认配置懒构造</li>
 *   <li>{@link #providerStatus()}：名称 → 是否已初始化，用于健康检查</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public interface RegistryContext extends AutoCloseable {

    /**
     * 注册 Provider。
     *
     * @return 注册生效时返回 true；名称已被占用（或为同一实例）时返回 false
     */
    boolean registerProvider(String name, RegistryProvider<?> provider);

    /**
     * 加载全部尚未初始化的 Provider，顺序执行。
     */
    void initialize();

    /**
     * 按名称获取 Provider；未注册的内置名称会被懒构造、注册并标记为已初始化。
     */
    Optional<RegistryProvider<?>> provider(String name);

    /**
     * 按名称与实体类型获取 Provider。
     *
     * @throws IllegalArgumentException Provider 存在但实体类型不符
     */
    <T extends RegistryEntity> Optional<RegistryProvider<T>> provider(String name, Class<T> type);

    BusinessProcessProvider businessProcesses();

    KpiProvider kpis();

    PrincipalProfileProvider principals();

    DataProductProvider dataProducts();

    BusinessGlossaryProvider glossary();

    /**
     * 名称 → 是否已初始化。
     */
    Map<String, Boolean> providerStatus();

    Map<String, ProviderState> providerStates();

    @Override
    default void close() {
    }
}
