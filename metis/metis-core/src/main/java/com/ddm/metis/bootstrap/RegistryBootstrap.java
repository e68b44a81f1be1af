package com.ddm.metis.bootstrap;

import com.ddm.metis.codec.DocumentLayout;
import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.BusinessProcess;
import com.ddm.metis.defined.BusinessTerm;
import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.defined.PrincipalProfile;
import com.ddm.metis.defined.RegistryEntity;
import com.ddm.metis.factory.DefaultRegistryContext;
import com.ddm.metis.factory.RegistryContext;
import com.ddm.metis.provider.BusinessGlossaryProvider;
import com.ddm.metis.provider.BusinessProcessProvider;
import com.ddm.metis.provider.DataProductProvider;
import com.ddm.metis.provider.KpiProvider;
import com.ddm.metis.provider.PrincipalProfileProvider;
import com.ddm.metis.source.FileRegistrySource;
import com.ddm.metis.source.InMemorySource;
import com.ddm.metis.source.JdbcRegistrySource;
import com.ddm.metis.source.RegistrySource;
import com.ddm.metis.source.RestRegistrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 注册表启动器：解析配置，为五个注册表构造 Provider 并注册到上下文，然后调用
 * {@link RegistryContext#initialize()}。
 *
 * <p><strong>后端与回退链：</strong>
 * <ul>
 *   <li>{@code file}：[本地文件] → 内置默认</li>
 *   <li>{@code database}：[数据库表, 本地文件] → 内置默认</li>
 *   <li>{@code remote}：[远程 REST, 本地文件] → 内置默认</li>
 *   <li>{@code memory}：[进程内夹具]（未提供夹具时直接使用内置默认）</li>
 * </ul>
 *
 * <p><strong>幂等：</strong>首次调用构造并注册 Provider；之后的调用只重试尚未初始化成功的 Provider。
 *
 * <pre>{@code
 * RegistryBootstrap bootstrap = new RegistryBootstrap(properties);
 * RegistryContext registry = bootstrap.initialize();
 * registry.kpis().findByBusinessProcess("finance_cash_flow_management");
 * }</pre>
 *
 * @author metis
 * @since 1.0
 */
public class RegistryBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RegistryBootstrap.class);

    /**
     * 每个注册表的约定：默认文件名、默认表名、默认文档布局。
     */
    private record Convention(String file, String table, DocumentLayout layout) {
    }

    private static final Map<String, Convention> CONVENTIONS = Map.of(
            BusinessProcessProvider.NAME, new Convention("business_process_registry.yaml", "business_processes",
                    DocumentLayout.list()),
            KpiProvider.NAME, new Convention("kpi_registry.yaml", "kpis",
                    DocumentLayout.wrapped("kpis", DocumentLayout.list())),
            PrincipalProfileProvider.NAME, new Convention("principal_registry.yaml", "principal_profiles",
                    DocumentLayout.wrapped("principals", DocumentLayout.list())),
            DataProductProvider.NAME, new Convention("data_products", "data_products",
                    DocumentLayout.contract()),
            BusinessGlossaryProvider.NAME, new Convention("business_glossary.yaml", "business_glossary_terms",
                    DocumentLayout.wrapped("terms", DocumentLayout.list())));

    private final RegistryProperties properties;
    private final RegistryContext context;
    private final Map<String, Collection<? extends RegistryEntity>> fixtures = new HashMap<>();
    private DataSource dataSource;
    private HttpClient http;
    private boolean bootstrapped;

    public RegistryBootstrap(RegistryProperties properties) {
        this(properties, new DefaultRegistryContext(), null, null);
    }

    /**
     * @param properties 注册表配置
     * @param context    目标上下文
     * @param dataSource 数据库后端使用的数据源，为 null 时按 {@code database.url} 创建
     * @param http       远程后端使用的 HTTP 客户端，为 null 时按需创建
     */
    public RegistryBootstrap(RegistryProperties properties, RegistryContext context,
                             DataSource dataSource, HttpClient http) {
        this.properties = properties;
        this.context = context;
        this.dataSource = dataSource;
        this.http = http;
    }

    /**
     * 为 {@code memory} 后端提供进程内实体集合。须在 {@link #initialize()} 之前调用。
     */
    public RegistryBootstrap withFixtures(String registry, Collection<? extends RegistryEntity> entities) {
        fixtures.put(registry, List.copyOf(entities));
        return this;
    }

    public RegistryContext context() {
        return context;
    }

    /**
     * 执行启动，可重复调用。
     *
     * @return 注册表上下文
     * @throws IllegalArgumentException 配置缺少必需项（如 database 后端没有 url）
     */
    public synchronized RegistryContext initialize() {
        if (!bootstrapped) {
            context.registerProvider(BusinessProcessProvider.NAME,
                    new BusinessProcessProvider(sources(BusinessProcessProvider.NAME, BusinessProcessProvider.CODEC, BusinessProcess.class),
                            defaultsEnabled(BusinessProcessProvider.NAME)));
            context.registerProvider(KpiProvider.NAME,
                    new KpiProvider(sources(KpiProvider.NAME, KpiProvider.CODEC, Kpi.class),
                            defaultsEnabled(KpiProvider.NAME)));
            context.registerProvider(PrincipalProfileProvider.NAME,
                    new PrincipalProfileProvider(sources(PrincipalProfileProvider.NAME, PrincipalProfileProvider.CODEC, PrincipalProfile.class),
                            defaultsEnabled(PrincipalProfileProvider.NAME)));
            context.registerProvider(DataProductProvider.NAME,
                    new DataProductProvider(sources(DataProductProvider.NAME, DataProductProvider.CODEC, DataProduct.class),
                            defaultsEnabled(DataProductProvider.NAME)));
            context.registerProvider(BusinessGlossaryProvider.NAME,
                    new BusinessGlossaryProvider(sources(BusinessGlossaryProvider.NAME, BusinessGlossaryProvider.CODEC, BusinessTerm.class),
                            defaultsEnabled(BusinessGlossaryProvider.NAME)));
            bootstrapped = true;
        } else {
            log.debug("Registry already bootstrapped, retrying uninitialized providers only");
        }
        context.initialize();
        return context;
    }

    private boolean defaultsEnabled(String name) {
        return properties.provider(name).defaults();
    }

    <T extends RegistryEntity> List<RegistrySource<T>> sources(String name, EntityCodec<T> codec, Class<T> type) {
        RegistryProperties.ProviderOptions options = properties.provider(name);
        Convention convention = CONVENTIONS.get(name);
        String table = Optional.ofNullable(options.table()).orElse(convention.table());
        List<RegistrySource<T>> chain = new ArrayList<>();
        switch (options.backend()) {
            case "file" -> chain.add(fileSource(options, convention, codec));
            case "database", "postgres", "jdbc" -> {
                chain.add(new JdbcRegistrySource<>(dataSource(), table, codec,
                        options.keyFields(), properties.database().initSql()));
                chain.add(fileSource(options, convention, codec));
            }
            case "remote", "supabase", "rest" -> {
                RegistryProperties.Remote remote = properties.remote();
                if (remote.url() == null || remote.url().isBlank()) {
                    throw new IllegalArgumentException("Missing required config: metis.registry.remote.url");
                }
                chain.add(new RestRegistrySource<>(httpClient(), remote.endpoint(table), remote.apiKey(),
                        remote.timeout(), codec, remote.payloadColumn()));
                chain.add(fileSource(options, convention, codec));
            }
            case "memory" -> {
                Collection<? extends RegistryEntity> entities = fixtures.get(name);
                if (entities != null) {
                    chain.add(InMemorySource.of(entities.stream().map(type::cast).toList()));
                }
            }
            default -> throw new IllegalArgumentException("Unknown backend '" + options.backend()
                    + "' for registry '" + name + "'");
        }
        log.info("Registry '{}' uses backend '{}' with chain {}", name, options.backend(),
                chain.stream().map(RegistrySource::type).toList());
        return chain;
    }

    private <T extends RegistryEntity> FileRegistrySource<T> fileSource(RegistryProperties.ProviderOptions options,
                                                                         Convention convention, EntityCodec<T> codec) {
        Path base = Path.of(properties.basePath());
        Path path = options.path() == null || options.path().isBlank()
                ? base.resolve(convention.file())
                : base.resolve(options.path());
        DocumentLayout layout = options.layout() == null || options.layout().isBlank()
                ? convention.layout()
                : DocumentLayout.parse(options.layout(), options.wrapperKey());
        return new FileRegistrySource<>(path, layout, codec, options.minEntries());
    }

    private DataSource dataSource() {
        if (dataSource == null) {
            RegistryProperties.Database db = properties.database();
            if (db.url() == null || db.url().isBlank()) {
                throw new IllegalArgumentException("Missing required config: metis.registry.database.url");
            }
            dataSource = new DriverManagerDataSource(db.url(), db.username(), db.password());
        }
        return dataSource;
    }

    private HttpClient httpClient() {
        if (http == null) {
            http = HttpClient.newBuilder()
                    .connectTimeout(properties.remote().timeout())
                    .build();
        }
        return http;
    }
}
