package com.ddm.metis.bootstrap;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 注册表配置绑定类，对应属性前缀：{@code metis.registry.*}
 *
 * <p>配置只在启动时读取一次，不做热更新。
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * metis:
 *   registry:
 *     base-path: config/registry
 *     database:
 *       url: jdbc:postgresql://localhost:5432/metis
 *       username: metis
 *       password: secret
 *       init-sql: true
 *     remote:
 *       url: https://example.supabase.co
 *       api-key: ${SUPABASE_KEY}
 *       timeout: 5
 *     providers:
 *       kpi:
 *         backend: remote
 *         path: kpi_registry.yaml
 *       business_glossary:
 *         backend: database
 *         table: business_glossary_terms
 * }</pre>
 *
 * @param basePath  注册表文件所在目录，相对路径的 {@code path} 以它为基准，默认 {@code registry}
 * @param database  数据库后端连接参数
 * @param remote    远程 REST 后端参数
 * @param providers 按注册表名称的后端选择，未出现的注册表使用 {@code file} 后端
 * @author metis
 * @since 1.0
 */
@ConfigurationProperties(prefix = "metis.registry")
public record RegistryProperties(
        String basePath,
        Database database,
        Remote remote,
        Map<String, ProviderOptions> providers) {

    public RegistryProperties {
        basePath = basePath == null || basePath.isBlank() ? "registry" : basePath;
        database = database == null ? new Database(null, null, null, null) : database;
        remote = remote == null ? new Remote(null, null, null, null, null) : remote;
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public static RegistryProperties defaults() {
        return new RegistryProperties(null, null, null, null);
    }

    /**
     * 按注册表名称取后端选项。属性键 {@code business_glossary}、{@code business-glossary}
     * 与 {@code businessglossary} 视为同一名称。
     */
    public ProviderOptions provider(String name) {
        for (String key : List.of(name, name.replace('_', '-'), name.replace("_", ""))) {
            ProviderOptions options = providers.get(key);
            if (options != null) return options;
        }
        return ProviderOptions.FILE;
    }

    /**
     * @param url      JDBC URL
     * @param username 用户名，默认空字符串
     * @param password 密码，默认空字符串
     * @param initSql  是否自动建表，默认 false
     */
    public record Database(String url, String username, String password, Boolean initSql) {

        public Database {
            username = username == null ? "" : username;
            password = password == null ? "" : password;
            initSql = initSql != null && initSql;
        }
    }

    /**
     * @param url           服务根地址，如 {@code https://x.supabase.co}
     * @param apiKey        API key，同时作为 {@code apikey} 头与 Bearer token
     * @param timeout       单次请求超时，单位秒，默认 5 秒，取值限制在 1~9 秒
     * @param pathPrefix    表路径前缀，默认 {@code /rest/v1}
     * @param payloadColumn 两层行格式的载荷列名，为空时使用扁平行
     */
    public record Remote(String url,
                         String apiKey,
                         @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
                         String pathPrefix,
                         String payloadColumn) {

        static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
        static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
        static final Duration MAX_TIMEOUT = Duration.ofSeconds(9);

        public Remote {
            if (timeout == null) {
                timeout = DEFAULT_TIMEOUT;
            } else if (timeout.compareTo(MIN_TIMEOUT) < 0) {
                timeout = MIN_TIMEOUT;
            } else if (timeout.compareTo(MAX_TIMEOUT) > 0) {
                timeout = MAX_TIMEOUT;
            }
            pathPrefix = pathPrefix == null ? "/rest/v1" : pathPrefix;
        }

        public String endpoint(String table) {
            String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            String prefix = pathPrefix.isEmpty() || pathPrefix.startsWith("/") ? pathPrefix : "/" + pathPrefix;
            return base + prefix + "/" + table;
        }
    }

    /**
     * 单个注册表的后端选项。
     *
     * @param backend    {@code file}（默认）、{@code database}、{@code remote} 或 {@code memory}
     * @param path       本地文件或目录，相对路径以 {@code base-path} 为基准；为空时使用约定文件名
     * @param table      数据库表 / 远程表名；为空时使用约定表名
     * @param layout     文档布局：{@code list}、{@code keyed}、{@code wrapped}、{@code wrapped-keyed}、{@code contract}
     * @param wrapperKey 包装布局的键
     * @param keyFields  数据库 upsert 的键字段，默认 {@code [id]}
     * @param defaults   回退链耗尽时是否使用内置默认数据，默认 true
     * @param minEntries 文件至少应解码出的实体数，不足时视为文件不可用，默认 0
     */
    public record ProviderOptions(String backend,
                                  String path,
                                  String table,
                                  String layout,
                                  String wrapperKey,
                                  List<String> keyFields,
                                  Boolean defaults,
                                  Integer minEntries) {

        public static final ProviderOptions FILE = new ProviderOptions(null, null, null, null, null, null, null, null);

        public ProviderOptions {
            backend = backend == null || backend.isBlank() ? "file" : backend.trim().toLowerCase(Locale.ROOT);
            keyFields = keyFields == null || keyFields.isEmpty() ? List.of("id") : List.copyOf(keyFields);
            defaults = defaults == null || defaults;
            minEntries = minEntries == null ? 0 : minEntries;
        }
    }
}
