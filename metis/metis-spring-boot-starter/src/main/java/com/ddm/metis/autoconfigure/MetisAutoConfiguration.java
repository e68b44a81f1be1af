package com.ddm.metis.autoconfigure;

import com.ddm.metis.bootstrap.RegistryBootstrap;
import com.ddm.metis.bootstrap.RegistryProperties;
import com.ddm.metis.factory.DefaultRegistryContext;
import com.ddm.metis.factory.RegistryContext;
import com.ddm.metis.resolve.KpiDefaultsResolver;
import com.ddm.metis.validation.RegistryChainValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Metis 元数据注册表的自动配置类。
 * <p>自动配置以下组件：
 * <ul>
 *   <li>{@link RegistryContext}：已完成启动的注册表上下文</li>
 *   <li>{@link KpiDefaultsResolver}：KPI 分层默认值解析器</li>
 *   <li>{@link RegistryChainValidator}：注册表引用链校验器</li>
 * </ul>
 *
 * <p>未配置 {@code metis.registry.database.url} 时，数据库后端使用容器中已有的 {@link DataSource}。
 *
 * @see RegistryBootstrap
 * @author metis
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(RegistryProperties.class)
public class MetisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MetisAutoConfiguration.class);

    /**
     * 创建并启动注册表上下文。
     *
     * @param props       注册表配置
     * @param dataSources 容器中的数据源（可选）
     * @return 已初始化的 RegistryContext
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RegistryContext registryContext(RegistryProperties props, ObjectProvider<DataSource> dataSources) {
        DataSource ds = props.database().url() == null || props.database().url().isBlank()
                ? dataSources.getIfAvailable()
                : null;
        RegistryContext context = new RegistryBootstrap(props, new DefaultRegistryContext(), ds, null).initialize();
        log.info("Metis registry ready: {}", context.providerStatus());
        return context;
    }

    @Bean
    @ConditionalOnMissingBean
    public KpiDefaultsResolver kpiDefaultsResolver() {
        return new KpiDefaultsResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public RegistryChainValidator registryChainValidator() {
        return new RegistryChainValidator();
    }
}
