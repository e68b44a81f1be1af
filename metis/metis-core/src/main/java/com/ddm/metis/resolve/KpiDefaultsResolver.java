package com.ddm.metis.resolve;

import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.factory.RegistryContext;
import com.ddm.metis.provider.KpiProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 计算 KPI 的生效定义：KPI 记录 ← 所属数据产品的 {@code metadata.kpi_defaults} ← 调用方覆盖。
 *
 * <p><strong>字段规则：</strong>
 * <ul>
 *   <li>{@code thresholds}：按 {@code comparison_type} 合并</li>
 *   <li>{@code dimensions}：按 {@code name} 合并</li>
 *   <li>{@code tags}、{@code business_process_ids}、{@code stakeholder_roles}：并集</li>
 *   <li>{@code metadata}：逐键合并</li>
 *   <li>其余字段：浅替换</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public class KpiDefaultsResolver {

    public static final String DEFAULTS_KEY = "kpi_defaults";

    private static final Map<String, LayeredResolver.FieldRule> RULES = Map.of(
            "thresholds", LayeredResolver.FieldRule.byKey("comparison_type"),
            "dimensions", LayeredResolver.FieldRule.byKey("name"),
            "tags", LayeredResolver.FieldRule.of(MergeRule.UNION),
            "business_process_ids", LayeredResolver.FieldRule.of(MergeRule.UNION),
            "stakeholder_roles", LayeredResolver.FieldRule.of(MergeRule.UNION),
            "metadata", LayeredResolver.FieldRule.of(MergeRule.MERGE_MAP));

    private final LayeredResolver<Kpi> resolver = new LayeredResolver<>(KpiProvider.CODEC, RULES);

    /**
     * @param kpi       基础记录
     * @param product   所属数据产品，可以为 null
     * @param overrides 覆盖字段（snake_case），可以为 null
     */
    public Kpi resolve(Kpi kpi, DataProduct product, Map<String, ?> overrides) {
        List<Layer> layers = new ArrayList<>(2);
        productDefaults(product).ifPresent(d -> layers.add(Layer.defaults("data_product:" + product.id(), d)));
        if (overrides != null && !overrides.isEmpty()) {
            layers.add(Layer.overrides("overrides", overrides));
        }
        return layers.isEmpty() ? kpi : resolver.resolve(kpi, layers);
    }

    /**
     * 从上下文查找 KPI 与其数据产品后解析。
     */
    public Optional<Kpi> resolve(RegistryContext registry, String kpiKey, Map<String, ?> overrides) {
        return registry.kpis().get(kpiKey).map(kpi -> {
            DataProduct product = kpi.dataProductId() == null ? null
                    : registry.dataProducts().get(kpi.dataProductId()).orElse(null);
            return resolve(kpi, product, overrides);
        });
    }

    @SuppressWarnings("unchecked")
    private static Optional<Map<String, Object>> productDefaults(DataProduct product) {
        if (product == null) return Optional.empty();
        Object raw = product.metadata().get(DEFAULTS_KEY);
        return raw instanceof Map<?, ?> m ? Optional.of((Map<String, Object>) m) : Optional.empty();
    }
}
