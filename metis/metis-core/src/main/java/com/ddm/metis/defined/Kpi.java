package com.ddm.metis.defined;

import com.ddm.metis.utils.Identifiers;
import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * KPI 定义。
 *
 * <p><strong>字段说明：</strong>
 * <ul>
 *   <li>{@code dataProductId}：计算所依赖的数据产品 id</li>
 *   <li>{@code businessProcessIds}：关联的业务流程 id 列表</li>
 *   <li>{@code sqlQuery}：计算表达式</li>
 *   <li>{@code thresholds}：按对比口径的阈值，每个口径至多一条（重复时取第一条）</li>
 *   <li>{@code dimensions}：可下钻的分析维度</li>
 * </ul>
 *
 * <p>对没有阈值的口径调用 {@link #evaluate(double, ComparisonType)} 返回
 * {@link KpiStatus#UNKNOWN}，从不抛出异常。
 *
 * @author metis
 * @since 1.0
 */
public record Kpi(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("unit") String unit,
        @JsonProperty("data_product_id") String dataProductId,
        @JsonProperty("business_process_ids") List<String> businessProcessIds,
        @JsonProperty("sql_query") String sqlQuery,
        @JsonProperty("thresholds") List<KpiThreshold> thresholds,
        @JsonProperty("dimensions") List<KpiDimension> dimensions,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("owner_role") String ownerRole,
        @JsonProperty("stakeholder_roles") List<String> stakeholderRoles,
        @JsonProperty("metadata") Map<String, Object> metadata) implements RegistryEntity {

    public Kpi {
        if (Identifiers.isBlank(id)) {
            throw new IllegalArgumentException("KPI id must not be blank");
        }
        name = Values.orDefault(name, Identifiers.humanize(id));
        businessProcessIds = Values.list(businessProcessIds);
        thresholds = Values.list(thresholds);
        dimensions = Values.list(dimensions);
        tags = Values.list(tags);
        stakeholderRoles = Values.list(stakeholderRoles);
        metadata = Values.map(metadata);
    }

    /**
     * 由旧式枚举值构造 KPI：{@code "GROSS_MARGIN"} → id {@code gross_margin}，名称 {@code Gross Margin}。
     */
    public static Kpi fromLegacyLabel(String label, String domain) {
        String id = label.trim().toLowerCase(Locale.ROOT);
        String name = Identifiers.humanize(id);
        return new Kpi(id, name, domain, name, null, null, null, null,
                null, null, null, null, null, null);
    }

    @Override
    public String legacyId() {
        return Identifiers.legacyId(name);
    }

    public Optional<KpiThreshold> threshold(ComparisonType type) {
        return thresholds.stream().filter(t -> t.comparisonType() == type).findFirst();
    }

    public KpiStatus evaluate(double value, ComparisonType type) {
        if (type == null) return KpiStatus.UNKNOWN;
        return threshold(type).map(t -> t.evaluate(value)).orElse(KpiStatus.UNKNOWN);
    }
}
