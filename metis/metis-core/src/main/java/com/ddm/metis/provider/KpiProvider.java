package com.ddm.metis.provider;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.ComparisonType;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.defined.KpiStatus;
import com.ddm.metis.defined.KpiThreshold;
import com.ddm.metis.source.RegistrySource;

import java.util.List;

/**
 * KPI 注册表。
 *
 * @author metis
 * @since 1.0
 */
public class KpiProvider extends AbstractRegistryProvider<Kpi> {

    public static final String NAME = "kpi";

    public static final EntityCodec<Kpi> CODEC =
            new EntityCodec<>(Kpi.class, List.of("id", "name", "domain", "owner_role"));

    public KpiProvider() {
        this(List.of(), true);
    }

    public KpiProvider(List<RegistrySource<Kpi>> sources, boolean defaultsEnabled) {
        super(NAME, CODEC, sources, defaultsEnabled, List.of());
    }

    public List<Kpi> findByBusinessProcess(String businessProcessId) {
        return findByAttribute("business_process_ids", businessProcessId);
    }

    public List<Kpi> findByDataProduct(String dataProductId) {
        return findByAttribute("data_product_id", dataProductId);
    }

    /**
     * 查找 KPI 并评估取值，KPI 不存在时返回 {@link KpiStatus#UNKNOWN}。
     */
    public KpiStatus evaluate(String kpiKey, double value, ComparisonType type) {
        return get(kpiKey).map(k -> k.evaluate(value, type)).orElse(KpiStatus.UNKNOWN);
    }

    @Override
    protected List<Kpi> defaults() {
        return List.of(
                new Kpi("gross_margin", "Gross Margin", "Finance",
                        "Revenue minus cost of goods sold, divided by revenue", "%", "finance_data",
                        List.of("finance_profitability_analysis"), "SELECT * FROM kpi_gross_margin",
                        List.of(KpiThreshold.of(ComparisonType.YOY, 5.0, 0.0, -5.0)),
                        null, null, "CFO", null, null),
                new Kpi("revenue_growth_rate", "Revenue Growth Rate", "Finance",
                        "Year-over-year percentage change in revenue", "%", "finance_data",
                        List.of("finance_revenue_growth_analysis"), "SELECT * FROM kpi_revenue_growth_rate",
                        List.of(KpiThreshold.of(ComparisonType.YOY, 10.0, 5.0, 0.0)),
                        null, null, "CFO", null, null));
    }
}
