package com.ddm.metis.provider;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.CommunicationPreference;
import com.ddm.metis.defined.PrincipalProfile;
import com.ddm.metis.defined.TimeFrame;
import com.ddm.metis.source.RegistrySource;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 角色画像注册表，额外按 title 建立不区分大小写的索引。
 *
 * @author metis
 * @since 1.0
 */
public class PrincipalProfileProvider extends AbstractRegistryProvider<PrincipalProfile> {

    public static final String NAME = "principal_profile";

    public static final EntityCodec<PrincipalProfile> CODEC =
            new EntityCodec<>(PrincipalProfile.class, List.of("id", "name", "title"));

    public PrincipalProfileProvider() {
        this(List.of(), true);
    }

    public PrincipalProfileProvider(List<RegistrySource<PrincipalProfile>> sources, boolean defaultsEnabled) {
        super(NAME, CODEC, sources, defaultsEnabled,
                List.of(IndexKey.<PrincipalProfile>ignoreCase("title", p -> single(p.title()))));
    }

    public Optional<PrincipalProfile> findByTitle(String title) {
        return title == null ? Optional.empty() : lookupIn("title", title.toLowerCase(Locale.ROOT));
    }

    public List<PrincipalProfile> findByBusinessProcess(String businessProcessId) {
        return findByAttribute("business_processes", businessProcessId);
    }

    public List<PrincipalProfile> findByKpi(String kpiId) {
        return findByAttribute("kpis", kpiId);
    }

    @Override
    protected List<PrincipalProfile> defaults() {
        List<String> processes = List.of(
                "finance_profitability_analysis",
                "finance_revenue_growth_analysis",
                "finance_expense_management",
                "finance_cash_flow_management",
                "finance_budget_vs_actuals");
        List<String> kpis = List.of("gross_margin", "revenue_growth_rate");
        Map<String, List<String>> filters = Map.of(
                "region", List.of("ALL"),
                "product", List.of("ALL"),
                "customer_segment", List.of("ALL"));
        return List.of(
                new PrincipalProfile("cfo_001", "CFO", "Chief Financial Officer", "Finance",
                        "Responsible for financial planning, risk management, and financial reporting",
                        processes, kpis,
                        List.of("Financial strategy", "Capital allocation", "Financial reporting",
                                "Risk management", "Investor relations"),
                        filters,
                        new TimeFrame("QTD", 4, 2),
                        new CommunicationPreference("high", List.of("visual", "text", "table"),
                                List.of("trends", "anomalies", "forecasts")),
                        null, null),
                new PrincipalProfile("finance_manager", "Finance Manager", "Finance Manager", "Finance",
                        "Manages financial operations and supports financial decision-making",
                        processes, kpis,
                        List.of("Budget management", "Financial analysis", "Reporting"),
                        filters,
                        new TimeFrame("MTD", 6, 3),
                        CommunicationPreference.DEFAULT,
                        null, null));
    }
}
