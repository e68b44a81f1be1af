package com.ddm.metis.provider;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.BusinessProcess;
import com.ddm.metis.source.RegistrySource;

import java.util.List;

/**
 * 业务流程注册表。可按 id、旧式 id（{@code CASH_FLOW_MANAGEMENT}）、展示名称
 * （{@code "Finance: Cash Flow Management"}）或名称查找。
 *
 * @author metis
 * @since 1.0
 */
public class BusinessProcessProvider extends AbstractRegistryProvider<BusinessProcess> {

    public static final String NAME = "business_process";

    public static final EntityCodec<BusinessProcess> CODEC =
            new EntityCodec<>(BusinessProcess.class, List.of("id", "name", "domain", "owner_role"));

    public BusinessProcessProvider() {
        this(List.of(), true);
    }

    public BusinessProcessProvider(List<RegistrySource<BusinessProcess>> sources, boolean defaultsEnabled) {
        super(NAME, CODEC, sources, defaultsEnabled, List.of());
    }

    public List<BusinessProcess> findByDomain(String domain) {
        return findByAttribute("domain", domain);
    }

    public List<BusinessProcess> findByOwnerRole(String role) {
        return findByAttribute("owner_role", role);
    }

    @Override
    protected List<BusinessProcess> defaults() {
        return List.of(
                process("finance_profitability_analysis", "Profitability Analysis",
                        "Analysis of profit margins, cost structures, and profit drivers",
                        List.of("CEO", "Finance Manager"),
                        List.of("finance", "profitability", "margin", "analysis")),
                process("finance_revenue_growth_analysis", "Revenue Growth Analysis",
                        "Analysis of revenue growth trends, patterns, and drivers across products and regions",
                        List.of("CEO", "Sales Director", "Finance Manager"),
                        List.of("finance", "revenue", "growth", "analysis")),
                process("finance_expense_management", "Expense Management",
                        "Tracking and controlling operational and capital expenses across the organization",
                        List.of("Finance Manager", "Department Heads"),
                        List.of("finance", "expense", "cost", "management")),
                process("finance_cash_flow_management", "Cash Flow Management",
                        "Monitoring and optimization of cash inflows and outflows to ensure liquidity",
                        List.of("Finance Manager", "Treasury Manager"),
                        List.of("finance", "cash flow", "liquidity", "working capital")),
                process("finance_budget_vs_actuals", "Budget vs. Actuals",
                        "Comparison of budgeted figures with actual financial results to identify variances",
                        List.of("Finance Manager", "Department Heads"),
                        List.of("finance", "budget", "variance", "planning")));
    }

    private static BusinessProcess process(String id, String name, String description,
                                           List<String> stakeholders, List<String> tags) {
        return new BusinessProcess(id, name, "Finance", description, tags, "CFO", stakeholders, null, null);
    }
}
