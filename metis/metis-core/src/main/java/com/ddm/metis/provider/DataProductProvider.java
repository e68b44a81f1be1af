package com.ddm.metis.provider;

import com.ddm.metis.codec.DataProductCodec;
import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.DataSourceType;
import com.ddm.metis.defined.TableDefinition;
import com.ddm.metis.defined.ViewDefinition;
import com.ddm.metis.source.RegistrySource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据产品注册表。
 *
 * <p>{@link #findByAttribute(String, Object)} 额外支持两个派生属性：
 * {@code has_table}（按表名）与 {@code has_view}（按视图名）。
 *
 * @author metis
 * @since 1.0
 */
public class DataProductProvider extends AbstractRegistryProvider<DataProduct> {

    public static final String NAME = "data_product";

    public static final DataProductCodec CODEC = new DataProductCodec();

    public DataProductProvider() {
        this(List.of(), true);
    }

    public DataProductProvider(List<RegistrySource<DataProduct>> sources, boolean defaultsEnabled) {
        super(NAME, CODEC, sources, defaultsEnabled, List.of());
    }

    @Override
    protected Object attributeValue(DataProduct entity, String field) {
        return switch (field) {
            case "has_table" -> new ArrayList<>(entity.tables().keySet());
            case "has_view" -> new ArrayList<>(entity.views().keySet());
            default -> super.attributeValue(entity, field);
        };
    }

    public List<DataProduct> findByTable(String tableName) {
        return findByAttribute("has_table", tableName);
    }

    public List<DataProduct> findByBusinessProcess(String businessProcessId) {
        return findByAttribute("related_business_processes", businessProcessId);
    }

    @Override
    protected List<DataProduct> defaults() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("transaction_id", "string");
        columns.put("date", "date");
        columns.put("amount", "float");
        columns.put("category", "string");
        columns.put("department", "string");
        TableDefinition transactions = new TableDefinition("financial_transactions",
                "Financial transactions including revenue, expenses, etc.",
                DataSourceType.CSV, "data/finance/financial_transactions.csv",
                columns, List.of("transaction_id"), null);
        ViewDefinition revenueByDepartment = new ViewDefinition("revenue_by_department",
                "Revenue aggregated by department",
                """
                        SELECT department, SUM(amount) AS total_revenue
                        FROM financial_transactions
                        WHERE category = 'Revenue'
                        GROUP BY department""",
                List.of("financial_transactions"));
        return List.of(new DataProduct("finance_data", "Finance Data", "Finance",
                "Core financial data product including financial transactions and dimensions",
                "Finance Team", "1.0.0",
                Map.of(transactions.name(), transactions),
                Map.of(revenueByDepartment.name(), revenueByDepartment),
                List.of("finance_profitability_analysis", "finance_revenue_growth_analysis"),
                List.of("finance", "transactions"), null, null));
    }
}
