package com.ddm.metis.codec;

import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.DataSourceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link DataProductCodec} 类的单元测试。
 *
 * @author metis
 */
class DataProductCodecTest {

    private final DataProductCodec codec = new DataProductCodec();

    @Test
    void testDecodeDocument_ContractFormat() throws Exception {
        String doc = """
                metadata:
                  name: FI Star Schema
                  domain: Finance
                  owner: Finance Team
                  tags: [finance, star]
                tables:
                  - name: fact_gl
                    data_source_type: database
                    columns:
                      - {name: amount, type: DECIMAL}
                      - {name: account_id, type: VARCHAR}
                    primary_keys: [entry_id]
                views:
                  - name: v_revenue
                    sql_definition: SELECT SUM(amount) FROM fact_gl
                    depends_on: [fact_gl]
                related_business_processes: [finance_revenue_growth_analysis]
                fallback_group_by_dimensions: [account_id]
                """;
        DataProduct dp = codec.decodeDocument(EntityCodecs.YAML.readTree(doc), "fi_star_schema");

        assertEquals("fi_star_schema", dp.id());
        assertEquals("FI Star Schema", dp.name());
        assertEquals("1.0.0", dp.version());
        assertEquals(List.of("finance", "star"), dp.tags());
        assertEquals(Map.of("amount", "DECIMAL", "account_id", "VARCHAR"), dp.table("fact_gl").orElseThrow().columnSchema());
        assertEquals(DataSourceType.DATABASE, dp.table("fact_gl").orElseThrow().dataSourceType());
        assertEquals(List.of("fact_gl"), dp.view("v_revenue").orElseThrow().dependsOn());
        assertEquals(List.of("finance_revenue_growth_analysis"), dp.relatedBusinessProcesses());
        assertEquals(List.of("account_id"), dp.metadata().get("fallback_group_by_dimensions"));
    }

    @Test
    void testDecodeDocument_PlainEntityWithoutMetadataBlock() throws Exception {
        String doc = """
                id: sales_data
                name: Sales Data
                domain: Sales
                tables:
                  orders:
                    name: orders
                """;
        DataProduct dp = codec.decodeDocument(EntityCodecs.YAML.readTree(doc), "ignored");
        assertEquals("sales_data", dp.id());
        assertTrue(dp.table("orders").isPresent());
        assertEquals("duckdb", dp.sourceSystem());
    }

    @Test
    void testPromotedFields() {
        DataProduct dp = new DataProduct("p1", "P1", "Finance", null, "Ops", null, null, null, null, null, null, null);
        assertEquals(Map.of("id", "p1", "name", "P1", "domain", "Finance", "owner", "Ops", "version", "1.0.0"),
                codec.promote(dp));
    }
}
