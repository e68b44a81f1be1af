package com.ddm.metis.defined;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link KpiThreshold} 与 {@link Kpi#evaluate(double, ComparisonType)} 的单元测试。
 *
 * @author metis
 */
class KpiThresholdTest {

    private static final KpiThreshold GROSS_MARGIN_YOY = KpiThreshold.of(ComparisonType.YOY, 5.0, 0.0, -5.0);

    @Test
    void testEvaluate_NormalLogic() {
        assertEquals(KpiStatus.GREEN, GROSS_MARGIN_YOY.evaluate(7.0));
        assertEquals(KpiStatus.GREEN, GROSS_MARGIN_YOY.evaluate(5.0));
        assertEquals(KpiStatus.YELLOW, GROSS_MARGIN_YOY.evaluate(2.0));
        assertEquals(KpiStatus.YELLOW, GROSS_MARGIN_YOY.evaluate(0.0));
        assertEquals(KpiStatus.RED, GROSS_MARGIN_YOY.evaluate(-1.0));
        assertEquals(KpiStatus.RED, GROSS_MARGIN_YOY.evaluate(-50.0));
    }

    @Test
    void testEvaluate_InverseLogic() {
        KpiThreshold cost = new KpiThreshold(ComparisonType.BUDGET, 100.0, 110.0, 120.0, true);
        assertEquals(KpiStatus.GREEN, cost.evaluate(90.0));
        assertEquals(KpiStatus.GREEN, cost.evaluate(100.0));
        assertEquals(KpiStatus.YELLOW, cost.evaluate(105.0));
        assertEquals(KpiStatus.RED, cost.evaluate(111.0));
    }

    @Test
    void testEvaluate_NeverThrows() {
        assertEquals(KpiStatus.NEUTRAL, GROSS_MARGIN_YOY.evaluate(Double.NaN));
        assertEquals(KpiStatus.GREEN, GROSS_MARGIN_YOY.evaluate(Double.POSITIVE_INFINITY));
        assertEquals(KpiStatus.RED, GROSS_MARGIN_YOY.evaluate(Double.NEGATIVE_INFINITY));
        assertEquals(KpiStatus.NEUTRAL, KpiThreshold.of(ComparisonType.QOQ, null, null, null).evaluate(1.0));
    }

    @Test
    void testEvaluate_PartialThresholds() {
        KpiThreshold onlyYellow = KpiThreshold.of(ComparisonType.MOM, null, 3.0, null);
        assertEquals(KpiStatus.YELLOW, onlyYellow.evaluate(4.0));
        assertEquals(KpiStatus.RED, onlyYellow.evaluate(2.0));
    }

    @Test
    void testKpiEvaluate_UnknownComparison() {
        Kpi kpi = new Kpi("gross_margin", "Gross Margin", "Finance", null, "%", null, null, null,
                java.util.List.of(GROSS_MARGIN_YOY), null, null, null, null, null);
        assertEquals(KpiStatus.GREEN, kpi.evaluate(6.0, ComparisonType.YOY));
        assertEquals(KpiStatus.UNKNOWN, kpi.evaluate(6.0, ComparisonType.QOQ));
        assertEquals(KpiStatus.UNKNOWN, kpi.evaluate(6.0, null));
    }

    @Test
    void testComparisonType_Codes() {
        assertEquals(ComparisonType.YOY, ComparisonType.of("yoy"));
        assertEquals(ComparisonType.BUDGET, ComparisonType.of("BUDGET"));
        assertThrows(IllegalArgumentException.class, () -> ComparisonType.of("weekly"));
    }
}
