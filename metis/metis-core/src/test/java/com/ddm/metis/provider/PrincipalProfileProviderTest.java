package com.ddm.metis.provider;

import com.ddm.metis.defined.PrincipalProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link PrincipalProfileProvider} 类的单元测试。
 *
 * @author metis
 */
class PrincipalProfileProviderTest {

    private PrincipalProfileProvider principals;

    @BeforeEach
    void setUp() {
        principals = new PrincipalProfileProvider();
        principals.load();
    }

    @Test
    void testLookupByTitle() {
        PrincipalProfile cfo = principals.get("cfo_001").orElseThrow();
        assertSame(cfo, principals.get("Chief Financial Officer").orElseThrow());
        assertSame(cfo, principals.get("chief financial officer").orElseThrow());
        assertSame(cfo, principals.findByTitle("CHIEF FINANCIAL OFFICER").orElseThrow());
        assertTrue(principals.findByTitle("Chief Executive Officer").isEmpty());
        assertTrue(principals.findByTitle(null).isEmpty());
    }

    @Test
    void testFindByBusinessProcessAndKpi() {
        assertEquals(2, principals.findByBusinessProcess("finance_cash_flow_management").size());
        assertEquals(2, principals.findByKpi("gross_margin").size());
        assertTrue(principals.findByBusinessProcess("finance_cash").isEmpty());
    }

    @Test
    void testFindByDefaultFilterHasNoMatchForMapField() {
        assertTrue(principals.findByAttribute("default_filters", "ALL").isEmpty());
    }

    @Test
    void testFindScenario_CfoCash() {
        principals.register(new PrincipalProfile("cfo_cash", "Cash CFO", "Treasury Lead", "Finance", null,
                List.of("finance_cash_flow_management"), List.of(), null, null, null, null, null, null));
        List<String> ids = principals.findByBusinessProcess("finance_cash_flow_management").stream()
                .map(PrincipalProfile::id).toList();
        assertEquals(List.of("cfo_001", "finance_manager", "cfo_cash"), ids);
    }
}
