package com.ddm.metis.provider;

import com.ddm.metis.defined.BusinessTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link BusinessGlossaryProvider} 类的单元测试。
 *
 * @author metis
 */
class BusinessGlossaryProviderTest {

    private BusinessGlossaryProvider glossary;

    @BeforeEach
    void setUp() {
        glossary = new BusinessGlossaryProvider();
        glossary.load();
    }

    @Test
    void testTermBySynonym() {
        BusinessTerm revenue = glossary.term("Revenue").orElseThrow();
        assertSame(revenue, glossary.term("sales").orElseThrow());
        assertSame(revenue, glossary.term("TURNOVER").orElseThrow());
        assertTrue(glossary.term("headcount").isEmpty());
    }

    @Test
    void testTechnicalMapping() {
        assertEquals("revenue", glossary.technicalMapping("Sales").orElseThrow());
        assertEquals("PROFIT_MARGIN", glossary.technicalMapping("margin", "SAP").orElseThrow());
        assertTrue(glossary.technicalMapping("margin", "oracle").isEmpty());
    }

    @Test
    void testTranslate() {
        Map<String, TermTranslation> out = glossary.translate(List.of("Sales", "foo"), "duckdb");
        assertEquals(List.of("Sales", "foo"), List.copyOf(out.keySet()));
        assertEquals(new TermTranslation(true, "revenue", "revenue"), out.get("Sales"));
        assertFalse(out.get("foo").resolved());
        assertNull(out.get("foo").technicalName());
    }

    @Test
    void testUpsertReindexesSynonyms() {
        glossary.upsert(BusinessTerm.of("Revenue", List.of("top line"), "Total income", Map.of("duckdb", "rev")));
        assertEquals("rev", glossary.technicalMapping("Top Line").orElseThrow());
        assertTrue(glossary.term("sales").isEmpty());
    }
}
