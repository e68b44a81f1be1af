package com.ddm.metis.factory;

import com.ddm.metis.codec.DocumentLayout;
import com.ddm.metis.defined.BusinessProcess;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.provider.AbstractRegistryProvider;
import com.ddm.metis.provider.BusinessProcessProvider;
import com.ddm.metis.provider.KpiProvider;
import com.ddm.metis.provider.RegistryProvider;
import com.ddm.metis.source.FileRegistrySource;
import com.ddm.metis.source.InMemorySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link DefaultRegistryContext} 类的单元测试。
 *
 * @author metis
 */
class DefaultRegistryContextTest {

    private DefaultRegistryContext context;

    @BeforeEach
    void setUp() {
        context = new DefaultRegistryContext();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private static KpiProvider kpisFrom(Kpi... kpis) {
        return new KpiProvider(List.of(InMemorySource.of(List.of(kpis))), true);
    }

    // ==================== 注册 ====================

    @Test
    void testRegister_FirstWinsAfterInitialize() {
        KpiProvider first = kpisFrom(Kpi.fromLegacyLabel("NET_INCOME", "Finance"));
        assertTrue(context.registerProvider(KpiProvider.NAME, first));
        assertFalse(context.registerProvider(KpiProvider.NAME, first));
        context.initialize();

        assertFalse(context.registerProvider(KpiProvider.NAME, new KpiProvider()));
        assertSame(first, context.kpis());
    }

    @Test
    void testRegister_UninitializedMayBeReplaced() {
        KpiProvider first = kpisFrom(Kpi.fromLegacyLabel("NET_INCOME", "Finance"));
        KpiProvider second = kpisFrom(Kpi.fromLegacyLabel("EBITDA", "Finance"));
        assertTrue(context.registerProvider(KpiProvider.NAME, first));
        assertTrue(context.registerProvider(KpiProvider.NAME, second));
        context.initialize();
        assertTrue(context.kpis().get("ebitda").isPresent());
    }

    // ==================== 初始化 ====================

    @Test
    void testInitialize_IsolatesFailures() {
        KpiProvider strict = new KpiProvider(List.of(new FileRegistrySource<>(Path.of("target/missing/kpis.yaml"),
                DocumentLayout.list(), KpiProvider.CODEC)), false);
        BusinessProcessProvider processes = new BusinessProcessProvider(
                List.of(InMemorySource.of(List.of(BusinessProcess.of("hr_payroll", "Payroll", "HR")))), true);
        context.registerProvider(KpiProvider.NAME, strict);
        context.registerProvider(BusinessProcessProvider.NAME, processes);

        context.initialize();

        assertEquals(Map.of(KpiProvider.NAME, false, BusinessProcessProvider.NAME, true), context.providerStatus());
        ProviderState kpiState = context.providerStates().get(KpiProvider.NAME);
        assertFalse(kpiState.initialized());
        assertNotNull(kpiState.error());
        assertEquals(0, kpiState.size());
        assertEquals("memory", context.providerStates().get(BusinessProcessProvider.NAME).origin());
    }

    @Test
    void testInitialize_SkipsAlreadyInitialized() {
        KpiProvider kpis = kpisFrom(Kpi.fromLegacyLabel("NET_INCOME", "Finance"));
        context.registerProvider(KpiProvider.NAME, kpis);
        context.initialize();
        kpis.upsert(Kpi.fromLegacyLabel("EBITDA", "Finance"));

        context.initialize();
        assertEquals(2, context.kpis().size());
    }

    @Test
    void testInitialize_FallbackOriginVisibleInStates() {
        context.registerProvider(KpiProvider.NAME, new KpiProvider(List.of(new FileRegistrySource<>(
                Path.of("target/missing/kpis.yaml"), DocumentLayout.list(), KpiProvider.CODEC)), true));
        context.initialize();

        ProviderState state = context.providerStates().get(KpiProvider.NAME);
        assertTrue(state.initialized());
        assertEquals(AbstractRegistryProvider.ORIGIN_DEFAULTS, state.origin());
        assertEquals(2, state.size());
    }

    // ==================== 懒构造 ====================

    @Test
    void testProvider_LazyDefaults() {
        assertTrue(context.providerStatus().isEmpty());
        assertEquals(5, context.businessProcesses().size());
        assertEquals(Map.of(BusinessProcessProvider.NAME, true), context.providerStatus());
        assertSame(context.businessProcesses(), context.businessProcesses());
        assertTrue(context.glossary().term("sales").isPresent());
    }

    @Test
    void testProvider_UnknownName() {
        assertTrue(context.provider("weather").isEmpty());
    }

    @Test
    void testProvider_TypeCheck() {
        RegistryProvider<Kpi> kpis = context.provider(KpiProvider.NAME, Kpi.class).orElseThrow();
        assertEquals(KpiProvider.NAME, kpis.name());
        assertThrows(IllegalArgumentException.class, () -> context.provider(KpiProvider.NAME, BusinessProcess.class));
    }

    @Test
    void testTypedAccessor_WrongProviderClass() {
        context.registerProvider(KpiProvider.NAME, new BusinessProcessProvider());
        assertThrows(IllegalStateException.class, () -> context.kpis());
    }
}
