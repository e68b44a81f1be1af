package com.ddm.metis.provider;

import com.ddm.metis.codec.DocumentLayout;
import com.ddm.metis.defined.BusinessProcess;
import com.ddm.metis.source.FileRegistrySource;
import com.ddm.metis.source.InMemorySource;
import com.ddm.metis.source.RegistrySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link BusinessProcessProvider} 与 {@link AbstractRegistryProvider} 公共行为的单元测试。
 *
 * @author metis
 */
class BusinessProcessProviderTest {

    private BusinessProcessProvider provider;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        provider = new BusinessProcessProvider();
        provider.load();
    }

    // ==================== 查找 ====================

    @Test
    void testGet_AllKeysResolveToSameEntity() {
        BusinessProcess byId = provider.get("finance_cash_flow_management").orElseThrow();
        assertSame(byId, provider.get("CASH_FLOW_MANAGEMENT").orElseThrow());
        assertSame(byId, provider.get("Finance: Cash Flow Management").orElseThrow());
        assertSame(byId, provider.get("cash flow management").orElseThrow());
        assertSame(byId, provider.get("FINANCE_CASH_FLOW_MANAGEMENT").orElseThrow());
        assertTrue(provider.get("Finance: Payroll").isEmpty());
        assertTrue(provider.get(null).isEmpty());
    }

    @Test
    void testFindByAttribute() {
        assertEquals(5, provider.findByDomain("Finance").size());
        assertEquals(5, provider.findByOwnerRole("CFO").size());
        assertEquals(2, provider.findByAttribute("stakeholderRoles", "Department Heads").size());
        assertTrue(provider.findByAttribute("domain", "HR").isEmpty());
        assertTrue(provider.findByAttribute("no_such_field", "x").isEmpty());
    }

    // ==================== 写操作 ====================

    @Test
    void testRegister_FirstWins() {
        BusinessProcess payroll = BusinessProcess.of("hr_payroll", "Payroll", "HR");
        assertTrue(provider.register(payroll));
        assertFalse(provider.register(BusinessProcess.of("hr_payroll", "Other", "HR")));
        assertEquals("Payroll", provider.get("hr_payroll").orElseThrow().name());
        assertEquals(6, provider.size());
    }

    @Test
    void testUpsert_ReindexesSecondaryKeys() {
        BusinessProcess renamed = BusinessProcess.of("finance_expense_management", "Spend Control", "Finance");
        provider.upsert(renamed);

        assertSame(renamed, provider.get("Finance: Spend Control").orElseThrow());
        assertSame(renamed, provider.get("SPEND_CONTROL").orElseThrow());
        assertTrue(provider.get("EXPENSE_MANAGEMENT").isEmpty());
        assertTrue(provider.get("Finance: Expense Management").isEmpty());
        assertIndexConsistent();
    }

    @Test
    void testDelete_RemovesAllKeys() {
        assertTrue(provider.delete("finance_budget_vs_actuals"));
        assertFalse(provider.delete("finance_budget_vs_actuals"));
        assertTrue(provider.get("Finance: Budget vs. Actuals").isEmpty());
        assertEquals(4, provider.size());
        assertIndexConsistent();
    }

    @Test
    void testWrites_KeepIndexesConsistent() {
        assertIndexConsistent();
        provider.register(BusinessProcess.of("hr_payroll", "Payroll", "HR"));
        assertIndexConsistent();
        provider.upsert(BusinessProcess.of("hr_payroll", "Payroll Run", "HR"));
        assertIndexConsistent();
        assertTrue(provider.get("PAYROLL").isEmpty());
        provider.delete("finance_cash_flow_management");
        assertIndexConsistent();
        provider.reseed(List.of(BusinessProcess.of("ops_fulfilment", "Fulfilment", "Operations")));
        assertIndexConsistent();
    }

    private void assertIndexConsistent() {
        RegistryIndex<BusinessProcess> index = provider.index();
        // 二级索引 → 主索引
        for (String name : index.indexNames()) {
            for (Map.Entry<String, String> e : index.secondary(name).entrySet()) {
                assertTrue(index.contains(e.getValue()), name + " points to missing id " + e.getValue());
            }
        }
        // 主索引 → 二级索引，键由当前值推导
        for (IndexKey<BusinessProcess> key : index.keys()) {
            Map<String, String> secondary = index.secondary(key.name());
            for (BusinessProcess bp : index.values()) {
                Collection<String> values = key.keys().apply(bp);
                if (values == null) continue;
                for (String v : values) {
                    if (v == null || v.isBlank()) continue;
                    String k = key.caseInsensitive() ? v.toLowerCase(Locale.ROOT) : v;
                    assertEquals(bp.id(), secondary.get(k), key.name() + " is missing " + k);
                    assertEquals(bp, index.byId(secondary.get(k)));
                }
            }
        }
    }

    // ==================== 加载与回退 ====================

    @Test
    void testLoad_Idempotent() {
        provider.upsert(BusinessProcess.of("hr_payroll", "Payroll", "HR"));
        provider.load();
        assertEquals(6, provider.size());
        provider.reload();
        assertEquals(5, provider.size());
    }

    @Test
    void testLoad_FallsBackThroughChain() throws Exception {
        RegistrySource<BusinessProcess> broken = new RegistrySource<>() {
            @Override
            public String type() {
                return "broken";
            }

            @Override
            public List<BusinessProcess> loadAll() {
                throw new IllegalStateException("down");
            }
        };
        Path file = Files.writeString(dir.resolve("bp.yaml"), """
                business_processes:
                  - id: hr_payroll
                    name: Payroll
                    domain: HR
                """);
        BusinessProcessProvider chained = new BusinessProcessProvider(List.of(broken,
                new FileRegistrySource<>(file, DocumentLayout.wrapped("business_processes", DocumentLayout.list()),
                        BusinessProcessProvider.CODEC)), true);
        chained.load();
        assertEquals("file", chained.origin());
        assertEquals(List.of("hr_payroll"), chained.getAll().stream().map(BusinessProcess::id).toList());
    }

    @Test
    void testLoad_DefaultsWhenChainExhausted() {
        BusinessProcessProvider chained = new BusinessProcessProvider(List.of(
                new FileRegistrySource<>(dir.resolve("missing.yaml"), DocumentLayout.list(), BusinessProcessProvider.CODEC)),
                true);
        chained.load();
        assertTrue(chained.isLoaded());
        assertEquals(AbstractRegistryProvider.ORIGIN_DEFAULTS, chained.origin());
        assertEquals(5, chained.size());
    }

    @Test
    void testLoad_DefaultsDisabled() {
        BusinessProcessProvider strict = new BusinessProcessProvider(List.of(
                new FileRegistrySource<>(dir.resolve("missing.yaml"), DocumentLayout.list(), BusinessProcessProvider.CODEC)),
                false);
        assertThrows(RegistryLoadException.class, strict::load);
        assertFalse(strict.isLoaded());
        assertEquals(0, strict.size());
        assertFalse(strict.loadDefaults());
    }

    @Test
    void testLoad_EmptySourceIsValid() {
        BusinessProcessProvider empty = new BusinessProcessProvider(List.of(InMemorySource.of(List.of())), true);
        empty.load();
        assertEquals("memory", empty.origin());
        assertEquals(0, empty.size());
    }

    // ==================== 并发 ====================

    @Test
    void testConcurrentReadersSeeCompleteSnapshots() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(3);
        try {
            List<Future<?>> readers = new java.util.ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(pool.submit(() -> {
                    started.countDown();
                    while (!done.get()) {
                        BusinessProcess bp = provider.get("finance_cash_flow_management").orElseThrow();
                        // 通过旧名称或新名称查到的必须是同一快照中的实体
                        provider.get(bp.displayName()).ifPresent(same -> assertEquals(bp.id(), same.id()));
                    }
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 200; i++) {
                provider.upsert(BusinessProcess.of("finance_cash_flow_management", "Cash Flow " + i, "Finance"));
            }
            done.set(true);
            for (Future<?> f : readers) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            done.set(true);
            pool.shutdownNow();
        }
        assertEquals("Cash Flow 199", provider.get("finance_cash_flow_management").orElseThrow().name());
        assertIndexConsistent();
    }
}
