package com.ddm.metis.validation;

import com.ddm.metis.defined.DataProduct;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.defined.PrincipalProfile;
import com.ddm.metis.factory.RegistryContext;
import com.ddm.metis.provider.BusinessProcessProvider;
import com.ddm.metis.provider.DataProductProvider;
import com.ddm.metis.provider.KpiProvider;
import com.ddm.metis.provider.PrincipalProfileProvider;
import com.ddm.metis.provider.RegistryProvider;
import com.ddm.metis.utils.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 离线校验注册表之间的引用链：
 * 画像 → 业务流程、画像 → KPI、KPI → 业务流程、KPI → 数据产品、数据产品 → 业务流程。
 *
 * <p>引用按各 Provider 的完整查找顺序解析（id、legacy id、显示名称、忽略大小写）。只读，不修改任何注册表。
 *
 * @author metis
 * @since 1.0
 */
public class RegistryChainValidator {

    private static final Logger log = LoggerFactory.getLogger(RegistryChainValidator.class);

    public ChainReport validate(RegistryContext registry) {
        Collector c = new Collector();
        BusinessProcessProvider processes = registry.businessProcesses();
        KpiProvider kpis = registry.kpis();
        DataProductProvider products = registry.dataProducts();

        for (PrincipalProfile p : registry.principals().getAll()) {
            c.check(PrincipalProfileProvider.NAME, p.id(), processes, p.businessProcesses());
            c.check(PrincipalProfileProvider.NAME, p.id(), kpis, p.kpis());
        }
        for (Kpi k : kpis.getAll()) {
            c.check(KpiProvider.NAME, k.id(), processes, k.businessProcessIds());
            if (!Identifiers.isBlank(k.dataProductId())) {
                c.check(KpiProvider.NAME, k.id(), products, List.of(k.dataProductId()));
            }
        }
        for (DataProduct d : products.getAll()) {
            c.check(DataProductProvider.NAME, d.id(), processes, d.relatedBusinessProcesses());
        }

        ChainReport report = new ChainReport(c.checked, c.dangling);
        if (report.isValid()) {
            log.info("Registry chain valid, {} references checked", report.checked());
        } else {
            log.warn("Registry chain has {} dangling references: {}", report.dangling().size(), report.dangling());
        }
        return report;
    }

    private static final class Collector {
        private int checked;
        private final List<ChainReport.DanglingReference> dangling = new ArrayList<>();

        void check(String sourceRegistry, String sourceId, RegistryProvider<?> target, List<String> refs) {
            for (String ref : refs) {
                checked++;
                if (target.get(ref).isEmpty()) {
                    dangling.add(new ChainReport.DanglingReference(sourceRegistry, sourceId, target.name(), ref));
                }
            }
        }
    }
}
