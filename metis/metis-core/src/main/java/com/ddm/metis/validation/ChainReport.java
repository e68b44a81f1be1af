package com.ddm.metis.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 引用链校验结果。
 *
 * @param checked 参与校验的引用数
 * @param dangling 无法解析的引用
 * @author metis
 * @since 1.0
 */
public record ChainReport(int checked, List<DanglingReference> dangling) {

    /**
     * 一条无法解析的引用，如 {@code principal_profile:cfo_001 -> business_process:finance_unknown}。
     */
    public record DanglingReference(String sourceRegistry, String sourceId, String targetRegistry, String reference) {

        @Override
        public String toString() {
            return sourceRegistry + ":" + sourceId + " -> " + targetRegistry + ":" + reference;
        }
    }

    public ChainReport {
        dangling = List.copyOf(dangling);
    }

    public boolean isValid() {
        return dangling.isEmpty();
    }

    public List<DanglingReference> from(String sourceRegistry) {
        return dangling.stream().filter(d -> d.sourceRegistry().equals(sourceRegistry)).toList();
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "ChainReport{checked=" + checked + ", valid}";
        }
        return dangling.stream().map(DanglingReference::toString)
                .collect(Collectors.joining(", ", "ChainReport{checked=" + checked + ", dangling=[", "]}"));
    }
}
