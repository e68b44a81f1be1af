package com.ddm.metis.provider;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.BusinessTerm;
import com.ddm.metis.source.RegistrySource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 业务术语表：按名称或同义词（均不区分大小写）解析术语，并翻译为目标系统的技术字段名。
 *
 * <pre>{@code
 * glossary.term("sales");                          // → Revenue
 * glossary.technicalMapping("income", "sap");       // → Optional[REVENUE]
 * glossary.translate(List.of("Sales", "foo"), "duckdb");
 * }</pre>
 *
 * @author metis
 * @since 1.0
 */
public class BusinessGlossaryProvider extends AbstractRegistryProvider<BusinessTerm> {

    public static final String NAME = "business_glossary";

    public static final String DEFAULT_SYSTEM = "duckdb";

    public static final EntityCodec<BusinessTerm> CODEC =
            new EntityCodec<>(BusinessTerm.class, List.of("id", "name", "domain"));

    public BusinessGlossaryProvider() {
        this(List.of(), true);
    }

    public BusinessGlossaryProvider(List<RegistrySource<BusinessTerm>> sources, boolean defaultsEnabled) {
        super(NAME, CODEC, sources, defaultsEnabled,
                List.of(IndexKey.<BusinessTerm>ignoreCase("synonym", BusinessTerm::synonyms)));
    }

    /**
     * 按名称或同义词查找术语。
     */
    public Optional<BusinessTerm> term(String nameOrSynonym) {
        return get(nameOrSynonym);
    }

    public Optional<String> technicalMapping(String term, String system) {
        String sys = (system == null ? DEFAULT_SYSTEM : system).toLowerCase(Locale.ROOT);
        return term(term).flatMap(t -> t.technicalName(sys));
    }

    public Optional<String> technicalMapping(String term) {
        return technicalMapping(term, DEFAULT_SYSTEM);
    }

    /**
     * 批量翻译，结果按输入顺序以原始术语为键。
     */
    public Map<String, TermTranslation> translate(List<String> terms, String system) {
        Map<String, TermTranslation> results = new LinkedHashMap<>();
        for (String raw : terms) {
            Optional<BusinessTerm> term = term(raw);
            String technical = term.flatMap(t -> t.technicalName(
                    (system == null ? DEFAULT_SYSTEM : system).toLowerCase(Locale.ROOT))).orElse(null);
            String canonical = term.map(t -> t.name().toLowerCase(Locale.ROOT)).orElse(null);
            results.put(raw, new TermTranslation(technical != null, technical, canonical));
        }
        return results;
    }

    @Override
    protected List<BusinessTerm> defaults() {
        return List.of(
                BusinessTerm.of("Revenue", List.of("sales", "income", "turnover"),
                        "Total income generated from sales",
                        Map.of("sap", "REVENUE", "duckdb", "revenue")),
                BusinessTerm.of("Profit Margin", List.of("margin", "profit percentage"),
                        "Percentage of profit relative to revenue",
                        Map.of("sap", "PROFIT_MARGIN", "duckdb", "profit_margin")));
    }
}
