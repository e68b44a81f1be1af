package com.ddm.metis.defined;

import com.ddm.metis.utils.Identifiers;
import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 业务术语：规范名称、同义词以及"系统名 → 技术字段名"映射。
 *
 * <p>未给出 id 时由名称推导（小写、空格与连字符替换为下划线）。
 *
 * @author metis
 * @since 1.0
 */
public record BusinessTerm(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("synonyms") List<String> synonyms,
        @JsonProperty("technical_mappings") Map<String, String> technicalMappings,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata) implements RegistryEntity {

    public BusinessTerm {
        if (Identifiers.isBlank(name) && Identifiers.isBlank(id)) {
            throw new IllegalArgumentException("BusinessTerm requires a name or an id");
        }
        name = Values.orDefault(name, Identifiers.humanize(id));
        id = Values.orDefault(id, Identifiers.slug(name));
        synonyms = Values.list(synonyms);
        technicalMappings = Values.map(technicalMappings);
        tags = Values.list(tags);
        metadata = Values.map(metadata);
    }

    public static BusinessTerm of(String name, List<String> synonyms, String description,
                                  Map<String, String> technicalMappings) {
        return new BusinessTerm(null, name, null, description, synonyms, technicalMappings, null, null);
    }

    public Optional<String> technicalName(String system) {
        return Optional.ofNullable(technicalMappings.get(system));
    }
}
