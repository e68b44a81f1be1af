package com.ddm.metis.defined;

import com.ddm.metis.utils.Identifiers;
import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 角色（principal）画像：关注的业务流程与 KPI、默认过滤条件以及呈现偏好。
 *
 * @author metis
 * @since 1.0
 */
public record PrincipalProfile(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("title") String title,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("business_processes") List<String> businessProcesses,
        @JsonProperty("kpis") List<String> kpis,
        @JsonProperty("responsibilities") List<String> responsibilities,
        @JsonProperty("default_filters") Map<String, List<String>> defaultFilters,
        @JsonProperty("time_frame") TimeFrame timeFrame,
        @JsonProperty("communication") CommunicationPreference communication,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata) implements RegistryEntity {

    public PrincipalProfile {
        if (Identifiers.isBlank(id)) {
            throw new IllegalArgumentException("PrincipalProfile id must not be blank");
        }
        name = Values.orDefault(name, Identifiers.humanize(id));
        businessProcesses = Values.list(businessProcesses);
        kpis = Values.list(kpis);
        responsibilities = Values.list(responsibilities);
        defaultFilters = Values.map(defaultFilters);
        timeFrame = Values.orDefault(timeFrame, TimeFrame.DEFAULT);
        communication = Values.orDefault(communication, CommunicationPreference.DEFAULT);
        tags = Values.list(tags);
        metadata = Values.map(metadata);
    }

    /** 以 title 作为展示名称。 */
    @Override
    public String displayName() {
        return title;
    }
}
