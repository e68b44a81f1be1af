package com.ddm.metis.defined;

import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 信息呈现偏好。
 *
 * @author metis
 * @since 1.0
 */
public record CommunicationPreference(
        @JsonProperty("detail_level") String detailLevel,
        @JsonProperty("format_preference") List<String> formatPreference,
        @JsonProperty("emphasis") List<String> emphasis) {

    public static final CommunicationPreference DEFAULT = new CommunicationPreference(null, null, null);

    public CommunicationPreference {
        detailLevel = Values.orDefault(detailLevel, "medium");
        formatPreference = formatPreference == null ? List.of("visual", "text") : Values.list(formatPreference);
        emphasis = emphasis == null ? List.of("trends", "anomalies") : Values.list(emphasis);
    }
}
