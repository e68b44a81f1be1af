package com.ddm.metis.defined;

import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 分析时间窗口偏好，缺省为 {@code YTD}、回看 4 期、前瞻 2 期。
 *
 * @author metis
 * @since 1.0
 */
public record TimeFrame(
        @JsonProperty("default_period") String defaultPeriod,
        @JsonProperty("historical_periods") Integer historicalPeriods,
        @JsonProperty("forward_looking_periods") Integer forwardLookingPeriods) {

    public static final TimeFrame DEFAULT = new TimeFrame(null, null, null);

    public TimeFrame {
        defaultPeriod = Values.orDefault(defaultPeriod, "YTD");
        historicalPeriods = Values.orDefault(historicalPeriods, 4);
        forwardLookingPeriods = Values.orDefault(forwardLookingPeriods, 2);
    }
}
