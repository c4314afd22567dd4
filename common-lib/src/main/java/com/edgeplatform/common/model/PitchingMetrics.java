package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Starting pitcher metrics. {@code fip} is null when the source had no FIP.
 */
public record PitchingMetrics(
    @JsonProperty("name")           String name,
    @JsonProperty("throws")         Handedness throwsHand,
    @JsonProperty("inningsPitched") double inningsPitched,
    @JsonProperty("era")            AdjustedStat era,
    @JsonProperty("fip")            AdjustedStat fip,
    @JsonProperty("daysRest")       Integer daysRest,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("flags")          List<String> flags
) implements MetricRecord {

    @Override
    public MetricCategory category() {
        return MetricCategory.PITCHING;
    }
}
