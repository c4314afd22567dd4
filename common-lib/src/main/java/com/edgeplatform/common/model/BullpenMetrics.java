package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BullpenMetrics(
    @JsonProperty("team")           String team,
    @JsonProperty("inningsPitched") double inningsPitched,
    @JsonProperty("era")            AdjustedStat era,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("flags")          List<String> flags
) implements MetricRecord {

    @Override
    public MetricCategory category() {
        return MetricCategory.BULLPEN;
    }
}
