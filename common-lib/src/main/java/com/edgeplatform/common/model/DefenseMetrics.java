package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DefenseMetrics(
    @JsonProperty("team")          String team,
    @JsonProperty("games")         int games,
    @JsonProperty("fieldingPct")   AdjustedStat fieldingPct,
    @JsonProperty("errorsPerGame") AdjustedStat errorsPerGame,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("flags")         List<String> flags
) implements MetricRecord {

    @Override
    public MetricCategory category() {
        return MetricCategory.DEFENSE;
    }
}
