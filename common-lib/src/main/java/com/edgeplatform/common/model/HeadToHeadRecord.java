package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Head-to-head record from the home team's perspective.
 */
public record HeadToHeadRecord(
    @JsonProperty("totalGames")      int totalGames,
    @JsonProperty("winRate")         double winRate,
    @JsonProperty("winRateWeighted") double winRateWeighted,
    @JsonProperty("marginWeighted")  double marginWeighted,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("flags")           List<String> flags
) implements MetricRecord {

    @Override
    public MetricCategory category() {
        return MetricCategory.HEAD_TO_HEAD;
    }
}
