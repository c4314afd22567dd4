package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Team offense metrics. Split OPS and recent run rate are null when unavailable.
 */
public record OffenseMetrics(
    @JsonProperty("team")        String team,
    @JsonProperty("games")       int games,
    @JsonProperty("runsPerGame") AdjustedStat runsPerGame,
    @JsonProperty("ops")         AdjustedStat ops,
    @JsonProperty("wrcPlus")     AdjustedStat wrcPlus,
    @JsonProperty("opsVsRight")  Double opsVsRight,
    @JsonProperty("opsVsLeft")   Double opsVsLeft,
    @JsonProperty("runsLast30")  Double runsLast30,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("flags")       List<String> flags
) implements MetricRecord {

    @Override
    public MetricCategory category() {
        return MetricCategory.OFFENSE;
    }

    public Double opsVs(Handedness pitcherHand) {
        return pitcherHand == Handedness.L ? opsVsLeft : opsVsRight;
    }
}
