package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-team, per-game environment: park, weather and schedule fatigue.
 * Built for a single date and never reused across dates.
 */
public record ContextRecord(
    @JsonProperty("team")            String team,
    @JsonProperty("parkFactor")      double parkFactor,
    @JsonProperty("weatherRunDelta") double weatherRunDelta,
    @JsonProperty("fatiguePenalty")  double fatiguePenalty,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("flags")           List<String> flags
) implements MetricRecord {

    public static ContextRecord neutral(String team) {
        return new ContextRecord(team, 1.0, 0.0, 0.0, 0.0, List.of());
    }

    @Override
    public MetricCategory category() {
        return MetricCategory.CONTEXT;
    }
}
