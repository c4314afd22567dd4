package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * All per-category metric records of one game. Any member may be null when the
 * analysis was assembled from projections alone.
 */
public record GameMetrics(
    @JsonProperty("homePitcher") PitchingMetrics homePitcher,
    @JsonProperty("awayPitcher") PitchingMetrics awayPitcher,
    @JsonProperty("homeOffense") OffenseMetrics homeOffense,
    @JsonProperty("awayOffense") OffenseMetrics awayOffense,
    @JsonProperty("homeDefense") DefenseMetrics homeDefense,
    @JsonProperty("awayDefense") DefenseMetrics awayDefense,
    @JsonProperty("homeBullpen") BullpenMetrics homeBullpen,
    @JsonProperty("awayBullpen") BullpenMetrics awayBullpen,
    @JsonProperty("homeContext") ContextRecord homeContext,
    @JsonProperty("awayContext") ContextRecord awayContext,
    @JsonProperty("headToHead")  HeadToHeadRecord headToHead
) {}
