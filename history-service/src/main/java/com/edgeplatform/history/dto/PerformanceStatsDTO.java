package com.edgeplatform.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate pick performance. {@code market} is null for the all-markets view.
 * Win rate excludes pushes; ROI is profit over the stake of settled picks.
 */
public record PerformanceStatsDTO(
    @JsonProperty("market")        String market,
    @JsonProperty("totalPicks")    long totalPicks,
    @JsonProperty("settled")       long settled,
    @JsonProperty("wins")          long wins,
    @JsonProperty("losses")        long losses,
    @JsonProperty("pushes")        long pushes,
    @JsonProperty("pending")       long pending,
    @JsonProperty("winRate")       double winRate,
    @JsonProperty("totalStake")    double totalStake,
    @JsonProperty("totalProfit")   double totalProfit,
    @JsonProperty("roi")           double roi,
    @JsonProperty("avgEdge")       double avgEdge,
    @JsonProperty("avgConfidence") double avgConfidence,
    @JsonProperty("avgOdds")       double avgOdds
) {}
