package com.edgeplatform.common.model;

import com.edgeplatform.common.projection.RunProjectionModel;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decomposition of one team's expected runs for one game.
 *
 * <pre>
 *   mu = max(MIN_RUNS,
 *            base × split × recent × pitcher × defense × park + weather − fatigue + h2h)
 * </pre>
 */
public record ProjectionBreakdown(
    @JsonProperty("baseRunsPerGame") double baseRunsPerGame,
    @JsonProperty("splitFactor")     double splitFactor,
    @JsonProperty("recentFactor")    double recentFactor,
    @JsonProperty("pitcherFactor")   double pitcherFactor,
    @JsonProperty("defenseFactor")   double defenseFactor,
    @JsonProperty("parkFactor")      double parkFactor,
    @JsonProperty("weatherDelta")    double weatherDelta,
    @JsonProperty("fatiguePenalty")  double fatiguePenalty,
    @JsonProperty("headToHeadDelta") double headToHeadDelta,
    @JsonProperty("mu")              double mu,
    @JsonProperty("confidence")      double confidence
) {
    /** A projection supplied directly (no decomposition), all factors neutral, floored at {@code MIN_RUNS}. */
    public static ProjectionBreakdown of(double mu, double confidence) {
        double floored = Math.max(mu, RunProjectionModel.MIN_RUNS);
        return new ProjectionBreakdown(floored, 1.0, 1.0, 1.0, 1.0, 1.0, 0.0, 0.0, 0.0, floored, confidence);
    }
}
