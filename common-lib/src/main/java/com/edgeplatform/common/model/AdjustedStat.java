package com.edgeplatform.common.model;

import com.edgeplatform.common.shrinkage.ShrinkageEstimator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One observed rate statistic with its sample volume, league prior and shrunk value.
 */
public record AdjustedStat(
    @JsonProperty("observed")   double observed,
    @JsonProperty("sampleSize") double sampleSize,
    @JsonProperty("prior")      double prior,
    @JsonProperty("adjusted")   double adjusted
) {
    public static AdjustedStat shrink(double observed, double sampleSize, double prior, double priorWeight) {
        return new AdjustedStat(observed, sampleSize, prior,
            ShrinkageEstimator.adjust(observed, sampleSize, prior, priorWeight));
    }

    /** No observation: the prior stands in for the observed and adjusted value. */
    public static AdjustedStat priorOnly(double prior) {
        return new AdjustedStat(prior, 0.0, prior, prior);
    }
}
