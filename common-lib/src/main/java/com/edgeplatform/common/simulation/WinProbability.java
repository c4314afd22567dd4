package com.edgeplatform.common.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Monte Carlo estimate of the moneyline. Sampling error shrinks as {@code 1/sqrt(trials)}.
 */
public record WinProbability(
    @JsonProperty("homeWinProb") double homeWinProb,
    @JsonProperty("awayWinProb") double awayWinProb,
    @JsonProperty("trials")      int trials,
    @JsonProperty("meanRunDiff") double meanRunDiff
) {}
