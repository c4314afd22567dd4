package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Totals market: the run line and Over/Under prices in either convention. */
public record TotalsOdds(
    @JsonProperty("line")      Double line,
    @JsonProperty("oddsOver")  Number oddsOver,
    @JsonProperty("oddsUnder") Number oddsUnder
) {}
