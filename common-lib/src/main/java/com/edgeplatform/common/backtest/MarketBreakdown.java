package com.edgeplatform.common.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MarketBreakdown(
    @JsonProperty("bets")   int bets,
    @JsonProperty("wins")   int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("pushes") int pushes,
    @JsonProperty("profit") double profit
) {}
