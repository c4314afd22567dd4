package com.edgeplatform.common.backtest;

import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.PickSide;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** Settlement of one pick. {@code roi} is profit / stake, 0 for a zero stake. */
public record BacktestResult(
    @JsonProperty("eventId")  String eventId,
    @JsonProperty("gameDate") LocalDate gameDate,
    @JsonProperty("market")   MarketType market,
    @JsonProperty("side")     PickSide side,
    @JsonProperty("odds")     double odds,
    @JsonProperty("stake")    double stake,
    @JsonProperty("edge")     double edge,
    @JsonProperty("outcome")  SettlementOutcome outcome,
    @JsonProperty("profit")   double profit,
    @JsonProperty("roi")      double roi
) {}
