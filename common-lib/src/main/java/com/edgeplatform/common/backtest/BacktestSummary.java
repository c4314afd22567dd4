package com.edgeplatform.common.backtest;

import com.edgeplatform.common.model.MarketType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate performance of a batch of settled picks.
 *
 * @param winRate         wins / (wins + losses); pushes and pending excluded
 * @param roi             totalProfit / totalStake
 * @param edgeRealization roi / avgEdge, 0 when the average edge is not positive
 * @param maxDrawdown     largest peak-to-trough fractional decline of the running bankroll
 * @param sharpeRatio     mean/stddev of per-bet ROI × √250; null with fewer than 2 bets or zero variance
 */
public record BacktestSummary(
    @JsonProperty("totalBets")       int totalBets,
    @JsonProperty("wins")            int wins,
    @JsonProperty("losses")          int losses,
    @JsonProperty("pushes")          int pushes,
    @JsonProperty("pending")         int pending,
    @JsonProperty("winRate")         double winRate,
    @JsonProperty("totalStake")      double totalStake,
    @JsonProperty("totalProfit")     double totalProfit,
    @JsonProperty("roi")             double roi,
    @JsonProperty("avgEdge")         double avgEdge,
    @JsonProperty("edgeRealization") double edgeRealization,
    @JsonProperty("maxDrawdown")     double maxDrawdown,
    @JsonProperty("sharpeRatio")     Double sharpeRatio,
    @JsonProperty("initialBankroll") double initialBankroll,
    @JsonProperty("finalBankroll")   double finalBankroll,
    @JsonProperty("byMarket")        Map<MarketType, MarketBreakdown> byMarket
) {}
