package com.edgeplatform.common.backtest;

import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays picks against historical games and summarizes performance.
 *
 * <p>Settlement of each pick is independent. Bankroll-path statistics (drawdown, final
 * bankroll) are computed over the settled results ordered by game date, input order breaking
 * ties, whatever order the results arrive in.
 */
public class BacktestEngine {

    public static final double DEFAULT_INITIAL_BANKROLL = 10_000.0;
    public static final int    BETS_PER_YEAR            = 250;

    private final double initialBankroll;

    public BacktestEngine() {
        this(DEFAULT_INITIAL_BANKROLL);
    }

    public BacktestEngine(double initialBankroll) {
        this.initialBankroll = initialBankroll;
    }

    public List<BacktestResult> run(List<HistoricalGame> games, List<Pick> picks) {
        Map<String, HistoricalGame> byId = new HashMap<>();
        for (HistoricalGame game : games) {
            byId.put(game.eventId(), game);
        }
        List<BacktestResult> results = new ArrayList<>(picks.size());
        for (Pick pick : picks) {
            results.add(settle(pick, byId.get(pick.eventId())));
        }
        return results;
    }

    /** Settles one pick. A pick that cannot be interpreted settles {@code UNKNOWN}, never throws. */
    public BacktestResult settle(Pick pick, HistoricalGame game) {
        double stake = pick.stake() != null ? pick.stake() : 0.0;
        double odds  = pick.odds() != null ? pick.odds() : 0.0;
        double edge  = pick.edge() != null ? pick.edge() : 0.0;
        LocalDate date = game != null && game.date() != null ? game.date() : pick.gameDate();

        SettlementOutcome outcome;
        try {
            outcome = SettlementMatcher.settle(pick, game);
        } catch (RuntimeException e) {
            outcome = SettlementOutcome.UNKNOWN;
        }
        double profit = SettlementMatcher.profit(outcome, stake, odds);
        double roi = stake > 0 ? profit / stake : 0.0;
        return new BacktestResult(pick.eventId(), date, pick.market(), pick.side(), odds, stake, edge,
            outcome, profit, roi);
    }

    public BacktestSummary summarize(List<BacktestResult> results) {
        List<BacktestResult> settled = inSettlementOrder(results);

        int wins = 0, losses = 0, pushes = 0;
        double totalStake = 0.0, totalProfit = 0.0, edgeSum = 0.0;
        Map<MarketType, int[]> counts = new EnumMap<>(MarketType.class);
        Map<MarketType, Double> profits = new EnumMap<>(MarketType.class);
        List<Double> returns = new ArrayList<>(settled.size());
        List<Double> bankroll = new ArrayList<>(settled.size() + 1);
        bankroll.add(initialBankroll);

        double running = initialBankroll;
        for (BacktestResult r : settled) {
            switch (r.outcome()) {
                case WIN  -> wins++;
                case LOSS -> losses++;
                default   -> pushes++;
            }
            totalStake  += r.stake();
            totalProfit += r.profit();
            edgeSum     += r.edge();
            returns.add(r.roi());
            running += r.profit();
            bankroll.add(running);

            if (r.market() != null) {
                int[] c = counts.computeIfAbsent(r.market(), m -> new int[4]);
                c[0]++;
                if (r.outcome() == SettlementOutcome.WIN) c[1]++;
                else if (r.outcome() == SettlementOutcome.LOSS) c[2]++;
                else c[3]++;
                profits.merge(r.market(), r.profit(), Double::sum);
            }
        }

        int decided = wins + losses;
        double winRate = decided > 0 ? (double) wins / decided : 0.0;
        double roi = totalStake > 0 ? totalProfit / totalStake : 0.0;
        double avgEdge = settled.isEmpty() ? 0.0 : edgeSum / settled.size();
        double edgeRealization = avgEdge > 0 ? roi / avgEdge : 0.0;

        Map<MarketType, MarketBreakdown> byMarket = new EnumMap<>(MarketType.class);
        counts.forEach((market, c) ->
            byMarket.put(market, new MarketBreakdown(c[0], c[1], c[2], c[3], profits.getOrDefault(market, 0.0))));

        return new BacktestSummary(settled.size(), wins, losses, pushes, results.size() - settled.size(),
            winRate, totalStake, totalProfit, roi, avgEdge, edgeRealization,
            maxDrawdown(bankroll), sharpeRatio(returns), initialBankroll, running, byMarket);
    }

    /**
     * Largest {@code (peak − trough) / peak} over a bankroll series, 0 for a non-decreasing one.
     */
    public static double maxDrawdown(List<Double> series) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDd = 0.0;
        for (double value : series) {
            if (value > peak) {
                peak = value;
            } else if (peak > 0) {
                maxDd = Math.max(maxDd, (peak - value) / peak);
            }
        }
        return maxDd;
    }

    /** Annualized mean/stddev of per-bet returns (population stddev). Null when undefined. */
    public static Double sharpeRatio(List<Double> returns) {
        if (returns.size() < 2) return null;
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).sum() / returns.size();
        double std = Math.sqrt(variance);
        if (std == 0.0) return null;
        return mean / std * Math.sqrt(BETS_PER_YEAR);
    }

    private static List<BacktestResult> inSettlementOrder(List<BacktestResult> results) {
        List<BacktestResult> settled = new ArrayList<>();
        for (BacktestResult r : results) {
            if (r.outcome() != null && r.outcome().isSettled()) settled.add(r);
        }
        // List.sort is stable, so input order breaks date ties.
        settled.sort(Comparator.comparing(BacktestResult::gameDate,
            Comparator.nullsLast(Comparator.naturalOrder())));
        return settled;
    }

    public double initialBankroll() {
        return initialBankroll;
    }
}
