package com.edgeplatform.common.backtest;

import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.Pick;

/**
 * Market-specific settlement rules.
 *
 * <pre>
 *   moneyline: picked side scored more → WIN, fewer → LOSS, level → PUSH
 *   total:     OVER wins above the line, UNDER below, exactly on the line → PUSH
 *   profit:    WIN stake·(odds − 1), LOSS −stake, otherwise 0
 * </pre>
 */
public final class SettlementMatcher {

    private SettlementMatcher() {}

    public static SettlementOutcome settle(Pick pick, HistoricalGame game) {
        if (game == null || !game.isFinal()) {
            return SettlementOutcome.PENDING;
        }
        if (pick.market() == null || pick.side() == null) {
            return SettlementOutcome.UNKNOWN;
        }
        return switch (pick.market()) {
            case MONEYLINE -> moneyline(pick, game);
            case TOTAL     -> total(pick, game);
            default        -> SettlementOutcome.UNKNOWN;
        };
    }

    public static double profit(SettlementOutcome outcome, double stake, double decimalOdds) {
        return switch (outcome) {
            case WIN  -> stake * (decimalOdds - 1.0);
            case LOSS -> -stake;
            default   -> 0.0;
        };
    }

    private static SettlementOutcome moneyline(Pick pick, HistoricalGame game) {
        int home = game.homeScore();
        int away = game.awayScore();
        if (home == away) return SettlementOutcome.PUSH;
        return switch (pick.side()) {
            case HOME -> home > away ? SettlementOutcome.WIN : SettlementOutcome.LOSS;
            case AWAY -> away > home ? SettlementOutcome.WIN : SettlementOutcome.LOSS;
            default   -> SettlementOutcome.UNKNOWN;
        };
    }

    private static SettlementOutcome total(Pick pick, HistoricalGame game) {
        if (pick.line() == null) return SettlementOutcome.UNKNOWN;
        double runs = game.totalRuns();
        double line = pick.line();
        if (runs == line) return SettlementOutcome.PUSH;
        return switch (pick.side()) {
            case OVER  -> runs > line ? SettlementOutcome.WIN : SettlementOutcome.LOSS;
            case UNDER -> runs < line ? SettlementOutcome.WIN : SettlementOutcome.LOSS;
            default    -> SettlementOutcome.UNKNOWN;
        };
    }
}
