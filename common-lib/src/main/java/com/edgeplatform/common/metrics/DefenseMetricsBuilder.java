package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.AdjustedStat;
import com.edgeplatform.common.model.DefenseMetrics;
import com.edgeplatform.common.model.DefenseStatLine;

import java.util.ArrayList;
import java.util.List;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Builds {@link DefenseMetrics}: fielding percentage and errors per game shrunk toward the league.
 * Confidence: low_sample 0.85, no_recent 0.92, no_der 0.97, floor 0.50.
 */
public final class DefenseMetricsBuilder {

    public static final String NO_SEASON_DATA = "no_season_data";
    public static final String LOW_SAMPLE     = "low_sample";
    public static final String NO_RECENT      = "no_recent";
    public static final String NO_DER         = "no_der";

    private static final double MIN_CONFIDENCE = 0.5;

    private DefenseMetricsBuilder() {}

    public static DefenseMetrics build(String team, DefenseStatLine line) {
        if (line == null || line.gamesPlayed() == null || line.gamesPlayed() <= 0) {
            return new DefenseMetrics(team, 0,
                AdjustedStat.priorOnly(LEAGUE_FPCT), AdjustedStat.priorOnly(LEAGUE_ERRORS_PER_GAME),
                MIN_CONFIDENCE, List.of(NO_SEASON_DATA));
        }

        int games = line.gamesPlayed();
        double fpct = line.fieldingPct() != null ? line.fieldingPct() : LEAGUE_FPCT;
        double errorsPerGame = line.errors() != null ? (double) line.errors() / games : LEAGUE_ERRORS_PER_GAME;

        List<String> flags = new ArrayList<>();
        double confidence = 1.0;
        if (games < MIN_GAMES_CONFIDENT) {
            flags.add(LOW_SAMPLE);
            confidence *= 0.85;
        }
        if (line.recentErrors() == null) {
            flags.add(NO_RECENT);
            confidence *= 0.92;
        }
        if (line.der() == null) {
            flags.add(NO_DER);
            confidence *= 0.97;
        }
        confidence = Math.max(MIN_CONFIDENCE, Math.min(confidence, 1.0));

        return new DefenseMetrics(team, games,
            AdjustedStat.shrink(fpct, games, LEAGUE_FPCT, EB_GAMES),
            AdjustedStat.shrink(errorsPerGame, games, LEAGUE_ERRORS_PER_GAME, EB_GAMES),
            confidence, List.copyOf(flags));
    }
}
