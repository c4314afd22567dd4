package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.AdjustedStat;
import com.edgeplatform.common.model.OffenseMetrics;
import com.edgeplatform.common.model.OffenseStatLine;

import java.util.ArrayList;
import java.util.List;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Builds {@link OffenseMetrics}. Runs per game, OPS and wRC+ are shrunk toward the league
 * with a full season (162 games) of prior weight. wRC+ is always an OPS proxy.
 *
 * <pre>
 *   unresolved team → 0.40, league defaults
 *   1.0 × low_sample (G &lt; 40) 0.80 × no_recent 0.90 × no_splits 0.92 × wrc_proxy 0.90
 *   floor 0.40
 * </pre>
 */
public final class OffenseMetricsBuilder {

    public static final String NO_TEAM    = "no_team_id";
    public static final String LOW_SAMPLE = "low_sample";
    public static final String NO_RECENT  = "no_recent";
    public static final String NO_SPLITS  = "no_splits";
    public static final String WRC_PROXY  = "wrc_proxy";

    private static final double MIN_CONFIDENCE = 0.4;

    private OffenseMetricsBuilder() {}

    public static OffenseMetrics build(String team, OffenseStatLine line) {
        if (line == null || line.gamesPlayed() == null) {
            return new OffenseMetrics(team, 0,
                AdjustedStat.priorOnly(LEAGUE_RPG), AdjustedStat.priorOnly(LEAGUE_OPS),
                AdjustedStat.priorOnly(LEAGUE_WRC_PLUS), null, null, null,
                MIN_CONFIDENCE, List.of(NO_TEAM));
        }

        int games  = line.gamesPlayed();
        double rpg = line.runsPerGame() != null ? line.runsPerGame() : LEAGUE_RPG;
        double ops = line.ops() != null ? line.ops() : LEAGUE_OPS;
        double wrcPlus = ops / LEAGUE_OPS * 100.0;

        List<String> flags = new ArrayList<>();
        double confidence = 1.0;
        if (games < MIN_GAMES_CONFIDENT) {
            flags.add(LOW_SAMPLE);
            confidence *= 0.8;
        }
        if (line.runsLast14() == null && line.runsLast30() == null) {
            flags.add(NO_RECENT);
            confidence *= 0.9;
        }
        if (line.opsVsRight() == null && line.opsVsLeft() == null) {
            flags.add(NO_SPLITS);
            confidence *= 0.92;
        }
        flags.add(WRC_PROXY);
        confidence *= 0.9;
        confidence = Math.max(MIN_CONFIDENCE, Math.min(confidence, 1.0));

        return new OffenseMetrics(team, games,
            AdjustedStat.shrink(rpg, games, LEAGUE_RPG, EB_GAMES),
            AdjustedStat.shrink(ops, games, LEAGUE_OPS, EB_GAMES),
            AdjustedStat.shrink(wrcPlus, games, LEAGUE_WRC_PLUS, EB_GAMES),
            line.opsVsRight(), line.opsVsLeft(), line.runsLast30(),
            confidence, List.copyOf(flags));
    }
}
