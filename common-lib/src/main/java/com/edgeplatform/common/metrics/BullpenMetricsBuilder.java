package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.AdjustedStat;
import com.edgeplatform.common.model.BullpenMetrics;
import com.edgeplatform.common.model.BullpenStatLine;

import java.util.ArrayList;
import java.util.List;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Builds {@link BullpenMetrics}. Without a reliever-only line the bullpen is estimated from the
 * team pitching line (40% of team innings).
 *
 * <pre>
 *   no data → 0.30, league bullpen ERA
 *   1.0 × team_estimate 0.85 × low_sample (IP &lt; 30) 0.80 × no_high_leverage 0.95 × no_recent 0.92
 *   floor 0.30
 * </pre>
 */
public final class BullpenMetricsBuilder {

    public static final String NO_DATA          = "no_data";
    public static final String TEAM_ESTIMATE    = "team_estimate";
    public static final String LOW_SAMPLE       = "low_sample";
    public static final String NO_HIGH_LEVERAGE = "no_high_leverage";
    public static final String NO_RECENT        = "no_recent";

    private static final double MIN_CONFIDENCE = 0.30;

    private BullpenMetricsBuilder() {}

    public static BullpenMetrics build(String team, BullpenStatLine line) {
        boolean direct   = line != null && line.inningsPitched() != null && line.era() != null;
        boolean estimate = !direct && line != null && line.teamInningsPitched() != null;
        if (!direct && !estimate) {
            return new BullpenMetrics(team, 0.0, AdjustedStat.priorOnly(LEAGUE_BULLPEN_ERA),
                MIN_CONFIDENCE, List.of(TEAM_ESTIMATE, NO_DATA));
        }

        double ip;
        double era;
        if (direct) {
            ip  = line.inningsPitched();
            era = line.era();
        } else {
            ip  = line.teamInningsPitched() * BULLPEN_SHARE_OF_TEAM_IP;
            era = line.era() != null ? line.era()
                : line.teamEra() != null ? line.teamEra() : LEAGUE_BULLPEN_ERA;
        }

        List<String> flags = new ArrayList<>();
        double confidence = 1.0;
        if (estimate) {
            flags.add(TEAM_ESTIMATE);
            confidence *= 0.85;
        }
        if (ip < MIN_BULLPEN_IP) {
            flags.add(LOW_SAMPLE);
            confidence *= 0.80;
        }
        if (!line.highLeverageAvailable()) {
            flags.add(NO_HIGH_LEVERAGE);
            confidence *= 0.95;
        }
        if (!line.recentAvailable()) {
            flags.add(NO_RECENT);
            confidence *= 0.92;
        }
        confidence = Math.max(MIN_CONFIDENCE, Math.min(confidence, 1.0));

        return new BullpenMetrics(team, ip, AdjustedStat.shrink(era, ip, LEAGUE_BULLPEN_ERA, EB_IP),
            confidence, List.copyOf(flags));
    }
}
