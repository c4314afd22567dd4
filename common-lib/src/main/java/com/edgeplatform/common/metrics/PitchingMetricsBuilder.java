package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.AdjustedStat;
import com.edgeplatform.common.model.Handedness;
import com.edgeplatform.common.model.PitcherStatLine;
import com.edgeplatform.common.model.PitchingMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Builds {@link PitchingMetrics} for a probable starter.
 *
 * <h3>Confidence</h3>
 * <pre>
 *   unknown starter (TBD)         → 0.10, league ERA
 *   1.0 × low_sample (IP &lt; 25)  0.60
 *       × no_recent               0.85
 *       × no_fip                  0.90
 *       × fatigue (rest &lt; 4 d)  0.80
 *   floor 0.05
 * </pre>
 */
public final class PitchingMetricsBuilder {

    public static final String TBD        = "tbd";
    public static final String LOW_SAMPLE = "low_sample";
    public static final String NO_RECENT  = "no_recent";
    public static final String NO_FIP     = "no_fip";
    public static final String FATIGUE    = "fatigue";

    private static final double TBD_CONFIDENCE = 0.10;
    private static final double MIN_CONFIDENCE = 0.05;
    private static final Set<String> UNKNOWN_NAMES = Set.of("tbd", "probable", "unknown", "desconocido");

    private PitchingMetricsBuilder() {}

    public static PitchingMetrics build(PitcherStatLine line) {
        if (line == null || isUnknown(line.name())) {
            String name = line != null && line.name() != null && !line.name().isBlank() ? line.name() : "TBD";
            return new PitchingMetrics(name, Handedness.R, 0.0,
                AdjustedStat.priorOnly(LEAGUE_ERA), null, null, TBD_CONFIDENCE, List.of(TBD));
        }

        double ip  = line.inningsPitched() != null ? line.inningsPitched() : 0.0;
        double era = line.era() != null ? line.era() : LEAGUE_ERA;
        Handedness hand = line.throwsHand() != null ? line.throwsHand() : Handedness.R;

        List<String> flags = new ArrayList<>();
        double confidence = 1.0;
        if (ip < MIN_IP_CONFIDENT) {
            flags.add(LOW_SAMPLE);
            confidence *= 0.6;
        }
        if (line.recentInnings30d() == null) {
            flags.add(NO_RECENT);
            confidence *= 0.85;
        }
        if (line.fip() == null) {
            flags.add(NO_FIP);
            confidence *= 0.9;
        }
        if (line.daysRest() != null && line.daysRest() < FATIGUE_DAYS_REST) {
            flags.add(FATIGUE);
            confidence *= 0.8;
        }
        confidence = Math.max(MIN_CONFIDENCE, Math.min(confidence, 1.0));

        AdjustedStat eraStat = AdjustedStat.shrink(era, ip, LEAGUE_ERA, EB_IP);
        AdjustedStat fipStat = line.fip() != null
            ? AdjustedStat.shrink(line.fip(), ip, LEAGUE_FIP, EB_IP)
            : null;

        return new PitchingMetrics(line.name(), hand, ip, eraStat, fipStat, line.daysRest(),
            confidence, List.copyOf(flags));
    }

    static boolean isUnknown(String name) {
        return name == null || name.isBlank() || UNKNOWN_NAMES.contains(name.trim().toLowerCase(Locale.ROOT));
    }
}
