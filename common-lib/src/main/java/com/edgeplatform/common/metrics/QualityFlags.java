package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.GameMetrics;
import com.edgeplatform.common.model.MetricRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates metric-level flags into the upper-case analysis flags consumed by the moneyline
 * data-quality penalty and the pick validator (e.g. {@code LOW_SAMPLE_PITCHER_HOME},
 * {@code NO_H2H_DATA}).
 */
public final class QualityFlags {

    private QualityFlags() {}

    public static List<String> collect(GameMetrics metrics) {
        List<String> out = new ArrayList<>();
        if (metrics == null) return out;

        pitcher(out, metrics.homePitcher(), "HOME");
        pitcher(out, metrics.awayPitcher(), "AWAY");
        offense(out, metrics.homeOffense(), "HOME");
        offense(out, metrics.awayOffense(), "AWAY");
        defense(out, metrics.homeDefense(), "HOME");
        defense(out, metrics.awayDefense(), "AWAY");
        bullpen(out, metrics.homeBullpen(), "HOME");
        bullpen(out, metrics.awayBullpen(), "AWAY");

        MetricRecord h2h = metrics.headToHead();
        if (h2h != null) {
            if (h2h.hasFlag(HeadToHeadBuilder.NO_DATA))         out.add("NO_H2H_DATA");
            if (h2h.hasFlag(HeadToHeadBuilder.VERY_LOW_SAMPLE)) out.add("LOW_SAMPLE_H2H");
        }
        return out;
    }

    private static void pitcher(List<String> out, MetricRecord m, String side) {
        if (m == null) return;
        if (m.hasFlag(PitchingMetricsBuilder.TBD))        out.add("TBD_PITCHER_" + side);
        if (m.hasFlag(PitchingMetricsBuilder.LOW_SAMPLE)) out.add("LOW_SAMPLE_PITCHER_" + side);
        if (m.hasFlag(PitchingMetricsBuilder.FATIGUE))    out.add("FATIGUE_PITCHER_" + side);
    }

    private static void offense(List<String> out, MetricRecord m, String side) {
        if (m == null) return;
        if (m.hasFlag(OffenseMetricsBuilder.LOW_SAMPLE)) out.add("LOW_SAMPLE_OFFENSE_" + side);
        if (m.hasFlag(OffenseMetricsBuilder.NO_RECENT))  out.add("NO_RECENT_OFFENSE_" + side);
        if (m.hasFlag(OffenseMetricsBuilder.NO_SPLITS))  out.add("NO_SPLITS_OFFENSE_" + side);
    }

    private static void defense(List<String> out, MetricRecord m, String side) {
        if (m == null) return;
        if (m.hasFlag(DefenseMetricsBuilder.NO_RECENT)) out.add("NO_DEF_RECENT_" + side);
    }

    private static void bullpen(List<String> out, MetricRecord m, String side) {
        if (m == null) return;
        if (m.hasFlag(BullpenMetricsBuilder.NO_DATA))    out.add("NO_BULLPEN_DATA_" + side);
        if (m.hasFlag(BullpenMetricsBuilder.LOW_SAMPLE)) out.add("LOW_SAMPLE_BULLPEN_" + side);
    }
}
