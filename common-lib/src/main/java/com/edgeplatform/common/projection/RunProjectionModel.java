package com.edgeplatform.common.projection;

import com.edgeplatform.common.model.ContextRecord;
import com.edgeplatform.common.model.DefenseMetrics;
import com.edgeplatform.common.model.Handedness;
import com.edgeplatform.common.model.HeadToHeadRecord;
import com.edgeplatform.common.model.MetricRecord;
import com.edgeplatform.common.model.OffenseMetrics;
import com.edgeplatform.common.model.PitchingMetrics;
import com.edgeplatform.common.model.ProjectionBreakdown;

import static com.edgeplatform.common.league.MlbConstants.*;

/**
 * Expected runs for one team in one game.
 *
 * <h3>Formula</h3>
 * <pre>
 *   mu  = base runs/game (shrunk)
 *       × split    = clamp(0.6·opsVsHand/lgOPS + 0.4·teamOPS/lgOPS, 0.6, 1.4)
 *       × recent   = clamp(1 + 0.2·(runs30/base − 1), 0.7, 1.3)
 *       × pitcher  = clamp((oppERAadj / lgERA)^1.0, 0.6, 1.7)
 *       × defense  = clamp(1 + 0.25·(oppErrPG − 0.55), 0.8, 1.2)
 *       × park
 *       + weather − fatigue ± (h2hWinRate − 0.5)·0.05·h2hConf
 *   mu ≥ 0.1
 *
 *   confidence = clamp(0.4·off + 0.4·pit + 0.1·def + 0.05·ctx + 0.05·h2h, 0.2, 1.0)
 * </pre>
 * Any missing input is neutral (factor 1.0, delta 0.0) and drops out of the confidence sum.
 */
public final class RunProjectionModel {

    public static final double MIN_RUNS = 0.1;

    private static final double ALPHA_PITCHER    = 1.0;
    private static final double BETA_DEFENSE     = 0.25;
    private static final double GAMMA_H2H        = 0.05;
    private static final double WEIGHT_SPLIT     = 0.60;
    private static final double WEIGHT_RECENT_30 = 0.20;

    private RunProjectionModel() {}

    public static ProjectionBreakdown projectTeam(OffenseMetrics offense, PitchingMetrics opposingPitcher,
                                                  DefenseMetrics opposingDefense, ContextRecord context,
                                                  HeadToHeadRecord h2h, boolean isHome) {
        double base    = base(offense);
        Handedness hand = opposingPitcher != null && opposingPitcher.throwsHand() != null
            ? opposingPitcher.throwsHand() : Handedness.R;
        double split   = splitFactor(offense, hand);
        double recent  = recentFactor(offense);
        double pitcher = pitcherFactor(opposingPitcher);
        double defense = defenseFactor(opposingDefense);

        double park    = context != null ? context.parkFactor() : 1.0;
        double weather = context != null ? context.weatherRunDelta() : 0.0;
        double fatigue = context != null ? context.fatiguePenalty() : 0.0;
        double h2hAdj  = headToHeadDelta(h2h, isHome);

        double mu = base * split * recent * pitcher * defense * park + weather - fatigue + h2hAdj;
        mu = Math.max(mu, MIN_RUNS);

        double confidence = combineConfidence(offense, opposingPitcher, opposingDefense, context, h2h);
        return new ProjectionBreakdown(base, split, recent, pitcher, defense, park, weather, fatigue,
            h2hAdj, mu, confidence);
    }

    static double base(OffenseMetrics offense) {
        return offense != null && offense.runsPerGame() != null ? offense.runsPerGame().adjusted() : LEAGUE_RPG;
    }

    static double splitFactor(OffenseMetrics offense, Handedness pitcherHand) {
        if (offense == null) return 1.0;
        Double opsVs = offense.opsVs(pitcherHand);
        if (opsVs == null) return 1.0;

        double team = offense.ops() != null ? offense.ops().adjusted() : LEAGUE_OPS;
        double splitIdx = clamp(opsVs, 0.3, 1.5) / LEAGUE_OPS;
        double teamIdx  = clamp(team, 0.3, 1.5) / LEAGUE_OPS;
        return clamp(WEIGHT_SPLIT * splitIdx + (1 - WEIGHT_SPLIT) * teamIdx, 0.6, 1.4);
    }

    static double recentFactor(OffenseMetrics offense) {
        if (offense == null || offense.runsLast30() == null) return 1.0;
        double ratio = offense.runsLast30() / Math.max(base(offense), 0.1);
        return clamp(1 + WEIGHT_RECENT_30 * (ratio - 1), 0.7, 1.3);
    }

    static double pitcherFactor(PitchingMetrics pitcher) {
        double era = pitcher != null && pitcher.era() != null ? pitcher.era().adjusted() : LEAGUE_ERA;
        era = clamp(era, 0.5, 10.0);
        return clamp(Math.pow(era / LEAGUE_ERA, ALPHA_PITCHER), 0.6, 1.7);
    }

    static double defenseFactor(DefenseMetrics defense) {
        if (defense == null || defense.errorsPerGame() == null) return 1.0;
        double diff = defense.errorsPerGame().adjusted() - LEAGUE_ERRORS_PER_GAME;
        return clamp(1 + BETA_DEFENSE * diff, 0.8, 1.2);
    }

    static double headToHeadDelta(HeadToHeadRecord h2h, boolean isHome) {
        if (h2h == null || h2h.confidence() <= 0) return 0.0;
        double adj = (h2h.winRateWeighted() - 0.5) * GAMMA_H2H * h2h.confidence();
        return isHome ? adj : -adj;
    }

    static double combineConfidence(MetricRecord offense, MetricRecord pitcher, MetricRecord defense,
                                    MetricRecord context, MetricRecord h2h) {
        MetricRecord[] inputs  = {offense, pitcher, defense, context, h2h};
        double[]       weights = {0.4, 0.4, 0.1, 0.05, 0.05};
        double sum = 0.0;
        boolean any = false;
        for (int i = 0; i < inputs.length; i++) {
            if (inputs[i] != null) {
                sum += inputs[i].confidence() * weights[i];
                any = true;
            }
        }
        return any ? clamp(sum, 0.2, 1.0) : 0.5;
    }

    private static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(value, hi));
    }
}
