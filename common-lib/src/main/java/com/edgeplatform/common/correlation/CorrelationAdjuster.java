package com.edgeplatform.common.correlation;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;

/**
 * Reconciles a moneyline pick with the game's totals lean. Moneyline and totals edges on the
 * same game are not independent, so agreeing signals get a small boost and crossed signals a
 * small penalty.
 *
 * <h3>Rules (d = projected total − line, |d| must exceed 0.6)</h3>
 * <pre>
 *   favorite (edge &gt; 0, decimal &lt; 2.0) & d &gt; 0   → +min(0.07, 0.04 + 0.02·d)
 *   favorite                          & d &lt; 0   → max(−0.07, −0.04 + 0.02·d)
 *   underdog (decimal ≥ 2.0)          & d &lt; 0   → +min(0.07, 0.035 + 0.02·|d|)
 *   underdog                          & d &gt; 0   → max(−0.07, −0.04 − 0.02·d)
 *   multiplier = 1 + boost, applied to both edge and confidence
 * </pre>
 */
public final class CorrelationAdjuster {

    public static final double MAX_BOOST   = 0.07;
    public static final double MAX_PENALTY = -0.07;

    private static final double DELTA_THRESHOLD = 0.6;
    private static final double EVEN_MONEY      = 2.0;

    private CorrelationAdjuster() {}

    public static CorrelationAdjustment adjust(Pick primary, Analysis analysis) {
        if (primary == null || primary.market() != MarketType.MONEYLINE) {
            return CorrelationAdjustment.neutral("Not a moneyline pick");
        }
        Double projected = analysis.totalRuns();
        Double line = analysis.market() != null ? analysis.market().totalLine() : null;
        if (projected == null || line == null) {
            return CorrelationAdjustment.neutral("No totals data available");
        }

        double delta = projected - line;
        double edge = primary.edge() != null ? primary.edge() : 0.0;
        double odds = primary.odds() != null ? primary.odds() : 0.0;
        boolean favorite = edge > 0 && odds > 1.0 && odds < EVEN_MONEY;
        boolean underdog = odds >= EVEN_MONEY;

        double boost = 0.0;
        String reason = "Neutral moneyline/totals correlation";
        if (favorite && delta > DELTA_THRESHOLD) {
            boost = Math.min(MAX_BOOST, 0.04 + delta * 0.02);
            reason = "Favorite aligned with high-scoring projection";
        } else if (favorite && delta < -DELTA_THRESHOLD) {
            boost = Math.max(MAX_PENALTY, -0.04 + delta * 0.02);
            reason = "Favorite in projected low-scoring game (higher variance)";
        } else if (underdog && delta < -DELTA_THRESHOLD) {
            boost = Math.min(MAX_BOOST, 0.035 + Math.abs(delta) * 0.02);
            reason = "Underdog aligned with low-scoring projection";
        } else if (underdog && delta > DELTA_THRESHOLD) {
            boost = Math.max(MAX_PENALTY, -0.04 - delta * 0.02);
            reason = "Underdog in projected high-scoring game";
        }

        boost = Math.max(MAX_PENALTY, Math.min(boost, MAX_BOOST));
        return new CorrelationAdjustment(1 + boost, 1 + boost, reason);
    }

    /** Applies {@link #adjust} to the pick's edge and confidence. */
    public static Pick apply(Pick primary, Analysis analysis) {
        CorrelationAdjustment adj = adjust(primary, analysis);
        return primary.withCorrelation(adj.edgeMultiplier(), adj.reason());
    }
}
