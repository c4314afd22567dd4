package com.edgeplatform.common.market;

import com.edgeplatform.common.model.PickSide;

import java.util.List;
import java.util.Optional;

/**
 * Edge arithmetic shared by the market evaluators.
 */
public final class EdgeMath {

    public static final double PENALTY_PER_FLAG = 0.035;
    public static final double MAX_PENALTY      = 0.12;
    public static final double MIN_PROB         = 0.05;
    public static final double MAX_PROB         = 0.95;

    private static final List<String> LOW_QUALITY_MARKERS = List.of("LOW_SAMPLE", "NO_H2H", "NO_RECENT");

    /** One priced side of a market with the model's view of it. */
    public record SideQuote(PickSide side, double odds, double modelProb, double impliedProb, double edge) {}

    private EdgeMath() {}

    /**
     * Normalized edge {@code (model − implied) / implied}. Comparable between favorites and
     * underdogs. Zero when the implied probability is outside (0, 1).
     */
    public static double normalizedEdge(double modelProb, double impliedProb) {
        if (impliedProb <= 0 || impliedProb >= 1) {
            return 0.0;
        }
        return (modelProb - impliedProb) / impliedProb;
    }

    /** {@code min(count × 0.035, 0.12)} over flags carrying a low-quality marker. */
    public static double qualityPenalty(List<String> flags) {
        if (flags == null) return 0.0;
        long count = flags.stream()
            .filter(f -> f != null && LOW_QUALITY_MARKERS.stream().anyMatch(f::contains))
            .count();
        return Math.min(count * PENALTY_PER_FLAG, MAX_PENALTY);
    }

    /**
     * Pulls a probability toward a coin flip by the quality penalty, then clamps to [0.05, 0.95].
     * <pre>
     *   p' = clamp(0.5 + (p − 0.5) × (1 − penalty), 0.05, 0.95)
     * </pre>
     */
    public static double applyQualityPenalty(double probability, List<String> flags) {
        double penalty = qualityPenalty(flags);
        return clampProbability(0.5 + (probability - 0.5) * (1 - penalty));
    }

    public static double clampProbability(double p) {
        return Math.max(MIN_PROB, Math.min(p, MAX_PROB));
    }

    /**
     * Highest edge that clears {@code minEdge}. Sides are considered in list order; a later side
     * replaces the current best only with a strictly greater edge, so ties keep the first side.
     */
    public static Optional<SideQuote> selectBest(List<SideQuote> quotes, double minEdge) {
        SideQuote best = null;
        for (SideQuote quote : quotes) {
            if (quote.edge() < minEdge) continue;
            if (best == null || quote.edge() > best.edge()) {
                best = quote;
            }
        }
        return Optional.ofNullable(best);
    }
}
