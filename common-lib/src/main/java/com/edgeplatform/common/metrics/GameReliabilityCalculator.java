package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.GameMetrics;
import com.edgeplatform.common.model.GameReliability;
import com.edgeplatform.common.model.MetricRecord;
import com.edgeplatform.common.model.ReliabilityTier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Weighted reliability score of a whole game from its module confidences.
 *
 * <h3>Weights</h3>
 * <pre>
 *   pitching 0.35 · offense 0.30 · context 0.20 · market 0.15
 *   module confidence = min(home, away)
 *   score = Σ(conf × w) / Σ(w)   over modules that reported a confidence
 * </pre>
 * Tiers follow {@link ReliabilityTier}; a DISCARD game is not usable.
 */
public final class GameReliabilityCalculator {

    public static final Map<String, Double> DEFAULT_WEIGHTS = Map.of(
        "pitching", 0.35,
        "offense",  0.30,
        "context",  0.20,
        "market",   0.15);

    public static final double DEFAULT_MARKET_CONFIDENCE = 0.75;

    /** One module's confidence (null when unknown) and its active flags. */
    public record ModuleSignal(Double confidence, List<String> activeFlags) {}

    private GameReliabilityCalculator() {}

    public static GameReliability forGame(GameMetrics metrics, Double marketConfidence) {
        Map<String, ModuleSignal> modules = new LinkedHashMap<>();
        modules.put("pitching", pair(metrics.homePitcher(), metrics.awayPitcher(),
            PitchingMetricsBuilder.TBD, PitchingMetricsBuilder.LOW_SAMPLE, PitchingMetricsBuilder.FATIGUE));
        modules.put("offense", pair(metrics.homeOffense(), metrics.awayOffense(),
            OffenseMetricsBuilder.NO_RECENT, OffenseMetricsBuilder.NO_SPLITS, OffenseMetricsBuilder.LOW_SAMPLE));
        modules.put("context", pair(metrics.homeContext(), metrics.awayContext(),
            ContextBuilder.NO_WEATHER, ContextBuilder.NO_PARK_FACTOR));
        modules.put("market", new ModuleSignal(
            marketConfidence != null ? marketConfidence : DEFAULT_MARKET_CONFIDENCE, List.of()));
        return compute(modules, DEFAULT_WEIGHTS);
    }

    public static GameReliability compute(Map<String, ModuleSignal> modules, Map<String, Double> weights) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        TreeSet<String> warnings = new TreeSet<>();

        for (Map.Entry<String, ModuleSignal> entry : modules.entrySet()) {
            String module = entry.getKey().toUpperCase(Locale.ROOT);
            ModuleSignal signal = entry.getValue();
            if (signal == null || signal.confidence() == null) {
                warnings.add(module + "_NO_CONFIDENCE");
                continue;
            }
            double weight = weights.getOrDefault(entry.getKey(), 0.0);
            weighted    += signal.confidence() * weight;
            totalWeight += weight;
            for (String flag : signal.activeFlags()) {
                warnings.add(module + "_" + flag.toUpperCase(Locale.ROOT));
            }
        }

        double score = totalWeight > 0 ? weighted / totalWeight : 0.0;
        ReliabilityTier tier = ReliabilityTier.of(score);
        return new GameReliability(score, tier, tier != ReliabilityTier.DISCARD, List.copyOf(warnings));
    }

    private static ModuleSignal pair(MetricRecord home, MetricRecord away, String... relevantFlags) {
        if (home == null || away == null) {
            return new ModuleSignal(null, List.of());
        }
        TreeSet<String> active = new TreeSet<>();
        for (String flag : relevantFlags) {
            if (home.hasFlag(flag) || away.hasFlag(flag)) active.add(flag);
        }
        return new ModuleSignal(Math.min(home.confidence(), away.confidence()), List.copyOf(active));
    }
}
