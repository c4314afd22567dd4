package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;

/**
 * Immutable risk preset passed to evaluators, the stake engine and the validator.
 * Switching profile means building a new set of components.
 *
 * <pre>
 *   profile       minEdge  minConf  kelly  maxStake  picks/day
 *   conservative   0.04     0.65    0.20    0.03        3
 *   balanced       0.03     0.60    0.25    0.05        5
 *   aggressive     0.02     0.55    0.33    0.05        8
 * </pre>
 */
public record RiskProfile(
    @JsonProperty("name")           String name,
    @JsonProperty("minEdge")        double minEdge,
    @JsonProperty("minConfidence")  double minConfidence,
    @JsonProperty("kellyFraction")  double kellyFraction,
    @JsonProperty("maxStakePct")    double maxStakePct,
    @JsonProperty("maxPicksPerDay") int maxPicksPerDay
) {
    public static final RiskProfile CONSERVATIVE = new RiskProfile("conservative", 0.04, 0.65, 0.20, 0.03, 3);
    public static final RiskProfile BALANCED     = new RiskProfile("balanced",     0.03, 0.60, 0.25, 0.05, 5);
    public static final RiskProfile AGGRESSIVE   = new RiskProfile("aggressive",   0.02, 0.55, 0.33, 0.05, 8);

    public static final Map<String, RiskProfile> PRESETS = Map.of(
        CONSERVATIVE.name(), CONSERVATIVE,
        BALANCED.name(),     BALANCED,
        AGGRESSIVE.name(),   AGGRESSIVE);

    /** Looks up a preset by name (case-insensitive), falling back to {@link #BALANCED}. */
    public static RiskProfile named(String name) {
        if (name == null) return BALANCED;
        return PRESETS.getOrDefault(name.toLowerCase(Locale.ROOT), BALANCED);
    }
}
