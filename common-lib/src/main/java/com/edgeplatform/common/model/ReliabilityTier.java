package com.edgeplatform.common.model;

/**
 * Game reliability bands: {@code < 0.55} DISCARD, {@code < 0.65} LOW,
 * {@code < 0.75} MEDIUM, otherwise HIGH.
 */
public enum ReliabilityTier {
    DISCARD, LOW, MEDIUM, HIGH;

    public static ReliabilityTier of(double score) {
        if (score < 0.55) return DISCARD;
        if (score < 0.65) return LOW;
        if (score < 0.75) return MEDIUM;
        return HIGH;
    }
}
