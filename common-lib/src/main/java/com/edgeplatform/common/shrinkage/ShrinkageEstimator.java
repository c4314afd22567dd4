package com.edgeplatform.common.shrinkage;

/**
 * Empirical-Bayes shrinkage of an observed rate toward a league prior.
 *
 * <pre>
 *   adjusted = (value × n + prior × w) / (n + w)
 * </pre>
 *
 * <p>{@code w} is the number of virtual observations the prior is worth. With no
 * observations ({@code n <= 0}) the prior is returned unchanged.
 */
public final class ShrinkageEstimator {

    private ShrinkageEstimator() {}

    public static double adjust(double value, double sampleSize, double prior, double priorWeight) {
        if (sampleSize <= 0) {
            return prior;
        }
        return (value * sampleSize + prior * priorWeight) / (sampleSize + priorWeight);
    }
}
