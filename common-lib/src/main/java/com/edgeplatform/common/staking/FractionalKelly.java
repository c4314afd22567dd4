package com.edgeplatform.common.staking;

/**
 * Kelly criterion sizing.
 *
 * <pre>
 *   b = decimal − 1,  q = 1 − p
 *   f* = (b·p − q) / b
 *   stake = f* ≤ 0 ? 0 : min(f* × fraction, cap)
 * </pre>
 */
public final class FractionalKelly {

    private FractionalKelly() {}

    /** Full Kelly fraction, 0 for odds ≤ 1 or probabilities outside (0, 1). */
    public static double fullKelly(double decimalOdds, double modelProb) {
        double b = decimalOdds - 1.0;
        if (!(b > 0) || !(modelProb > 0) || !(modelProb < 1)) {
            return 0.0;
        }
        return (b * modelProb - (1.0 - modelProb)) / b;
    }

    public static double stakeFraction(double decimalOdds, double modelProb, double fraction, double cap) {
        double kelly = fullKelly(decimalOdds, modelProb);
        if (kelly <= 0) {
            return 0.0;
        }
        return Math.min(kelly * fraction, cap);
    }
}
