package com.edgeplatform.common.odds;

import com.edgeplatform.common.exception.OddsFormatException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between American and decimal odds plus the market arithmetic built on them.
 *
 * <h3>Convention detection</h3>
 * Integral values ({@code Integer}, {@code Long}, {@code Short}, {@code BigInteger}) are read as
 * American odds. Floating values ({@code Double}, {@code Float}, {@code BigDecimal}) are read as
 * decimal odds and must lie in (1, 100). JSON numbers keep this distinction after Jackson
 * deserialization ({@code -110} becomes an Integer, {@code 1.91} a Double).
 */
public final class OddsConverter {

    private static final double MAX_DECIMAL_ODDS = 100.0;

    private OddsConverter() {}

    public static double americanToDecimal(int american) {
        if (american == 0) {
            throw new OddsFormatException("American odds cannot be 0");
        }
        if (american < 0) {
            return 100.0 / Math.abs(american) + 1.0;
        }
        return american / 100.0 + 1.0;
    }

    public static int decimalToAmerican(double decimal) {
        if (decimal <= 1.0 || Double.isNaN(decimal)) {
            throw new OddsFormatException("Decimal odds must be > 1.0, got " + decimal);
        }
        if (decimal >= 2.0) {
            return (int) ((decimal - 1.0) * 100);
        }
        return (int) (-100 / (decimal - 1.0));
    }

    /**
     * Normalizes odds in either convention to decimal.
     *
     * @throws OddsFormatException for null, zero American odds or decimal odds outside (1, 100)
     */
    public static double normalizeToDecimal(Number odds) {
        if (odds == null) {
            throw new OddsFormatException("Odds value is missing");
        }
        if (odds instanceof Integer || odds instanceof Long || odds instanceof Short
                || odds instanceof BigInteger) {
            return americanToDecimal(odds.intValue());
        }
        if (odds instanceof Double || odds instanceof Float || odds instanceof BigDecimal) {
            double decimal = odds.doubleValue();
            if (!(decimal > 1.0 && decimal < MAX_DECIMAL_ODDS)) {
                throw new OddsFormatException("Decimal odds out of range (1, 100): " + decimal);
            }
            return decimal;
        }
        throw new OddsFormatException("Unsupported odds type: " + odds.getClass().getSimpleName());
    }

    /** Implied probability of decimal odds, {@code 1/d}. Returns 0 for odds ≤ 1. */
    public static double impliedProbability(double decimal) {
        if (decimal <= 1.0) {
            return 0.0;
        }
        return 1.0 / decimal;
    }

    /** Bookmaker margin of a two-way market: sum of implied probabilities minus 1. */
    public static double vig(double decimalA, double decimalB) {
        return impliedProbability(decimalA) + impliedProbability(decimalB) - 1.0;
    }

    /**
     * Fair probabilities of a two-way market with the margin removed proportionally.
     *
     * @return {@code [fairA, fairB]}, summing to 1
     */
    public static double[] removeVig(double decimalA, double decimalB) {
        double a = impliedProbability(decimalA);
        double b = impliedProbability(decimalB);
        double book = a + b;
        if (book <= 0) {
            throw new OddsFormatException("Cannot remove vig from an empty book");
        }
        return new double[] { a / book, b / book };
    }

    /** Expected profit of staking {@code stake} at {@code decimal} with win probability {@code prob}. */
    public static double expectedValue(double prob, double decimal, double stake) {
        return prob * stake * (decimal - 1.0) - (1.0 - prob) * stake;
    }
}
