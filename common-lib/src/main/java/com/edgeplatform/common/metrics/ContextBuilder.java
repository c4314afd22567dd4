package com.edgeplatform.common.metrics;

import com.edgeplatform.common.model.ContextRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the per-team {@link ContextRecord} for one date: park factor, weather run delta and
 * back-to-back fatigue.
 *
 * <pre>
 *   weatherDelta = (tempC − 22) × 0.005 + (windKph − 10) × 0.002
 *   fatigue      = 0.05 runs when the team played the previous day
 *   confidence   = 0.70 × (no weather 0.90) × (unknown park 0.95), floor 0.40
 * </pre>
 */
public final class ContextBuilder {

    public static final String NO_WEATHER     = "no_weather";
    public static final String NO_PARK_FACTOR = "no_park_factor";
    public static final String BACK_TO_BACK   = "back_to_back";

    private static final double NEUTRAL_TEMP_C      = 22.0;
    private static final double NEUTRAL_WIND_KPH    = 10.0;
    private static final double RUNS_PER_DEGREE     = 0.005;
    private static final double RUNS_PER_KPH        = 0.002;
    private static final double BACK_TO_BACK_PENALTY = 0.05;
    private static final double BASE_CONFIDENCE     = 0.70;
    private static final double MIN_CONFIDENCE      = 0.4;

    private static final Map<String, Double> PARK_FACTORS = new LinkedHashMap<>();
    static {
        PARK_FACTORS.put("coors",       1.34);
        PARK_FACTORS.put("fenway",      1.12);
        PARK_FACTORS.put("globe life",  1.10);
        PARK_FACTORS.put("oakland",     0.94);
        PARK_FACTORS.put("dodger",      1.01);
        PARK_FACTORS.put("petco",       0.92);
        PARK_FACTORS.put("yankee",      1.08);
    }

    private ContextBuilder() {}

    public static ContextRecord build(String team, String venue, Double temperatureC, Double windKph,
                                      boolean playedPreviousDay) {
        List<String> flags = new ArrayList<>();
        double confidence = BASE_CONFIDENCE;

        Double park = parkFactor(venue);
        if (park == null) {
            flags.add(NO_PARK_FACTOR);
            confidence *= 0.95;
        }

        double weatherDelta = 0.0;
        if (temperatureC == null) {
            flags.add(NO_WEATHER);
            confidence *= 0.90;
        } else {
            double wind = windKph != null ? windKph : NEUTRAL_WIND_KPH;
            weatherDelta = weatherDelta(temperatureC, wind);
        }

        double fatigue = 0.0;
        if (playedPreviousDay) {
            flags.add(BACK_TO_BACK);
            fatigue = BACK_TO_BACK_PENALTY;
        }

        confidence = Math.max(MIN_CONFIDENCE, Math.min(confidence, 1.0));
        return new ContextRecord(team, park != null ? park : 1.0, weatherDelta, fatigue,
            confidence, List.copyOf(flags));
    }

    public static double weatherDelta(double temperatureC, double windKph) {
        return (temperatureC - NEUTRAL_TEMP_C) * RUNS_PER_DEGREE + (windKph - NEUTRAL_WIND_KPH) * RUNS_PER_KPH;
    }

    /** Park factor for a venue name, null when the venue is not in the table. */
    public static Double parkFactor(String venue) {
        if (venue == null) return null;
        String key = venue.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : PARK_FACTORS.entrySet()) {
            if (key.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
