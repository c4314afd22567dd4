package com.edgeplatform.common.validation;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

import static com.edgeplatform.common.league.MlbConstants.LEAGUE_RPG;

/**
 * Sanity checks on a game projection before it reaches the market evaluators.
 *
 * <pre>
 *   runs per team &lt; 0.5   → error      &gt; 15 → warning
 *   total outside [1, 25]  → error
 *   |mu − 4.6| &gt; 3.0       → warning
 *   confidence &lt; 0.5      → warning
 * </pre>
 */
public final class ProjectionValidator {

    private static final double MIN_RUNS_TEAM      = 0.5;
    private static final double MAX_RUNS_TEAM      = 15.0;
    private static final double MIN_TOTAL          = 1.0;
    private static final double MAX_TOTAL          = 25.0;
    private static final double MAX_DEVIATION      = 3.0;
    private static final double MIN_CONFIDENCE     = 0.5;

    private ProjectionValidator() {}

    public static ValidationResult validate(Analysis analysis) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> info = new ArrayList<>();

        if (!analysis.hasProjections()) {
            errors.add("Missing team projections");
            return new ValidationResult(errors, warnings, info);
        }

        checkTeam("home", analysis.homeRuns(), errors, warnings);
        checkTeam("away", analysis.awayRuns(), errors, warnings);

        double total = analysis.totalRuns() != null
            ? analysis.totalRuns() : analysis.homeRuns() + analysis.awayRuns();
        if (total < MIN_TOTAL || total > MAX_TOTAL) {
            errors.add(String.format("Projected total %.2f outside [%.0f, %.0f]", total, MIN_TOTAL, MAX_TOTAL));
        }
        if (analysis.confidence() < MIN_CONFIDENCE) {
            warnings.add(String.format("Low projection confidence %.2f", analysis.confidence()));
        }
        info.add(String.format("Projected %.2f - %.2f (total %.2f)",
            analysis.homeRuns(), analysis.awayRuns(), total));
        return new ValidationResult(errors, warnings, info);
    }

    private static void checkTeam(String side, double runs, List<String> errors, List<String> warnings) {
        if (runs < MIN_RUNS_TEAM) {
            errors.add(String.format("%s projection %.2f below %.1f runs", side, runs, MIN_RUNS_TEAM));
        } else if (runs > MAX_RUNS_TEAM) {
            warnings.add(String.format("%s projection %.2f above %.0f runs", side, runs, MAX_RUNS_TEAM));
        }
        if (Math.abs(runs - LEAGUE_RPG) > MAX_DEVIATION) {
            warnings.add(String.format("%s projection %.2f deviates more than %.1f from league average",
                side, runs, MAX_DEVIATION));
        }
    }
}
