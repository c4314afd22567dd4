package com.edgeplatform.common.validation;

import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Two-tier sanity check of a generated pick. Errors block the pick; warnings keep it but flag
 * it for review.
 *
 * <h3>Errors</h3>
 * <ul>
 *   <li>missing market, side, odds, modelProb, impliedProb, edge or confidence</li>
 *   <li>edge below the profile minimum, or negative</li>
 *   <li>confidence below the profile minimum, or outside [0, 1]</li>
 *   <li>decimal odds below 1.01</li>
 *   <li>model probability outside [0.05, 0.95], implied probability outside (0, 1)</li>
 *   <li>negative stake, stake fraction above the profile cap</li>
 * </ul>
 * <h3>Warnings</h3>
 * <ul>
 *   <li>edge above 0.25; odds above 50</li>
 *   <li>high edge with low confidence (0.10/0.60, 0.08/0.65) and the reverse (0.80/0.03)</li>
 *   <li>stated edge not reproducible from the probabilities within 0.01</li>
 *   <li>implied probability not matching the odds within 0.01</li>
 *   <li>stake fraction below 0.001, stake amount above 500</li>
 * </ul>
 */
public class PickValidator {

    public static final double MIN_ODDS_DECIMAL   = 1.01;
    public static final double MAX_ODDS_DECIMAL   = 50.0;
    public static final double MIN_MODEL_PROB     = 0.05;
    public static final double MAX_MODEL_PROB     = 0.95;
    public static final double MAX_EDGE_WARNING   = 0.25;
    public static final double MIN_STAKE_PCT      = 0.001;
    public static final double MAX_STAKE_AMOUNT   = 500.0;
    public static final double TOLERANCE          = 0.01;

    private static final List<String> QUALITY_MARKERS =
        List.of("LOW_SAMPLE", "NO_H2H", "NO_RECENT", "TBD_PITCHER", "NO_BULLPEN", "NO_SPLITS");

    /** Per-pick results of a batch in input order, plus counts. */
    public record BatchResult(List<ValidationResult> results, int valid, int invalid) {}

    private final RiskProfile profile;

    public PickValidator(RiskProfile profile) {
        this.profile = profile;
    }

    public ValidationResult validate(Pick pick) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> info = new ArrayList<>();

        requiredFields(pick, errors);
        edge(pick, errors, warnings);
        confidence(pick, errors, warnings);
        odds(pick, errors, warnings);
        probabilities(pick, errors, warnings);
        stake(pick, errors, warnings);
        dataQuality(pick, info);

        return new ValidationResult(errors, warnings, info);
    }

    public BatchResult validateBatch(List<Pick> picks) {
        List<ValidationResult> results = new ArrayList<>(picks.size());
        int valid = 0;
        for (Pick pick : picks) {
            ValidationResult r = validate(pick);
            results.add(r);
            if (r.isValid()) valid++;
        }
        return new BatchResult(results, valid, picks.size() - valid);
    }

    private void requiredFields(Pick pick, List<String> errors) {
        Map<String, Object> required = new LinkedHashMap<>();
        required.put("market", pick.market());
        required.put("side", pick.side());
        required.put("odds", pick.odds());
        required.put("modelProb", pick.modelProb());
        required.put("impliedProb", pick.impliedProb());
        required.put("edge", pick.edge());
        required.put("confidence", pick.confidence());

        List<String> missing = new ArrayList<>();
        required.forEach((name, value) -> {
            if (value == null) missing.add(name);
        });
        if (!missing.isEmpty()) {
            errors.add("Missing required fields: " + missing);
        }
    }

    private void edge(Pick pick, List<String> errors, List<String> warnings) {
        Double edge = pick.edge();
        if (edge == null) return;
        if (edge < profile.minEdge()) {
            errors.add(String.format("Edge too low: %.2f%% < %.1f%%", edge * 100, profile.minEdge() * 100));
        }
        if (edge < 0) {
            errors.add(String.format("Negative edge: %.2f%%", edge * 100));
        }
        if (edge > MAX_EDGE_WARNING) {
            warnings.add(String.format("Edge suspiciously high: %.1f%% (check data quality)", edge * 100));
        }
    }

    private void confidence(Pick pick, List<String> errors, List<String> warnings) {
        Double confidence = pick.confidence();
        if (confidence == null) return;
        double edge = pick.edge() != null ? pick.edge() : 0.0;

        if (confidence < profile.minConfidence()) {
            errors.add(String.format("Confidence too low: %.1f%% < %.1f%%",
                confidence * 100, profile.minConfidence() * 100));
        }
        if (confidence < 0 || confidence > 1) {
            errors.add("Confidence out of range [0, 1]: " + confidence);
        }
        if (edge > 0.10 && confidence < 0.60) {
            warnings.add(String.format("High edge (%.1f%%) requires higher confidence (current %.1f%%, required 60.0%%)",
                edge * 100, confidence * 100));
        } else if (edge > 0.08 && confidence < 0.65) {
            warnings.add(String.format("High edge (%.1f%%) with moderate confidence (%.1f%%)",
                edge * 100, confidence * 100));
        }
        if (confidence > 0.80 && edge < 0.03) {
            warnings.add(String.format("High confidence (%.1f%%) with low edge (%.1f%%)",
                confidence * 100, edge * 100));
        }
    }

    private void odds(Pick pick, List<String> errors, List<String> warnings) {
        Double odds = pick.odds();
        if (odds == null) return;
        if (odds < MIN_ODDS_DECIMAL) {
            errors.add("Odds too low: " + odds + " < " + MIN_ODDS_DECIMAL);
        }
        if (odds > MAX_ODDS_DECIMAL) {
            warnings.add("Odds very high: " + odds + " (longshot)");
        }
    }

    private void probabilities(Pick pick, List<String> errors, List<String> warnings) {
        Double model = pick.modelProb();
        Double implied = pick.impliedProb();

        if (model != null && (model < MIN_MODEL_PROB || model > MAX_MODEL_PROB)) {
            errors.add(String.format("Model probability out of range [%.2f, %.2f]: %s",
                MIN_MODEL_PROB, MAX_MODEL_PROB, model));
        }
        if (implied != null && !(implied > 0 && implied < 1)) {
            errors.add("Implied probability out of range (0, 1): " + implied);
        }
        if (implied != null && pick.odds() != null && pick.odds() > 1.0
                && Math.abs(implied - 1.0 / pick.odds()) > TOLERANCE) {
            warnings.add(String.format("Implied probability %.3f does not match odds %.2f", implied, pick.odds()));
        }
        if (model != null && implied != null && pick.edge() != null && implied > 0 && implied < 1) {
            double expected = (model - implied) / implied * pick.effectiveCorrelation();
            if (Math.abs(expected - pick.edge()) > TOLERANCE) {
                warnings.add(String.format("Edge mismatch: calculated=%.3f, provided=%.3f", expected, pick.edge()));
            }
        }
    }

    private void stake(Pick pick, List<String> errors, List<String> warnings) {
        Double stakePct = pick.stakePct();
        Double stake = pick.stake();
        if (stakePct != null) {
            if (stakePct < MIN_STAKE_PCT) {
                warnings.add(String.format("Stake very small: %.2f%%", stakePct * 100));
            }
            if (stakePct > profile.maxStakePct()) {
                errors.add(String.format("Stake exceeds cap: %.2f%% > %.1f%%",
                    stakePct * 100, profile.maxStakePct() * 100));
            }
        }
        if (stake != null) {
            if (stake < 0) {
                errors.add("Negative stake: " + stake);
            }
            if (stake > MAX_STAKE_AMOUNT) {
                warnings.add(String.format("Stake very high: %.2f > %.0f", stake, MAX_STAKE_AMOUNT));
            }
        }
    }

    private void dataQuality(Pick pick, List<String> info) {
        StringBuilder haystack = new StringBuilder();
        if (pick.rationale() != null) haystack.append(pick.rationale());
        if (pick.flags() != null) pick.flags().forEach(f -> haystack.append(' ').append(f));
        String text = haystack.toString().toUpperCase(Locale.ROOT);

        List<String> found = QUALITY_MARKERS.stream().filter(text::contains).toList();
        if (!found.isEmpty()) {
            info.add("Data quality flags: " + found);
        }
    }

    public RiskProfile profile() {
        return profile;
    }
}
