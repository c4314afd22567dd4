package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * A market-side recommendation. Odds are always decimal.
 *
 * <p>Numeric fields are boxed because picks also arrive from outside the pipeline
 * (REST, storage) where any of them may be absent; the validator reports those as errors.
 * {@code correlationMultiplier} is the factor already applied to {@code edge} and
 * {@code confidence}, null meaning 1.0.
 */
public record Pick(
    @JsonProperty("eventId")               String eventId,
    @JsonProperty("gameDate")              LocalDate gameDate,
    @JsonProperty("market")                MarketType market,
    @JsonProperty("side")                  PickSide side,
    @JsonProperty("team")                  String team,
    @JsonProperty("line")                  Double line,
    @JsonProperty("odds")                  Double odds,
    @JsonProperty("modelProb")             Double modelProb,
    @JsonProperty("impliedProb")           Double impliedProb,
    @JsonProperty("edge")                  Double edge,
    @JsonProperty("confidence")            Double confidence,
    @JsonProperty("correlationMultiplier") Double correlationMultiplier,
    @JsonProperty("stakePct")              Double stakePct,
    @JsonProperty("stake")                 Double stake,
    @JsonProperty("rationale")             String rationale,
    @JsonProperty("flags")                 List<String> flags
) {
    /** Creates an unstaked, uncorrelated pick. */
    public static Pick of(String eventId, LocalDate gameDate, MarketType market, PickSide side,
                          String team, Double line, double odds, double modelProb,
                          double impliedProb, double edge, double confidence,
                          String rationale, List<String> flags) {
        return new Pick(eventId, gameDate, market, side, team, line, odds, modelProb, impliedProb,
            edge, confidence, 1.0, null, null, rationale, flags != null ? List.copyOf(flags) : List.of());
    }

    /**
     * Scales edge and confidence by {@code multiplier} and appends the reason to the rationale.
     * Confidence is capped at 1.0.
     */
    public Pick withCorrelation(double multiplier, String reason) {
        return new Pick(eventId, gameDate, market, side, team, line, odds, modelProb, impliedProb,
            edge != null ? edge * multiplier : null,
            confidence != null ? Math.min(1.0, confidence * multiplier) : null,
            effectiveCorrelation() * multiplier, stakePct, stake,
            appendReason(reason), flags);
    }

    public Pick withStake(double newStakePct, double newStake, String reason) {
        return new Pick(eventId, gameDate, market, side, team, line, odds, modelProb, impliedProb,
            edge, confidence, correlationMultiplier, newStakePct, newStake, appendReason(reason), flags);
    }

    public double effectiveCorrelation() {
        return correlationMultiplier != null ? correlationMultiplier : 1.0;
    }

    private String appendReason(String reason) {
        if (reason == null || reason.isBlank()) return rationale;
        return rationale == null || rationale.isBlank() ? reason : rationale + " | " + reason;
    }
}
