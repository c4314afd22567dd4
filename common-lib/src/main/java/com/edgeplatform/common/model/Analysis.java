package com.edgeplatform.common.model;

import com.edgeplatform.common.league.MlbConstants;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Normalized per-game bundle handed from the analysis stage to every market evaluator.
 *
 * <p>Immutable: use {@link #withMarket} or {@link #withReliability} to derive a copy.
 * {@code metrics}, {@code market} and {@code reliability} may be null; evaluators treat
 * missing pieces as "no pick", never as an error.
 */
public record Analysis(
    @JsonProperty("eventId")        String eventId,
    @JsonProperty("sport")          String sport,
    @JsonProperty("league")         String league,
    @JsonProperty("date")           LocalDate date,
    @JsonProperty("homeTeam")       String homeTeam,
    @JsonProperty("awayTeam")       String awayTeam,
    @JsonProperty("venue")          String venue,
    @JsonProperty("metrics")        GameMetrics metrics,
    @JsonProperty("homeProjection") ProjectionBreakdown homeProjection,
    @JsonProperty("awayProjection") ProjectionBreakdown awayProjection,
    @JsonProperty("totalRuns")      Double totalRuns,
    @JsonProperty("market")         MarketOdds market,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("flags")          List<String> flags,
    @JsonProperty("reliability")    GameReliability reliability
) {
    /**
     * Builds an analysis from projected runs alone, with neutral breakdowns and no metrics.
     */
    public static Analysis fromProjections(String eventId, String homeTeam, String awayTeam,
                                           double homeRuns, double awayRuns, MarketOdds market,
                                           double confidence, List<String> flags) {
        ProjectionBreakdown home = ProjectionBreakdown.of(homeRuns, confidence);
        ProjectionBreakdown away = ProjectionBreakdown.of(awayRuns, confidence);
        return new Analysis(eventId, "baseball", "MLB", null, homeTeam, awayTeam, null, null,
            home, away, home.mu() + away.mu(), market, confidence,
            flags != null ? List.copyOf(flags) : List.of(), null);
    }

    public Analysis withMarket(MarketOdds newMarket) {
        return new Analysis(eventId, sport, league, date, homeTeam, awayTeam, venue, metrics,
            homeProjection, awayProjection, totalRuns, newMarket, confidence, flags, reliability);
    }

    public Analysis withReliability(GameReliability newReliability) {
        return new Analysis(eventId, sport, league, date, homeTeam, awayTeam, venue, metrics,
            homeProjection, awayProjection, totalRuns, market, confidence, flags, newReliability);
    }

    @JsonIgnore
    public Double homeRuns() {
        return homeProjection != null ? homeProjection.mu() : null;
    }

    @JsonIgnore
    public Double awayRuns() {
        return awayProjection != null ? awayProjection.mu() : null;
    }

    @JsonIgnore
    public boolean hasProjections() {
        return homeProjection != null && awayProjection != null;
    }

    /** Adjusted bullpen ERA of the home team, league average when unknown. */
    @JsonIgnore
    public double homeBullpenEra() {
        return metrics != null && metrics.homeBullpen() != null
            ? metrics.homeBullpen().era().adjusted()
            : MlbConstants.LEAGUE_BULLPEN_ERA;
    }

    @JsonIgnore
    public double awayBullpenEra() {
        return metrics != null && metrics.awayBullpen() != null
            ? metrics.awayBullpen().era().adjusted()
            : MlbConstants.LEAGUE_BULLPEN_ERA;
    }
}
