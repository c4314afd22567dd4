package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** A completed (or scheduled, when scores are null) game used for settlement. */
public record HistoricalGame(
    @JsonProperty("eventId")   String eventId,
    @JsonProperty("date")      LocalDate date,
    @JsonProperty("homeTeam")  String homeTeam,
    @JsonProperty("awayTeam")  String awayTeam,
    @JsonProperty("homeScore") Integer homeScore,
    @JsonProperty("awayScore") Integer awayScore
) {
    @JsonIgnore
    public boolean isFinal() {
        return homeScore != null && awayScore != null;
    }

    @JsonIgnore
    public int totalRuns() {
        return homeScore + awayScore;
    }
}
