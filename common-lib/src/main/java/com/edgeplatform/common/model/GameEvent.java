package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * A scheduled game with every raw input the analysis stage consumes. Weather is null when
 * no forecast was available; {@code market} is null until an odds provider fills it.
 */
public record GameEvent(
    @JsonProperty("eventId")      String eventId,
    @JsonProperty("date")         LocalDate date,
    @JsonProperty("venue")        String venue,
    @JsonProperty("temperatureC") Double temperatureC,
    @JsonProperty("windKph")      Double windKph,
    @JsonProperty("home")         TeamInputs home,
    @JsonProperty("away")         TeamInputs away,
    @JsonProperty("headToHead")   List<HeadToHeadGame> headToHead,
    @JsonProperty("market")       MarketOdds market
) {}
