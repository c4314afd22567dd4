package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw season line of a probable starter. A null, blank or "TBD" name means the starter is unknown.
 * {@code recentInnings30d} is null when no game logs were available.
 */
public record PitcherStatLine(
    @JsonProperty("name")             String name,
    @JsonProperty("throws")           Handedness throwsHand,
    @JsonProperty("inningsPitched")   Double inningsPitched,
    @JsonProperty("era")              Double era,
    @JsonProperty("fip")              Double fip,
    @JsonProperty("daysRest")         Integer daysRest,
    @JsonProperty("recentInnings30d") Double recentInnings30d
) {}
