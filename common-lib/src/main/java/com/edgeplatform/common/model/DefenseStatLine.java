package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw team fielding line. {@code recentErrors} and {@code der} are optional. */
public record DefenseStatLine(
    @JsonProperty("gamesPlayed")  Integer gamesPlayed,
    @JsonProperty("fieldingPct")  Double fieldingPct,
    @JsonProperty("errors")       Integer errors,
    @JsonProperty("recentErrors") Integer recentErrors,
    @JsonProperty("der")          Double der
) {}
