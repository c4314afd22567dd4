package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw team batting line. Null {@code gamesPlayed} means the team could not be resolved. */
public record OffenseStatLine(
    @JsonProperty("gamesPlayed") Integer gamesPlayed,
    @JsonProperty("runsPerGame") Double runsPerGame,
    @JsonProperty("ops")         Double ops,
    @JsonProperty("opsVsRight")  Double opsVsRight,
    @JsonProperty("opsVsLeft")   Double opsVsLeft,
    @JsonProperty("runsLast14")  Double runsLast14,
    @JsonProperty("runsLast30")  Double runsLast30
) {}
