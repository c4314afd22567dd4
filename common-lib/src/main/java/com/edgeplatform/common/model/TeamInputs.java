package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TeamInputs(
    @JsonProperty("team")              String team,
    @JsonProperty("starter")           PitcherStatLine starter,
    @JsonProperty("offense")           OffenseStatLine offense,
    @JsonProperty("defense")           DefenseStatLine defense,
    @JsonProperty("bullpen")           BullpenStatLine bullpen,
    @JsonProperty("playedPreviousDay") boolean playedPreviousDay
) {}
