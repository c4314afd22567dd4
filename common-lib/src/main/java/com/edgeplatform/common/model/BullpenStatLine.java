package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw relief line. When bullpen innings are missing the builder estimates them from the
 * team pitching line.
 */
public record BullpenStatLine(
    @JsonProperty("inningsPitched")        Double inningsPitched,
    @JsonProperty("era")                   Double era,
    @JsonProperty("teamInningsPitched")    Double teamInningsPitched,
    @JsonProperty("teamEra")               Double teamEra,
    @JsonProperty("highLeverageAvailable") boolean highLeverageAvailable,
    @JsonProperty("recentAvailable")       boolean recentAvailable
) {}
