package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GameReliability(
    @JsonProperty("score")    double score,
    @JsonProperty("tier")     ReliabilityTier tier,
    @JsonProperty("usable")   boolean usable,
    @JsonProperty("warnings") List<String> warnings
) {}
