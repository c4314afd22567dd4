package com.edgeplatform.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Manual settlement of one pick. {@code actualOutcome} is the final score, e.g. "5-3". */
public record ResultUpdateRequest(
    @JsonProperty("result")        String result,
    @JsonProperty("actualOutcome") String actualOutcome,
    @JsonProperty("profit")        Double profit
) {}
