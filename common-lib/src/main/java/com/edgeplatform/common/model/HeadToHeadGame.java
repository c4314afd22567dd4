package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One prior meeting, scored from the home team's perspective. */
public record HeadToHeadGame(
    @JsonProperty("season")      int season,
    @JsonProperty("runsFor")     int runsFor,
    @JsonProperty("runsAgainst") int runsAgainst
) {}
