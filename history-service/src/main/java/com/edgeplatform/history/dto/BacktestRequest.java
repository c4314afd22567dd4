package com.edgeplatform.history.dto;

import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.Pick;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Games with final scores plus the picks to replay against them. When {@code picks} is absent the
 * stored picks of those games are used. {@code initialBankroll} defaults to 10,000.
 */
public record BacktestRequest(
    @JsonProperty("games")           List<HistoricalGame> games,
    @JsonProperty("picks")           List<Pick> picks,
    @JsonProperty("initialBankroll") Double initialBankroll
) {}
