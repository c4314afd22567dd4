package com.edgeplatform.history.dto;

import com.edgeplatform.common.backtest.BacktestResult;
import com.edgeplatform.common.backtest.BacktestSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BacktestResponse(
    @JsonProperty("results") List<BacktestResult> results,
    @JsonProperty("summary") BacktestSummary summary
) {}
