package com.edgeplatform.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SettlementReportDTO(
    @JsonProperty("checked")      int checked,
    @JsonProperty("settled")      int settled,
    @JsonProperty("stillPending") int stillPending,
    @JsonProperty("profit")       double profit
) {}
