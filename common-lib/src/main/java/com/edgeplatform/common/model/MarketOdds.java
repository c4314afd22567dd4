package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record MarketOdds(
    @JsonProperty("moneyline") MoneylineOdds moneyline,
    @JsonProperty("total")     TotalsOdds total
) {
    public static MarketOdds empty() {
        return new MarketOdds(null, null);
    }

    @JsonIgnore
    public Double totalLine() {
        return total != null ? total.line() : null;
    }
}
