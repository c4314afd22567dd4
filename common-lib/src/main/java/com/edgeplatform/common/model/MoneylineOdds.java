package com.edgeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Moneyline prices in either American (integral) or decimal (floating) convention. */
public record MoneylineOdds(
    @JsonProperty("home") Number home,
    @JsonProperty("away") Number away
) {}
