package com.edgeplatform.common.model;

/** Wagering markets with their stake multiplier relative to a moneyline bet. */
public enum MarketType {
    MONEYLINE(1.0),
    TOTAL(0.9),
    SPREAD(0.85);

    private final double stakeMultiplier;

    MarketType(double stakeMultiplier) {
        this.stakeMultiplier = stakeMultiplier;
    }

    public double stakeMultiplier() {
        return stakeMultiplier;
    }
}
