package com.edgeplatform.common.correlation;

import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;

/**
 * Stake reduction when a moneyline and a totals pick are held on the same game.
 * Symmetric: either pick may be the one being staked.
 *
 * <pre>
 *   moneyline + Over  → 0.75
 *   moneyline + Under → 0.70
 *   otherwise         → 1.00
 * </pre>
 */
public final class CorrelationStakeMultiplier {

    public static final double WITH_OVER  = 0.75;
    public static final double WITH_UNDER = 0.70;

    public record StakeAdjustment(double multiplier, String reason) {}

    private CorrelationStakeMultiplier() {}

    public static StakeAdjustment of(Pick pick, Pick correlated) {
        if (pick == null || correlated == null) {
            return new StakeAdjustment(1.0, "No correlated market");
        }
        Pick moneyline = pick.market() == MarketType.MONEYLINE ? pick
            : correlated.market() == MarketType.MONEYLINE ? correlated : null;
        Pick totals = pick.market() == MarketType.TOTAL ? pick
            : correlated.market() == MarketType.TOTAL ? correlated : null;

        if (moneyline == null || totals == null || moneyline == totals) {
            return new StakeAdjustment(1.0, "No meaningful correlation detected");
        }
        if (totals.side() == PickSide.OVER) {
            return new StakeAdjustment(WITH_OVER, "Positive moneyline/totals correlation (shared scoring dominance)");
        }
        if (totals.side() == PickSide.UNDER) {
            return new StakeAdjustment(WITH_UNDER, "Negative moneyline/totals correlation (pace suppression)");
        }
        return new StakeAdjustment(1.0, "No meaningful correlation detected");
    }
}
