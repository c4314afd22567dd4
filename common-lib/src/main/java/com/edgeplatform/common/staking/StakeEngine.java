package com.edgeplatform.common.staking;

import com.edgeplatform.common.correlation.CorrelationStakeMultiplier;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;

/**
 * Populates stake fields of a pick under a {@link RiskProfile}.
 *
 * <pre>
 *   stakePct = min(kelly × kellyFraction, maxStakePct)
 *            × market multiplier (moneyline 1.0, total 0.9, spread 0.85)
 *            × correlation multiplier (see {@link CorrelationStakeMultiplier})
 *   stake    = bankroll × stakePct, rounded to cents
 * </pre>
 * Every multiplier is ≤ 1, so the stake fraction never exceeds the profile cap.
 * Invalid odds or a missing probability size to zero; nothing here throws.
 */
public class StakeEngine {

    private final RiskProfile profile;

    public StakeEngine(RiskProfile profile) {
        this.profile = profile;
    }

    public Pick sizeStake(Pick pick, double bankroll) {
        return sizeStake(pick, bankroll, null);
    }

    public Pick sizeStake(Pick pick, double bankroll, Pick correlated) {
        double odds = pick.odds() != null ? pick.odds() : 0.0;
        double prob = pick.modelProb() != null ? pick.modelProb() : 0.0;

        double kellyPct = FractionalKelly.stakeFraction(odds, prob, profile.kellyFraction(), profile.maxStakePct());
        double marketMultiplier = pick.market() != null ? pick.market().stakeMultiplier() : MarketType.MONEYLINE.stakeMultiplier();
        CorrelationStakeMultiplier.StakeAdjustment corr = CorrelationStakeMultiplier.of(pick, correlated);

        double stakePct = kellyPct * marketMultiplier * corr.multiplier();
        double stake = bankroll > 0 ? Math.round(bankroll * stakePct * 100.0) / 100.0 : 0.0;

        String reason = String.format("stake %.4f = kelly %.4f (x%.2f, cap %.2f) x market %.2f x corr %.2f: %s",
            stakePct, kellyPct, profile.kellyFraction(), profile.maxStakePct(),
            marketMultiplier, corr.multiplier(), corr.reason());
        return pick.withStake(stakePct, stake, reason);
    }

    public RiskProfile profile() {
        return profile;
    }
}
