package com.edgeplatform.common.market;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;

import java.util.Optional;

/**
 * Turns an {@link Analysis} into at most one {@link Pick} for a single market.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li>Pure: no I/O, no logging, no mutation of the analysis</li>
 *   <li>Empty-safe: missing projections, odds or confidence yield {@link Optional#empty()}</li>
 *   <li>Strict on malformed odds: {@code OddsFormatException} propagates so the caller can skip
 *       the market</li>
 * </ul>
 */
public interface MarketEvaluator {

    MarketType market();

    Optional<Pick> evaluate(Analysis analysis, double minEdge, double minConfidence);

    default Optional<Pick> evaluate(Analysis analysis, RiskProfile profile) {
        return evaluate(analysis, profile.minEdge(), profile.minConfidence());
    }
}
