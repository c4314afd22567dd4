package com.edgeplatform.common.sport;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketOdds;

/** Supplies market prices for an analyzed game. Returns {@link MarketOdds#empty()} when it has none. */
public interface OddsProvider {

    MarketOdds getMarkets(Analysis analysis);
}
