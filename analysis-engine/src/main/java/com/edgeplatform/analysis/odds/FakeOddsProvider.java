package com.edgeplatform.analysis.odds;

import com.edgeplatform.analysis.config.EdgeProperties;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketOdds;
import com.edgeplatform.common.model.MoneylineOdds;
import com.edgeplatform.common.model.TotalsOdds;
import com.edgeplatform.common.sport.OddsProvider;
import org.springframework.stereotype.Component;

/**
 * Offline {@link OddsProvider} for development and tests.
 *
 * <pre>
 *   total     = configured line @ configured Over/Under prices (default 8.5 @ 1.95/1.95)
 *   P(home)   = h^1.83 / (h^1.83 + a^1.83)          (Pythagorean split of projected runs)
 *   moneyline = 1 / (p × (1 + margin))               per side, kept within [1.01, 99]
 * </pre>
 * Without projections it quotes nothing.
 */
@Component
public class FakeOddsProvider implements OddsProvider {

    static final double PYTHAGOREAN_EXPONENT = 1.83;
    private static final double MIN_DECIMAL  = 1.01;
    private static final double MAX_DECIMAL  = 99.0;

    private final EdgeProperties.FakeOdds settings;

    public FakeOddsProvider(EdgeProperties properties) {
        this.settings = properties.getFakeOdds();
    }

    @Override
    public MarketOdds getMarkets(Analysis analysis) {
        if (analysis == null || !analysis.hasProjections() || analysis.totalRuns() == null) {
            return MarketOdds.empty();
        }
        TotalsOdds total = new TotalsOdds(settings.getTotalLine(), settings.getOverOdds(), settings.getUnderOdds());

        double home = Math.pow(analysis.homeRuns(), PYTHAGOREAN_EXPONENT);
        double away = Math.pow(analysis.awayRuns(), PYTHAGOREAN_EXPONENT);
        if (home + away <= 0) {
            return new MarketOdds(null, total);
        }
        double pHome = home / (home + away);
        MoneylineOdds moneyline = new MoneylineOdds(price(pHome), price(1.0 - pHome));
        return new MarketOdds(moneyline, total);
    }

    private Double price(double fairProbability) {
        double shaded = 1.0 / (fairProbability * (1.0 + settings.getMoneylineMargin()));
        return Math.round(Math.max(MIN_DECIMAL, Math.min(shaded, MAX_DECIMAL)) * 100.0) / 100.0;
    }
}
