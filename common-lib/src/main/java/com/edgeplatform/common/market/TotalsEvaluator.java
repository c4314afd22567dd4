package com.edgeplatform.common.market;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.common.model.TotalsOdds;
import com.edgeplatform.common.odds.OddsConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Over/Under evaluator. The model probability is a logistic transform of the projected
 * total against the line, not a simulation.
 *
 * <pre>
 *   P(over)  = clamp(1 / (1 + e^−(projTotal − line)), 0.05, 0.95)
 *   P(under) = 1 − P(over)
 * </pre>
 * Over is evaluated before Under. A side without a price is skipped.
 */
public class TotalsEvaluator implements MarketEvaluator {

    @Override
    public MarketType market() {
        return MarketType.TOTAL;
    }

    @Override
    public Optional<Pick> evaluate(Analysis analysis, double minEdge, double minConfidence) {
        TotalsOdds total = analysis.market() != null ? analysis.market().total() : null;
        Double projected = analysis.totalRuns();
        if (total == null || total.line() == null || projected == null) return Optional.empty();
        if (analysis.confidence() < minConfidence) return Optional.empty();

        double line = total.line();
        double probOver  = overProbability(projected, line);
        double probUnder = 1.0 - probOver;

        List<EdgeMath.SideQuote> quotes = new ArrayList<>(2);
        if (total.oddsOver() != null) {
            quotes.add(quote(PickSide.OVER, OddsConverter.normalizeToDecimal(total.oddsOver()), probOver));
        }
        if (total.oddsUnder() != null) {
            quotes.add(quote(PickSide.UNDER, OddsConverter.normalizeToDecimal(total.oddsUnder()), probUnder));
        }

        return EdgeMath.selectBest(quotes, minEdge).map(q -> Pick.of(
            analysis.eventId(), analysis.date(), MarketType.TOTAL, q.side(), null, line,
            q.odds(), q.modelProb(), q.impliedProb(), q.edge(), analysis.confidence(),
            String.format("Logistic totals model: projected %.2f vs line %.1f", projected, line),
            analysis.flags()));
    }

    public static double overProbability(double projectedTotal, double line) {
        return EdgeMath.clampProbability(1.0 / (1.0 + Math.exp(-(projectedTotal - line))));
    }

    private static EdgeMath.SideQuote quote(PickSide side, double odds, double prob) {
        double implied = OddsConverter.impliedProbability(odds);
        return new EdgeMath.SideQuote(side, odds, prob, implied, EdgeMath.normalizedEdge(prob, implied));
    }
}
