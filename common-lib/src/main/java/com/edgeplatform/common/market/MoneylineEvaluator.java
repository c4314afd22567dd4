package com.edgeplatform.common.market;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.MoneylineOdds;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.common.odds.OddsConverter;
import com.edgeplatform.common.simulation.RandomStreamFactory;
import com.edgeplatform.common.simulation.WinProbability;
import com.edgeplatform.common.simulation.WinProbabilitySimulator;

import java.util.List;
import java.util.Optional;

/**
 * Moneyline evaluator driven by the Monte Carlo simulator.
 *
 * <pre>
 *   pHome   = qualityPenalty(simulated P(home))      pAway = 1 − pHome
 *   implied = 1 / decimalOdds
 *   edge    = (p − implied) / implied
 *   conf    = (analysis confidence + p) / 2
 * </pre>
 * Home is evaluated before away; see {@link EdgeMath#selectBest} for the tie-break.
 */
public class MoneylineEvaluator implements MarketEvaluator {

    private static final String RATIONALE =
        "Monte Carlo moneyline (starter + bullpen phases), adjusted for data quality";

    private final WinProbabilitySimulator simulator;
    private final RandomStreamFactory streams;
    private final int trials;

    public MoneylineEvaluator(WinProbabilitySimulator simulator, RandomStreamFactory streams, int trials) {
        this.simulator = simulator;
        this.streams   = streams;
        this.trials    = trials;
    }

    @Override
    public MarketType market() {
        return MarketType.MONEYLINE;
    }

    @Override
    public Optional<Pick> evaluate(Analysis analysis, double minEdge, double minConfidence) {
        MoneylineOdds odds = analysis.market() != null ? analysis.market().moneyline() : null;
        if (odds == null || odds.home() == null || odds.away() == null) return Optional.empty();
        if (!analysis.hasProjections()) return Optional.empty();
        if (analysis.confidence() < minConfidence) return Optional.empty();

        double homeOdds = OddsConverter.normalizeToDecimal(odds.home());
        double awayOdds = OddsConverter.normalizeToDecimal(odds.away());

        WinProbability sim = simulator.simulate(analysis.homeRuns(), analysis.awayRuns(),
            analysis.homeBullpenEra(), analysis.awayBullpenEra(), trials,
            streams.streamFor(analysis.eventId()));

        double probHome = EdgeMath.applyQualityPenalty(sim.homeWinProb(), analysis.flags());
        double probAway = 1.0 - probHome;
        double impHome  = OddsConverter.impliedProbability(homeOdds);
        double impAway  = OddsConverter.impliedProbability(awayOdds);

        List<EdgeMath.SideQuote> quotes = List.of(
            new EdgeMath.SideQuote(PickSide.HOME, homeOdds, probHome, impHome, EdgeMath.normalizedEdge(probHome, impHome)),
            new EdgeMath.SideQuote(PickSide.AWAY, awayOdds, probAway, impAway, EdgeMath.normalizedEdge(probAway, impAway)));

        return EdgeMath.selectBest(quotes, minEdge).map(q -> Pick.of(
            analysis.eventId(), analysis.date(), MarketType.MONEYLINE, q.side(),
            q.side() == PickSide.HOME ? analysis.homeTeam() : analysis.awayTeam(),
            null, q.odds(), q.modelProb(), q.impliedProb(), q.edge(),
            (analysis.confidence() + q.modelProb()) / 2.0,
            String.format("%s; P(home)=%.3f over %d trials", RATIONALE, sim.homeWinProb(), sim.trials()),
            analysis.flags()));
    }
}
