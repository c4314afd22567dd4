package com.edgeplatform.analysis.adapter;

import com.edgeplatform.analysis.feed.GameFeed;
import com.edgeplatform.common.exception.OddsFormatException;
import com.edgeplatform.common.market.MarketEvaluator;
import com.edgeplatform.common.metrics.GameReliabilityCalculator;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.MarketOdds;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.projection.GameProjector;
import com.edgeplatform.common.sport.OddsProvider;
import com.edgeplatform.common.sport.SportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MLB implementation of {@link SportAdapter}: games from the {@link GameFeed}, projections from
 * {@link GameProjector}, prices from the event itself or else the {@link OddsProvider}.
 */
@Component
public class MlbAdapter implements SportAdapter {

    private static final Logger log = LoggerFactory.getLogger(MlbAdapter.class);

    static final String SPORT  = "baseball";
    static final String LEAGUE = "MLB";

    private final GameFeed feed;
    private final OddsProvider oddsProvider;
    private final List<MarketEvaluator> evaluators;
    private final RiskProfile profile;

    public MlbAdapter(GameFeed feed, OddsProvider oddsProvider, List<MarketEvaluator> evaluators,
                      RiskProfile profile) {
        this.feed         = feed;
        this.oddsProvider = oddsProvider;
        this.evaluators   = evaluators;
        this.profile      = profile;
    }

    @Override
    public String sport() {
        return SPORT;
    }

    @Override
    public String league() {
        return LEAGUE;
    }

    @Override
    public List<GameEvent> getEvents(LocalDate date) {
        List<GameEvent> events = feed.eventsFor(date);
        log.info("[MlbAdapter] {} games scheduled for date={}", events.size(), date);
        return events;
    }

    @Override
    public Analysis analyzeEvent(GameEvent event) {
        Analysis analysis = GameProjector.analyze(event, SPORT, LEAGUE);
        if (!hasPrices(analysis.market())) {
            MarketOdds quoted = oddsProvider.getMarkets(analysis);
            analysis = analysis.withMarket(quoted);
            log.info("[MlbAdapter] No event prices, quoted by {} eventId={}",
                oddsProvider.getClass().getSimpleName(), event.eventId());
        }
        Double marketConfidence = hasPrices(analysis.market()) ? null : 0.0;
        analysis = analysis.withReliability(GameReliabilityCalculator.forGame(analysis.metrics(), marketConfidence));

        log.info("[MlbAdapter] Analyzed eventId={} {} {} - {} {} total={} confidence={} reliability={}",
            event.eventId(), analysis.homeTeam(), fmt(analysis.homeRuns()), fmt(analysis.awayRuns()),
            analysis.awayTeam(), fmt(analysis.totalRuns()), fmt(analysis.confidence()),
            analysis.reliability().tier());
        return analysis;
    }

    /**
     * Unstaked candidate picks, at most one per market. A market with malformed odds is skipped;
     * the other markets are still evaluated.
     */
    @Override
    public List<Pick> generatePicks(Analysis analysis) {
        List<Pick> picks = new ArrayList<>();
        for (MarketEvaluator evaluator : evaluators) {
            try {
                Optional<Pick> pick = evaluator.evaluate(analysis, profile);
                pick.ifPresent(picks::add);
            } catch (OddsFormatException e) {
                log.warn("[MlbAdapter] Skipping market={} eventId={} (non-fatal): {}",
                    evaluator.market(), analysis.eventId(), e.getMessage());
            }
        }
        return picks;
    }

    private static boolean hasPrices(MarketOdds market) {
        return market != null && (market.moneyline() != null || market.total() != null);
    }

    private static String fmt(Double value) {
        return value != null ? String.format("%.2f", value) : "n/a";
    }
}
