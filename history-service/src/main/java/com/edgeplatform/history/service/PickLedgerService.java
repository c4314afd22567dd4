package com.edgeplatform.history.service;

import com.edgeplatform.common.backtest.SettlementMatcher;
import com.edgeplatform.common.backtest.SettlementOutcome;
import com.edgeplatform.common.exception.EdgeException;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.history.dto.PerformanceStatsDTO;
import com.edgeplatform.history.dto.ResultUpdateRequest;
import com.edgeplatform.history.dto.SettlementReportDTO;
import com.edgeplatform.history.model.PickRecord;
import com.edgeplatform.history.repository.EventRepository;
import com.edgeplatform.history.repository.PickRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pick ledger: stores analyzed events and picks, records settlements and aggregates performance.
 */
@Service
public class PickLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PickLedgerService.class);

    static final int DEFAULT_RECENT_LIMIT = 20;
    static final int MAX_RECENT_LIMIT     = 500;

    private static final Set<String> RESULTS = Set.of("WIN", "LOSS", "PUSH", PickRecord.PENDING);

    private final EventRepository eventRepository;
    private final PickRepository pickRepository;
    private final ObjectMapper objectMapper;

    public PickLedgerService(EventRepository eventRepository, PickRepository pickRepository,
                             ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.pickRepository  = pickRepository;
        this.objectMapper    = objectMapper;
    }

    // ── Events and picks ────────────────────────────────────────────────────

    public Mono<Void> saveEvent(Analysis analysis) {
        if (analysis == null || analysis.eventId() == null || analysis.eventId().isBlank()) {
            return Mono.error(new EdgeException("PickLedger", "Event id is required"));
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(analysis))
            .flatMap(json -> eventRepository.upsertEvent(analysis.eventId(), analysis.sport(), analysis.league(),
                analysis.date(), analysis.homeTeam(), analysis.awayTeam(), analysis.venue(), json))
            .doOnSuccess(v -> log.info("[PickLedger] Event stored. eventId={} {} vs {}",
                analysis.eventId(), analysis.homeTeam(), analysis.awayTeam()))
            .doOnError(e -> log.error("[PickLedger] Failed to store event. eventId={}", analysis.eventId(), e));
    }

    public Mono<PickRecord> savePick(Pick pick) {
        if (pick == null || pick.eventId() == null || pick.market() == null || pick.side() == null
                || pick.odds() == null) {
            return Mono.error(new EdgeException("PickLedger", "Pick needs eventId, market, side and odds"));
        }
        if (pick.modelProb() == null || pick.impliedProb() == null || pick.edge() == null
                || pick.confidence() == null) {
            return Mono.error(new EdgeException("PickLedger",
                "Pick needs modelProb, impliedProb, edge and confidence. eventId=" + pick.eventId()));
        }
        PickRecord record = PickMapper.toRecord(pick);
        record.setCreatedAt(LocalDateTime.now());
        return pickRepository.save(record)
            .doOnSuccess(r -> log.info("[PickLedger] Pick stored. id={} eventId={} market={} side={} edge={}",
                r.getId(), r.getEventId(), r.getMarket(), r.getSide(), String.format("%.4f", r.getEdge())))
            .doOnError(e -> log.error("[PickLedger] Failed to store pick. eventId={}", pick.eventId(), e));
    }

    public Mono<PickRecord> getPick(Long id) {
        return pickRepository.findById(id);
    }

    public Flux<PickRecord> getPendingPicks() {
        return pickRepository.findByStatusOrderByGameDateAsc(PickRecord.PENDING);
    }

    public Flux<PickRecord> getPicksByDate(LocalDate date) {
        return pickRepository.findByGameDateOrderByEdgeDesc(date);
    }

    public Flux<PickRecord> getPicksByEvent(String eventId) {
        return pickRepository.findByEventIdOrderByCreatedAtAsc(eventId);
    }

    public Flux<PickRecord> getRecentPicks(Integer limit) {
        int n = limit == null ? DEFAULT_RECENT_LIMIT : Math.max(1, Math.min(limit, MAX_RECENT_LIMIT));
        return pickRepository.findRecent(n);
    }

    public Mono<Long> countPicks(String status) {
        if (status == null || status.isBlank()) {
            return pickRepository.count();
        }
        return pickRepository.countByStatus(status.trim().toUpperCase(Locale.ROOT));
    }

    // ── Settlement ──────────────────────────────────────────────────────────

    /**
     * Records a result for one pick. When no profit is given for a WIN, LOSS or PUSH it is
     * derived from the stored stake and odds.
     *
     * @return true if the pick existed and was updated
     */
    public Mono<Boolean> updateResult(Long id, ResultUpdateRequest request) {
        String result = request != null && request.result() != null
            ? request.result().trim().toUpperCase(Locale.ROOT) : null;
        if (result == null || !RESULTS.contains(result)) {
            return Mono.error(new EdgeException("PickLedger", "Result must be one of " + RESULTS + ", got "
                + (request != null ? request.result() : null)));
        }
        return pickRepository.findById(id)
            .flatMap(pick -> {
                Double profit = request.profit() != null
                    ? request.profit()
                    : derivedProfit(SettlementOutcome.valueOf(result), pick);
                return pickRepository.updateResult(id, result, request.actualOutcome(), profit);
            })
            .map(rows -> rows > 0)
            .defaultIfEmpty(false)
            .doOnNext(updated -> {
                if (updated) log.info("[PickLedger] Pick settled. id={} result={}", id, result);
                else         log.warn("[PickLedger] Pick not found. id={}", id);
            });
    }

    /**
     * Settles every pending pick whose game has a final score. Picks without a matching final
     * game stay pending; a pick that fails to settle is logged and left pending.
     */
    public Mono<SettlementReportDTO> settlePending(List<HistoricalGame> games) {
        Map<String, HistoricalGame> byId = new HashMap<>();
        for (HistoricalGame game : games) {
            if (game != null && game.eventId() != null) byId.put(game.eventId(), game);
        }
        return getPendingPicks()
            .concatMap(record -> settleOne(record, byId.get(record.getEventId()))
                .onErrorResume(e -> {
                    log.warn("[PickLedger] Settlement failed (non-fatal), left pending. id={} eventId={}",
                        record.getId(), record.getEventId(), e);
                    return Mono.just(Double.NaN);
                }))
            .collectList()
            .map(outcomes -> {
                int settled = 0;
                double profit = 0.0;
                for (Double p : outcomes) {
                    if (!p.isNaN()) {
                        settled++;
                        profit += p;
                    }
                }
                log.info("[PickLedger] Settlement pass. checked={} settled={} profit={}",
                    outcomes.size(), settled, String.format("%.2f", profit));
                return new SettlementReportDTO(outcomes.size(), settled, outcomes.size() - settled, profit);
            });
    }

    /** Emits the booked profit, or NaN when the pick stays pending. */
    private Mono<Double> settleOne(PickRecord record, HistoricalGame game) {
        SettlementOutcome outcome = SettlementMatcher.settle(PickMapper.toPick(record), game);
        if (!outcome.isSettled()) {
            if (outcome == SettlementOutcome.UNKNOWN) {
                log.warn("[PickLedger] Cannot settle market={} side={} id={}",
                    record.getMarket(), record.getSide(), record.getId());
            }
            return Mono.just(Double.NaN);
        }
        double profit = derivedProfit(outcome, record);
        String score = game.homeScore() + "-" + game.awayScore();
        return pickRepository.updateResult(record.getId(), outcome.name(), score, profit)
            .map(rows -> rows > 0 ? profit : Double.NaN);
    }

    private static Double derivedProfit(SettlementOutcome outcome, PickRecord pick) {
        if (!outcome.isSettled()) return null;
        double stake = pick.getStake() != null ? pick.getStake() : 0.0;
        return SettlementMatcher.profit(outcome, stake, pick.getOdds());
    }

    // ── Performance ─────────────────────────────────────────────────────────

    public Mono<PerformanceStatsDTO> getPerformanceStats(String market, LocalDate from, LocalDate to) {
        String marketFilter = market == null || market.isBlank() ? null : market.trim().toUpperCase(Locale.ROOT);
        return pickRepository.findForStats(marketFilter, from, to)
            .collectList()
            .map(picks -> aggregate(marketFilter, picks));
    }

    public Flux<PerformanceStatsDTO> getPerformanceByMarket() {
        return pickRepository.findForStats(null, null, null)
            .collectList()
            .flatMapMany(picks -> {
                Map<String, List<PickRecord>> byMarket = new TreeMap<>();
                for (PickRecord p : picks) {
                    String key = p.getMarket() != null ? p.getMarket() : "UNKNOWN";
                    byMarket.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
                }
                return Flux.fromIterable(byMarket.entrySet())
                    .map(e -> aggregate(e.getKey(), e.getValue()));
            });
    }

    static PerformanceStatsDTO aggregate(String market, List<PickRecord> picks) {
        long wins = 0, losses = 0, pushes = 0, pending = 0;
        double settledStake = 0.0, profit = 0.0, edge = 0.0, confidence = 0.0, odds = 0.0;
        for (PickRecord p : picks) {
            String status = p.getStatus() != null ? p.getStatus() : PickRecord.PENDING;
            switch (status) {
                case "WIN"  -> wins++;
                case "LOSS" -> losses++;
                case "PUSH" -> pushes++;
                default     -> pending++;
            }
            if ("WIN".equals(status) || "LOSS".equals(status) || "PUSH".equals(status)) {
                settledStake += p.getStake() != null ? p.getStake() : 0.0;
                profit       += p.getProfit() != null ? p.getProfit() : 0.0;
            }
            edge       += p.getEdge();
            confidence += p.getConfidence();
            odds       += p.getOdds();
        }
        int n = picks.size();
        long decided = wins + losses;
        return new PerformanceStatsDTO(market, n, wins + losses + pushes, wins, losses, pushes, pending,
            decided > 0 ? round4((double) wins / decided) : 0.0,
            settledStake, profit,
            settledStake > 0 ? round4(profit / settledStake) : 0.0,
            n > 0 ? round4(edge / n) : 0.0,
            n > 0 ? round4(confidence / n) : 0.0,
            n > 0 ? round4(odds / n) : 0.0);
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
