package com.edgeplatform.history.service;

import com.edgeplatform.common.backtest.BacktestEngine;
import com.edgeplatform.common.backtest.BacktestSummary;
import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.history.dto.BacktestRequest;
import com.edgeplatform.history.dto.BacktestResponse;
import com.edgeplatform.history.repository.PickRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays picks against final scores. Picks come from the request or, when it carries none,
 * from the ledger for the requested games.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final BacktestEngine defaultEngine;
    private final PickRepository pickRepository;

    public BacktestService(BacktestEngine defaultEngine, PickRepository pickRepository) {
        this.defaultEngine  = defaultEngine;
        this.pickRepository = pickRepository;
    }

    public Mono<BacktestResponse> run(BacktestRequest request) {
        List<HistoricalGame> games = request.games() != null ? request.games() : List.of();
        BacktestEngine engine = request.initialBankroll() != null && request.initialBankroll() > 0
            ? new BacktestEngine(request.initialBankroll())
            : defaultEngine;

        Map<String, HistoricalGame> byId = new HashMap<>();
        Set<String> eventIds = new LinkedHashSet<>();
        for (HistoricalGame game : games) {
            if (game == null || game.eventId() == null) continue;
            byId.put(game.eventId(), game);
            eventIds.add(game.eventId());
        }

        Flux<Pick> picks = request.picks() != null && !request.picks().isEmpty()
            ? Flux.fromIterable(request.picks())
            : Flux.fromIterable(eventIds)
                .concatMap(pickRepository::findByEventIdOrderByCreatedAtAsc)
                .map(PickMapper::toPick);

        log.info("[Backtest] Starting. games={} picks={} initialBankroll={}",
            games.size(), request.picks() != null && !request.picks().isEmpty() ? "request" : "ledger",
            engine.initialBankroll());

        return picks
            .concatMap(pick -> Mono.fromCallable(() -> engine.settle(pick, byId.get(pick.eventId())))
                .onErrorResume(e -> {
                    log.warn("[Backtest] Pick skipped (non-fatal). eventId={}", pick.eventId(), e);
                    return Mono.empty();
                }))
            .collectList()
            .map(results -> {
                BacktestSummary summary = engine.summarize(results);
                log.info("[Backtest] Done. bets={} wins={} losses={} pushes={} pending={} profit={} roi={}",
                    summary.totalBets(), summary.wins(), summary.losses(), summary.pushes(), summary.pending(),
                    String.format("%.2f", summary.totalProfit()), String.format("%.4f", summary.roi()));
                return new BacktestResponse(List.copyOf(results), summary);
            });
    }
}
