package com.edgeplatform.history.controller;

import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.history.dto.BacktestRequest;
import com.edgeplatform.history.dto.BacktestResponse;
import com.edgeplatform.history.dto.PerformanceStatsDTO;
import com.edgeplatform.history.dto.ResultUpdateRequest;
import com.edgeplatform.history.dto.SettlementReportDTO;
import com.edgeplatform.history.model.PickRecord;
import com.edgeplatform.history.service.BacktestService;
import com.edgeplatform.history.service.PickLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final PickLedgerService ledgerService;
    private final BacktestService backtestService;

    public HistoryController(PickLedgerService ledgerService, BacktestService backtestService) {
        this.ledgerService   = ledgerService;
        this.backtestService = backtestService;
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<Void>> saveEvent(@RequestBody Analysis analysis) {
        log.info("Received event for persistence. eventId={}", analysis.eventId());
        return ledgerService.saveEvent(analysis)
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PostMapping("/picks")
    public Mono<ResponseEntity<Map<String, Long>>> savePick(@RequestBody Pick pick) {
        log.info("Received pick for persistence. eventId={} market={} side={}",
                 pick.eventId(), pick.market(), pick.side());
        return ledgerService.savePick(pick)
            .map(saved -> ResponseEntity.ok(Map.of("id", saved.getId())));
    }

    @GetMapping("/picks/{id}")
    public Mono<ResponseEntity<PickRecord>> getPick(@PathVariable Long id) {
        return ledgerService.getPick(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/picks/pending")
    public Flux<PickRecord> pending() {
        return ledgerService.getPendingPicks();
    }

    @GetMapping("/picks")
    public Flux<PickRecord> byDate(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ledgerService.getPicksByDate(date);
    }

    @GetMapping("/picks/event/{eventId}")
    public Flux<PickRecord> byEvent(@PathVariable String eventId) {
        return ledgerService.getPicksByEvent(eventId);
    }

    @GetMapping("/picks/recent")
    public Flux<PickRecord> recent(@RequestParam(required = false) Integer limit) {
        return ledgerService.getRecentPicks(limit);
    }

    @GetMapping("/picks/count")
    public Mono<ResponseEntity<Map<String, Long>>> count(@RequestParam(required = false) String status) {
        return ledgerService.countPicks(status)
            .map(n -> ResponseEntity.ok(Map.of("count", n)));
    }

    @PutMapping("/picks/{id}/result")
    public Mono<ResponseEntity<Void>> updateResult(@PathVariable Long id, @RequestBody ResultUpdateRequest request) {
        log.info("Result update received. id={} result={}", id, request.result());
        return ledgerService.updateResult(id, request)
            .map(updated -> updated
                ? ResponseEntity.ok().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @PostMapping("/picks/settle")
    public Mono<ResponseEntity<SettlementReportDTO>> settle(@RequestBody List<HistoricalGame> games) {
        log.info("Settlement pass requested. games={}", games.size());
        return ledgerService.settlePending(games)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/performance")
    public Mono<ResponseEntity<PerformanceStatsDTO>> performance(
            @RequestParam(required = false) String market,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ledgerService.getPerformanceStats(market, from, to)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/performance/by-market")
    public Flux<PerformanceStatsDTO> performanceByMarket() {
        return ledgerService.getPerformanceByMarket();
    }

    @PostMapping("/backtest")
    public Mono<ResponseEntity<BacktestResponse>> backtest(@RequestBody BacktestRequest request) {
        return backtestService.run(request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Backtest endpoint error", e));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
