package com.edgeplatform.history.service;

import com.edgeplatform.common.backtest.BacktestEngine;
import com.edgeplatform.common.backtest.SettlementOutcome;
import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.history.dto.BacktestRequest;
import com.edgeplatform.history.model.PickRecord;
import com.edgeplatform.history.repository.PickRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BacktestServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 14);

    PickRepository pickRepository;
    BacktestService service;

    @BeforeEach
    void setUp() {
        pickRepository = mock(PickRepository.class);
        service = new BacktestService(new BacktestEngine(), pickRepository);
    }

    private static Pick pick(String eventId, MarketType market, PickSide side, Double line, double odds, double stake) {
        return new Pick(eventId, DATE, market, side, null, line, odds, 0.58, 1 / odds, 0.05, 0.64,
            1.0, stake / 10_000, stake, "test", List.of());
    }

    @Test
    @DisplayName("submitted picks are settled against submitted games")
    void submittedPicks() {
        List<HistoricalGame> games = List.of(
            new HistoricalGame("evt-1", DATE, "NYY", "BOS", 5, 3),
            new HistoricalGame("evt-2", DATE, "LAD", "SF", 2, 2));
        List<Pick> picks = List.of(
            pick("evt-1", MarketType.MONEYLINE, PickSide.HOME, null, 2.0, 100),
            pick("evt-1", MarketType.TOTAL, PickSide.OVER, 8.5, 2.0, 50),
            pick("evt-2", MarketType.MONEYLINE, PickSide.AWAY, null, 2.0, 100),
            pick("evt-9", MarketType.MONEYLINE, PickSide.HOME, null, 2.0, 100));

        StepVerifier.create(service.run(new BacktestRequest(games, picks, null)))
            .assertNext(response -> {
                assertEquals(4, response.results().size());
                assertEquals(SettlementOutcome.WIN, response.results().get(0).outcome());
                assertEquals(SettlementOutcome.LOSS, response.results().get(1).outcome());
                assertEquals(SettlementOutcome.PUSH, response.results().get(2).outcome());
                assertEquals(SettlementOutcome.PENDING, response.results().get(3).outcome());

                assertEquals(3, response.summary().totalBets());
                assertEquals(1, response.summary().pending());
                assertEquals(50.0, response.summary().totalProfit(), 1e-9);
                assertEquals(10_050.0, response.summary().finalBankroll(), 1e-9);
            })
            .verifyComplete();
        verifyNoInteractions(pickRepository);
    }

    @Test
    @DisplayName("without picks in the request, stored picks of those games are replayed")
    void storedPicks() {
        PickRecord stored = new PickRecord();
        stored.setEventId("evt-1");
        stored.setGameDate(DATE);
        stored.setMarket("MONEYLINE");
        stored.setSide("AWAY");
        stored.setOdds(2.5);
        stored.setModelProb(0.45);
        stored.setImpliedProb(0.4);
        stored.setEdge(0.125);
        stored.setConfidence(0.62);
        stored.setStake(40.0);
        when(pickRepository.findByEventIdOrderByCreatedAtAsc("evt-1")).thenReturn(Flux.just(stored));

        BacktestRequest request = new BacktestRequest(
            List.of(new HistoricalGame("evt-1", DATE, "NYY", "BOS", 5, 3)), null, 1_000.0);

        StepVerifier.create(service.run(request))
            .assertNext(response -> {
                assertEquals(1, response.results().size());
                assertEquals(SettlementOutcome.LOSS, response.results().get(0).outcome());
                assertEquals(1_000.0, response.summary().initialBankroll());
                assertEquals(960.0, response.summary().finalBankroll(), 1e-9);
            })
            .verifyComplete();
        verify(pickRepository).findByEventIdOrderByCreatedAtAsc("evt-1");
    }

    @Test
    @DisplayName("an unreadable stored pick settles UNKNOWN without stopping the run")
    void unreadableStoredPick() {
        PickRecord broken = new PickRecord();
        broken.setEventId("evt-1");
        broken.setMarket("PARLAY");
        broken.setSide("HOME");
        broken.setOdds(2.0);
        broken.setStake(10.0);
        when(pickRepository.findByEventIdOrderByCreatedAtAsc(anyString())).thenReturn(Flux.just(broken));

        BacktestRequest request = new BacktestRequest(
            List.of(new HistoricalGame("evt-1", DATE, "NYY", "BOS", 5, 3)), List.of(), null);

        StepVerifier.create(service.run(request))
            .assertNext(response -> {
                assertEquals(SettlementOutcome.UNKNOWN, response.results().get(0).outcome());
                assertEquals(0, response.summary().totalBets());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("empty request → empty summary")
    void empty() {
        StepVerifier.create(service.run(new BacktestRequest(null, null, null)))
            .assertNext(response -> {
                assertTrue(response.results().isEmpty());
                assertEquals(0, response.summary().totalBets());
                assertEquals(BacktestEngine.DEFAULT_INITIAL_BANKROLL, response.summary().finalBankroll());
            })
            .verifyComplete();
    }
}
