package com.edgeplatform.history.service;

import com.edgeplatform.common.exception.EdgeException;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.HistoricalGame;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.history.dto.PerformanceStatsDTO;
import com.edgeplatform.history.dto.ResultUpdateRequest;
import com.edgeplatform.history.model.PickRecord;
import com.edgeplatform.history.repository.EventRepository;
import com.edgeplatform.history.repository.PickRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PickLedgerServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 14);

    EventRepository eventRepository;
    PickRepository pickRepository;
    PickLedgerService service;

    @BeforeEach
    void setUp() {
        eventRepository = mock(EventRepository.class);
        pickRepository  = mock(PickRepository.class);
        service = new PickLedgerService(eventRepository, pickRepository,
            new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    private static PickRecord record(long id, String market, String side, String status,
                                     double stake, double odds, Double profit) {
        PickRecord r = new PickRecord();
        r.setId(id);
        r.setEventId("evt-" + id);
        r.setGameDate(DATE);
        r.setMarket(market);
        r.setSide(side);
        r.setLine("TOTAL".equals(market) ? 8.5 : null);
        r.setOdds(odds);
        r.setModelProb(0.58);
        r.setImpliedProb(1 / odds);
        r.setEdge(0.06);
        r.setConfidence(0.64);
        r.setStake(stake);
        r.setStatus(status);
        r.setProfit(profit);
        return r;
    }

    @Nested
    @DisplayName("storage")
    class Storage {

        @Test
        @DisplayName("saveEvent upserts by event id with the analysis as JSON")
        void saveEvent() {
            Analysis analysis = Analysis.fromProjections("evt-1", "New York Yankees", "Boston Red Sox",
                4.5, 4.0, null, 0.7, List.of());
            when(eventRepository.upsertEvent(anyString(), any(), any(), any(), any(), any(), any(), anyString()))
                .thenReturn(Mono.empty());

            StepVerifier.create(service.saveEvent(analysis)).verifyComplete();

            ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
            verify(eventRepository).upsertEvent(eq("evt-1"), eq("baseball"), eq("MLB"), isNull(),
                eq("New York Yankees"), eq("Boston Red Sox"), isNull(), json.capture());
            assertTrue(json.getValue().contains("\"totalRuns\":8.5"));
        }

        @Test
        @DisplayName("saveEvent without an id is rejected")
        void saveEventWithoutId() {
            Analysis analysis = Analysis.fromProjections(" ", "H", "A", 4.5, 4.0, null, 0.7, List.of());

            StepVerifier.create(service.saveEvent(analysis)).verifyError(EdgeException.class);
            verifyNoInteractions(eventRepository);
        }

        @Test
        @DisplayName("savePick stores a PENDING row")
        void savePick() {
            Pick pick = Pick.of("evt-1", DATE, MarketType.TOTAL, PickSide.UNDER, null, 8.5, 1.95,
                0.56, 1 / 1.95, 0.092, 0.63, "totals", List.of());
            when(pickRepository.save(any(PickRecord.class))).thenAnswer(inv -> {
                PickRecord r = inv.getArgument(0);
                r.setId(42L);
                return Mono.just(r);
            });

            StepVerifier.create(service.savePick(pick))
                .assertNext(saved -> {
                    assertEquals(42L, saved.getId());
                    assertEquals("PENDING", saved.getStatus());
                    assertEquals("TOTAL", saved.getMarket());
                    assertEquals("UNDER", saved.getSide());
                    assertEquals(8.5, saved.getLine());
                    assertNotNull(saved.getCreatedAt());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("savePick without a side is rejected")
        void savePickWithoutSide() {
            Pick pick = Pick.of("evt-1", DATE, MarketType.TOTAL, null, null, 8.5, 1.95,
                0.56, 1 / 1.95, 0.092, 0.63, "totals", List.of());

            StepVerifier.create(service.savePick(pick)).verifyError(EdgeException.class);
            verify(pickRepository, never()).save(any());
        }

        @Test
        @DisplayName("savePick without an edge or confidence is rejected rather than stored as zero")
        void savePickWithoutPricing() {
            Pick noEdge = new Pick("evt-1", DATE, MarketType.TOTAL, PickSide.UNDER, null, 8.5, 1.95,
                0.56, 1 / 1.95, null, 0.63, 1.0, null, null, "totals", List.of());
            Pick noConfidence = new Pick("evt-1", DATE, MarketType.TOTAL, PickSide.UNDER, null, 8.5, 1.95,
                0.56, 1 / 1.95, 0.092, null, 1.0, null, null, "totals", List.of());
            Pick noModelProb = new Pick("evt-1", DATE, MarketType.TOTAL, PickSide.UNDER, null, 8.5, 1.95,
                null, 1 / 1.95, 0.092, 0.63, 1.0, null, null, "totals", List.of());

            StepVerifier.create(service.savePick(noEdge)).verifyError(EdgeException.class);
            StepVerifier.create(service.savePick(noConfidence)).verifyError(EdgeException.class);
            StepVerifier.create(service.savePick(noModelProb)).verifyError(EdgeException.class);
            verify(pickRepository, never()).save(any());
        }

        @Test
        @DisplayName("recent limit defaults to 20 and is capped at 500")
        void recentLimit() {
            when(pickRepository.findRecent(anyInt())).thenReturn(Flux.empty());

            service.getRecentPicks(null).blockLast();
            service.getRecentPicks(10_000).blockLast();
            service.getRecentPicks(0).blockLast();

            verify(pickRepository).findRecent(20);
            verify(pickRepository).findRecent(500);
            verify(pickRepository).findRecent(1);
        }

        @Test
        @DisplayName("countPicks without a status counts everything")
        void count() {
            when(pickRepository.count()).thenReturn(Mono.just(7L));
            when(pickRepository.countByStatus("WIN")).thenReturn(Mono.just(3L));

            StepVerifier.create(service.countPicks(null)).expectNext(7L).verifyComplete();
            StepVerifier.create(service.countPicks("win")).expectNext(3L).verifyComplete();
        }
    }

    @Nested
    @DisplayName("updateResult")
    class UpdateResult {

        @Test
        @DisplayName("missing profit is derived from stake and odds")
        void derivesProfit() {
            when(pickRepository.findById(1L))
                .thenReturn(Mono.just(record(1, "MONEYLINE", "HOME", "PENDING", 100.0, 1.85, null)));
            when(pickRepository.updateResult(anyLong(), anyString(), any(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(service.updateResult(1L, new ResultUpdateRequest("win", "5-3", null)))
                .expectNext(true)
                .verifyComplete();

            ArgumentCaptor<Double> profit = ArgumentCaptor.forClass(Double.class);
            verify(pickRepository).updateResult(eq(1L), eq("WIN"), eq("5-3"), profit.capture());
            assertEquals(85.0, profit.getValue(), 1e-9);
        }

        @Test
        @DisplayName("unknown pick → false")
        void unknownPick() {
            when(pickRepository.findById(9L)).thenReturn(Mono.empty());

            StepVerifier.create(service.updateResult(9L, new ResultUpdateRequest("LOSS", null, -50.0)))
                .expectNext(false)
                .verifyComplete();
        }

        @Test
        @DisplayName("unknown result label is rejected")
        void badResult() {
            StepVerifier.create(service.updateResult(1L, new ResultUpdateRequest("CANCELLED", null, null)))
                .verifyError(EdgeException.class);
            verifyNoInteractions(pickRepository);
        }
    }

    @Nested
    @DisplayName("settlePending")
    class SettlePending {

        @Test
        @DisplayName("final games settle their pending picks, the rest stay pending")
        void settles() {
            PickRecord homeWin = record(1, "MONEYLINE", "HOME", "PENDING", 100.0, 2.0, null);
            PickRecord under   = record(2, "TOTAL", "UNDER", "PENDING", 50.0, 1.95, null);
            PickRecord noGame  = record(3, "MONEYLINE", "AWAY", "PENDING", 80.0, 2.10, null);
            when(pickRepository.findByStatusOrderByGameDateAsc("PENDING"))
                .thenReturn(Flux.just(homeWin, under, noGame));
            when(pickRepository.updateResult(anyLong(), anyString(), anyString(), anyDouble()))
                .thenReturn(Mono.just(1));

            List<HistoricalGame> games = List.of(
                new HistoricalGame("evt-1", DATE, "NYY", "BOS", 5, 3),
                new HistoricalGame("evt-2", DATE, "LAD", "SF", 6, 4));

            StepVerifier.create(service.settlePending(games))
                .assertNext(report -> {
                    assertEquals(3, report.checked());
                    assertEquals(2, report.settled());
                    assertEquals(1, report.stillPending());
                    assertEquals(100.0 - 50.0, report.profit(), 1e-9);
                })
                .verifyComplete();

            verify(pickRepository).updateResult(1L, "WIN", "5-3", 100.0);
            verify(pickRepository).updateResult(2L, "LOSS", "6-4", -50.0);
            verify(pickRepository, never()).updateResult(eq(3L), anyString(), anyString(), anyDouble());
        }

        @Test
        @DisplayName("a storage failure on one pick leaves it pending and the pass continues")
        void isolatesFailures() {
            PickRecord first  = record(1, "MONEYLINE", "HOME", "PENDING", 100.0, 2.0, null);
            PickRecord second = record(2, "MONEYLINE", "HOME", "PENDING", 100.0, 2.0, null);
            when(pickRepository.findByStatusOrderByGameDateAsc("PENDING")).thenReturn(Flux.just(first, second));
            when(pickRepository.updateResult(eq(1L), anyString(), anyString(), anyDouble()))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")));
            when(pickRepository.updateResult(eq(2L), anyString(), anyString(), anyDouble()))
                .thenReturn(Mono.just(1));

            List<HistoricalGame> games = List.of(
                new HistoricalGame("evt-1", DATE, "NYY", "BOS", 5, 3),
                new HistoricalGame("evt-2", DATE, "NYY", "BOS", 2, 3));

            StepVerifier.create(service.settlePending(games))
                .assertNext(report -> {
                    assertEquals(1, report.settled());
                    assertEquals(1, report.stillPending());
                    assertEquals(-100.0, report.profit(), 1e-9);
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("performance")
    class Performance {

        @Test
        @DisplayName("win rate ignores pushes, ROI counts settled stake only")
        void aggregates() {
            List<PickRecord> picks = List.of(
                record(1, "MONEYLINE", "HOME", "WIN", 100.0, 1.85, 85.0),
                record(2, "MONEYLINE", "AWAY", "LOSS", 100.0, 2.10, -100.0),
                record(3, "TOTAL", "OVER", "WIN", 50.0, 1.95, 47.5),
                record(4, "TOTAL", "UNDER", "PUSH", 50.0, 1.95, 0.0),
                record(5, "MONEYLINE", "HOME", "PENDING", 100.0, 1.85, null));

            PerformanceStatsDTO stats = PickLedgerService.aggregate(null, picks);

            assertEquals(5, stats.totalPicks());
            assertEquals(4, stats.settled());
            assertEquals(1, stats.pending());
            assertEquals(0.6667, stats.winRate(), 1e-9);
            assertEquals(300.0, stats.totalStake(), 1e-9);
            assertEquals(32.5, stats.totalProfit(), 1e-9);
            assertEquals(0.1083, stats.roi(), 1e-9);
            assertEquals(0.06, stats.avgEdge(), 1e-9);
        }

        @Test
        @DisplayName("no picks → all zeros")
        void empty() {
            PerformanceStatsDTO stats = PickLedgerService.aggregate("TOTAL", List.of());

            assertEquals(0, stats.totalPicks());
            assertEquals(0.0, stats.winRate());
            assertEquals(0.0, stats.roi());
        }

        @Test
        @DisplayName("market filter is normalized before querying")
        void filter() {
            when(pickRepository.findForStats("TOTAL", DATE, null)).thenReturn(Flux.empty());

            StepVerifier.create(service.getPerformanceStats(" total ", DATE, null))
                .assertNext(stats -> assertEquals("TOTAL", stats.market()))
                .verifyComplete();
        }

        @Test
        @DisplayName("by-market view has one row per market, alphabetically")
        void byMarket() {
            when(pickRepository.findForStats(null, null, null)).thenReturn(Flux.just(
                record(1, "TOTAL", "OVER", "WIN", 50.0, 1.95, 47.5),
                record(2, "MONEYLINE", "HOME", "LOSS", 100.0, 1.85, -100.0),
                record(3, "TOTAL", "UNDER", "LOSS", 50.0, 1.95, -50.0)));

            StepVerifier.create(service.getPerformanceByMarket())
                .assertNext(ml -> {
                    assertEquals("MONEYLINE", ml.market());
                    assertEquals(1, ml.totalPicks());
                })
                .assertNext(totals -> {
                    assertEquals("TOTAL", totals.market());
                    assertEquals(2, totals.totalPicks());
                    assertEquals(0.5, totals.winRate());
                })
                .verifyComplete();
        }
    }
}
