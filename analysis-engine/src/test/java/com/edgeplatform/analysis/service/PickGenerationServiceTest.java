package com.edgeplatform.analysis.service;

import com.edgeplatform.analysis.TestGames;
import com.edgeplatform.analysis.config.EdgeProperties;
import com.edgeplatform.analysis.publisher.PickPublisher;
import com.edgeplatform.common.correlation.CorrelationStakeMultiplier;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.GameReliability;
import com.edgeplatform.common.model.MarketOdds;
import com.edgeplatform.common.model.MarketType;
import com.edgeplatform.common.model.MoneylineOdds;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.PickSide;
import com.edgeplatform.common.model.ReliabilityTier;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.model.TotalsOdds;
import com.edgeplatform.common.sport.SportAdapter;
import com.edgeplatform.common.staking.FractionalKelly;
import com.edgeplatform.common.staking.StakeEngine;
import com.edgeplatform.common.validation.PickValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PickGenerationServiceTest {

    private SportAdapter adapter;
    private PickPublisher publisher;
    private PickGenerationService service;

    @BeforeEach
    void setUp() {
        adapter   = mock(SportAdapter.class);
        publisher = mock(PickPublisher.class);
        service   = new PickGenerationService(adapter, new StakeEngine(RiskProfile.BALANCED),
            new PickValidator(RiskProfile.BALANCED), publisher, new EdgeProperties());
    }

    private static Analysis analysis(String eventId, double home, double away) {
        MarketOdds market = new MarketOdds(new MoneylineOdds(1.85, 2.10), new TotalsOdds(8.5, 1.95, 1.95));
        return Analysis.fromProjections(eventId, "New York Yankees", "Boston Red Sox", home, away,
            market, 0.70, List.of());
    }

    /** A moneyline pick whose edge is consistent with its probabilities. */
    private static Pick moneyline(String eventId, double modelProb) {
        double implied = 1 / 1.85;
        return Pick.of(eventId, TestGames.DATE, MarketType.MONEYLINE, PickSide.HOME, "New York Yankees", null,
            1.85, modelProb, implied, (modelProb - implied) / implied, 0.65, "test moneyline", List.of());
    }

    private static Pick over(String eventId) {
        double implied = 1 / 1.95;
        return Pick.of(eventId, TestGames.DATE, MarketType.TOTAL, PickSide.OVER, null, 8.5,
            1.95, 0.56, implied, (0.56 - implied) / implied, 0.63, "test totals", List.of());
    }

    private static Pick under(String eventId) {
        double implied = 1 / 1.95;
        return Pick.of(eventId, TestGames.DATE, MarketType.TOTAL, PickSide.UNDER, null, 8.5,
            1.95, 0.56, implied, (0.56 - implied) / implied, 0.63, "test totals", List.of());
    }

    private static double uncorrelatedStake(Pick pick) {
        return FractionalKelly.stakeFraction(pick.odds(), pick.modelProb(),
            RiskProfile.BALANCED.kellyFraction(), RiskProfile.BALANCED.maxStakePct())
            * pick.market().stakeMultiplier();
    }

    private void stubGame(String eventId, Analysis analysis, List<Pick> picks) {
        GameEvent event = TestGames.stub(eventId);
        when(adapter.analyzeEvent(event)).thenReturn(analysis);
        when(adapter.generatePicks(analysis)).thenReturn(picks);
    }

    @Nested
    @DisplayName("per game")
    class PerGame {

        @Test
        @DisplayName("valid picks come back staked and are published")
        void stakesAndPublishes() {
            Analysis a = analysis("evt-1", 4.5, 4.0);
            stubGame("evt-1", a, List.of(moneyline("evt-1", 0.60), over("evt-1")));

            StepVerifier.create(service.generate(List.of(TestGames.stub("evt-1"))))
                .assertNext(picks -> {
                    assertEquals(2, picks.size());
                    picks.forEach(p -> {
                        assertTrue(p.stakePct() > 0 && p.stakePct() <= RiskProfile.BALANCED.maxStakePct());
                        assertTrue(p.stake() > 0);
                    });
                })
                .verifyComplete();

            verify(publisher).publishEvent(a);
            verify(publisher, times(2)).publishPick(any(Pick.class));
        }

        @Test
        @DisplayName("pick below the profile's edge floor is rejected")
        void lowEdgeRejected() {
            stubGame("evt-1", analysis("evt-1", 4.5, 4.0), List.of(moneyline("evt-1", 0.545)));

            StepVerifier.create(service.generate(List.of(TestGames.stub("evt-1"))))
                .assertNext(picks -> assertTrue(picks.isEmpty()))
                .verifyComplete();
            verify(publisher, never()).publishPick(any());
        }

        @Test
        @DisplayName("unreliable game never reaches the evaluators")
        void reliabilityGate() {
            Analysis unreliable = analysis("evt-1", 4.5, 4.0)
                .withReliability(new GameReliability(0.40, ReliabilityTier.DISCARD, false, List.of("PITCHING")));
            when(adapter.analyzeEvent(any())).thenReturn(unreliable);

            assertTrue(service.picksForGame(TestGames.stub("evt-1")).isEmpty());
            verify(adapter, never()).generatePicks(any());
            verify(publisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("implausible projection is dropped")
        void invalidProjection() {
            when(adapter.analyzeEvent(any())).thenReturn(analysis("evt-1", 0.2, 4.0));

            assertTrue(service.picksForGame(TestGames.stub("evt-1")).isEmpty());
            verify(adapter, never()).generatePicks(any());
        }

        @Test
        @DisplayName("moneyline pick carries the correlation multiplier")
        void correlationApplied() {
            Analysis highScoring = analysis("evt-1", 5.5, 4.5);
            when(adapter.analyzeEvent(any())).thenReturn(highScoring);
            when(adapter.generatePicks(highScoring)).thenReturn(List.of(moneyline("evt-1", 0.62)));

            Pick pick = service.picksForGame(TestGames.stub("evt-1")).get(0);

            assertTrue(pick.effectiveCorrelation() > 1.0);
            assertTrue(pick.rationale().contains("Favorite aligned with high-scoring projection"));
        }
    }

    @Nested
    @DisplayName("correlated staking")
    class CorrelatedStaking {

        @Test
        @DisplayName("a held moneyline/Under pair is staked at the Under multiplier")
        void pairHeld() {
            stubGame("evt-1", analysis("evt-1", 4.5, 4.0), List.of(moneyline("evt-1", 0.60), under("evt-1")));

            StepVerifier.create(service.generate(List.of(TestGames.stub("evt-1"))))
                .assertNext(picks -> {
                    assertEquals(2, picks.size());
                    picks.forEach(p -> assertEquals(
                        uncorrelatedStake(p) * CorrelationStakeMultiplier.WITH_UNDER, p.stakePct(), 1e-9));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an Under whose moneyline partner is rejected keeps its full stake")
        void partnerRejected() {
            // 7.5 projected against 8.5 trims the favorite's 3.1% edge below the 3% floor
            Pick favorite = moneyline("evt-1", 0.5573);
            stubGame("evt-1", analysis("evt-1", 4.0, 3.5), List.of(favorite, under("evt-1")));

            StepVerifier.create(service.generate(List.of(TestGames.stub("evt-1"))))
                .assertNext(picks -> {
                    assertEquals(1, picks.size());
                    Pick total = picks.get(0);
                    assertEquals(MarketType.TOTAL, total.market());
                    assertEquals(uncorrelatedStake(total), total.stakePct(), 1e-9);
                    assertTrue(total.stakePct() > 0.0217 && total.stakePct() < 0.0219);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a moneyline whose totals partner is cut by the daily cap keeps its full stake")
        void partnerCutByDailyCap() {
            List<GameEvent> slate = new ArrayList<>();
            stubGame("evt-1", analysis("evt-1", 4.5, 4.0), List.of(moneyline("evt-1", 0.60), over("evt-1")));
            slate.add(TestGames.stub("evt-1"));
            for (int i = 2; i <= 5; i++) {
                stubGame("evt-" + i, analysis("evt-" + i, 4.5, 4.0), List.of(moneyline("evt-" + i, 0.60)));
                slate.add(TestGames.stub("evt-" + i));
            }

            StepVerifier.create(service.generate(slate))
                .assertNext(picks -> {
                    assertEquals(RiskProfile.BALANCED.maxPicksPerDay(), picks.size());
                    assertTrue(picks.stream().noneMatch(p -> p.market() == MarketType.TOTAL));
                    Pick held = picks.stream().filter(p -> p.eventId().equals("evt-1")).findFirst().orElseThrow();
                    assertEquals(uncorrelatedStake(held), held.stakePct(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("stake sizing pairs picks only within the same game")
        void pairsWithinGame() {
            List<Pick> staked = service.stakeHeld(List.of(moneyline("evt-1", 0.60), over("evt-2")));

            assertEquals(2, staked.size());
            staked.forEach(p -> assertEquals(uncorrelatedStake(p), p.stakePct(), 1e-9));
        }
    }

    @Nested
    @DisplayName("slate")
    class Slate {

        @Test
        @DisplayName("a failing game does not sink the rest of the slate")
        void isolatesFailures() {
            GameEvent bad = TestGames.stub("evt-bad");
            when(adapter.analyzeEvent(bad)).thenThrow(new IllegalStateException("feed glitch"));
            stubGame("evt-1", analysis("evt-1", 4.5, 4.0), List.of(moneyline("evt-1", 0.60)));

            StepVerifier.create(service.generate(List.of(bad, TestGames.stub("evt-1"))))
                .assertNext(picks -> {
                    assertEquals(1, picks.size());
                    assertEquals("evt-1", picks.get(0).eventId());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("empty slate → empty list")
        void emptySlate() {
            StepVerifier.create(service.generate(List.of()))
                .assertNext(picks -> assertTrue(picks.isEmpty()))
                .verifyComplete();
        }

        @Test
        @DisplayName("generateForDate pulls the slate from the adapter")
        void forDate() {
            GameEvent event = TestGames.stub("evt-1");
            when(adapter.getEvents(TestGames.DATE)).thenReturn(List.of(event));
            stubGame("evt-1", analysis("evt-1", 4.5, 4.0), List.of(moneyline("evt-1", 0.60)));

            StepVerifier.create(service.generateForDate(TestGames.DATE))
                .assertNext(picks -> assertEquals(1, picks.size()))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("daily cap")
    class DailyCap {

        @Test
        @DisplayName("keeps the five best edges of a day")
        void capsPerDay() {
            List<Pick> picks = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                picks.add(moneyline("evt-" + i, 0.58 + i * 0.01));
            }

            List<Pick> kept = service.applyDailyCap(picks);

            assertEquals(RiskProfile.BALANCED.maxPicksPerDay(), kept.size());
            assertEquals("evt-6", kept.get(0).eventId());
            assertEquals("evt-2", kept.get(4).eventId());
        }

        @Test
        @DisplayName("equal edges fall back to confidence, then event id")
        void tieBreak() {
            Pick a = moneyline("evt-b", 0.60);
            Pick b = moneyline("evt-a", 0.60);

            List<Pick> kept = service.applyDailyCap(new ArrayList<>(List.of(a, b)));

            assertEquals("evt-a", kept.get(0).eventId());
        }

        @Test
        @DisplayName("each game date has its own cap")
        void separateDays() {
            List<Pick> picks = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                picks.add(moneyline("day1-" + i, 0.60));
                Pick p = moneyline("day2-" + i, 0.60);
                picks.add(new Pick(p.eventId(), TestGames.DATE.plusDays(1), p.market(), p.side(), p.team(),
                    p.line(), p.odds(), p.modelProb(), p.impliedProb(), p.edge(), p.confidence(),
                    p.correlationMultiplier(), p.stakePct(), p.stake(), p.rationale(), p.flags()));
            }

            assertEquals(10, service.applyDailyCap(picks).size());
        }
    }
}
