package com.edgeplatform.common.metrics;

import com.edgeplatform.common.GameFixtures;
import com.edgeplatform.common.league.MlbConstants;
import com.edgeplatform.common.model.BullpenMetrics;
import com.edgeplatform.common.model.BullpenStatLine;
import com.edgeplatform.common.model.ContextRecord;
import com.edgeplatform.common.model.DefenseMetrics;
import com.edgeplatform.common.model.HeadToHeadGame;
import com.edgeplatform.common.model.HeadToHeadRecord;
import com.edgeplatform.common.model.OffenseMetrics;
import com.edgeplatform.common.model.OffenseStatLine;
import com.edgeplatform.common.model.PitcherStatLine;
import com.edgeplatform.common.model.PitchingMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricBuildersTest {

    @Nested
    @DisplayName("PitchingMetricsBuilder")
    class Pitching {

        @Test
        @DisplayName("TBD starter → confidence 0.10, league ERA, tbd flag")
        void tbdStarter() {
            PitchingMetrics m = PitchingMetricsBuilder.build(
                new PitcherStatLine("TBD", null, null, null, null, null, null));
            assertEquals(0.10, m.confidence(), 1e-12);
            assertEquals(MlbConstants.LEAGUE_ERA, m.era().adjusted(), 1e-12);
            assertEquals(List.of(PitchingMetricsBuilder.TBD), m.flags());
        }

        @Test
        @DisplayName("null line is treated as TBD")
        void nullLine() {
            assertTrue(PitchingMetricsBuilder.build(null).hasFlag(PitchingMetricsBuilder.TBD));
        }

        @Test
        @DisplayName("complete line → confidence 1.0, ERA shrunk with 20 IP of prior")
        void completeLine() {
            PitchingMetrics m = PitchingMetricsBuilder.build(
                new PitcherStatLine("Ace", null, 120.0, 3.0, 3.2, 5, 30.0));
            assertEquals(1.0, m.confidence(), 1e-12);
            assertTrue(m.flags().isEmpty());
            assertEquals((3.0 * 120 + 4.30 * 20) / 140, m.era().adjusted(), 1e-9);
            assertNotNull(m.fip());
        }

        @Test
        @DisplayName("each added deficiency lowers confidence")
        void confidenceMonotone() {
            double full     = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 80.0, 3.5, 3.6, 5, 25.0)).confidence();
            double lowIp    = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 15.0, 3.5, 3.6, 5, 25.0)).confidence();
            double noFip    = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 15.0, 3.5, null, 5, 25.0)).confidence();
            double fatigued = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 15.0, 3.5, null, 3, 25.0)).confidence();
            double noRecent = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 15.0, 3.5, null, 3, null)).confidence();
            assertTrue(full > lowIp);
            assertTrue(lowIp > noFip);
            assertTrue(noFip > fatigued);
            assertTrue(fatigued > noRecent);
            assertTrue(noRecent >= 0.05);
        }

        @Test
        @DisplayName("small samples are pulled harder toward the league ERA")
        void smallSampleShrinksMore() {
            double small = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 10.0, 2.0, 2.0, 5, 10.0)).era().adjusted();
            double large = PitchingMetricsBuilder.build(new PitcherStatLine("A", null, 150.0, 2.0, 2.0, 5, 30.0)).era().adjusted();
            assertTrue(small > large);
            assertTrue(small < MlbConstants.LEAGUE_ERA);
        }
    }

    @Nested
    @DisplayName("OffenseMetricsBuilder")
    class Offense {

        @Test
        @DisplayName("unresolved team → league defaults and no_team_id")
        void unresolvedTeam() {
            OffenseMetrics m = OffenseMetricsBuilder.build("Nowhere", null);
            assertEquals(MlbConstants.LEAGUE_RPG, m.runsPerGame().adjusted(), 1e-12);
            assertTrue(m.hasFlag(OffenseMetricsBuilder.NO_TEAM));
            assertEquals(0.4, m.confidence(), 1e-12);
        }

        @Test
        @DisplayName("wRC+ is always an OPS proxy")
        void wrcProxyAlwaysFlagged() {
            OffenseMetrics m = OffenseMetricsBuilder.build("NYY", GameFixtures.offense());
            assertTrue(m.hasFlag(OffenseMetricsBuilder.WRC_PROXY));
            assertEquals(0.9, m.confidence(), 1e-12);
        }

        @Test
        @DisplayName("missing splits and recent form are flagged and lower confidence")
        void missingSplitsAndRecent() {
            OffenseMetrics m = OffenseMetricsBuilder.build("NYY",
                new OffenseStatLine(20, 5.0, 0.760, null, null, null, null));
            assertTrue(m.hasFlag(OffenseMetricsBuilder.LOW_SAMPLE));
            assertTrue(m.hasFlag(OffenseMetricsBuilder.NO_RECENT));
            assertTrue(m.hasFlag(OffenseMetricsBuilder.NO_SPLITS));
            assertEquals(0.8 * 0.9 * 0.92 * 0.9, m.confidence(), 1e-12);
        }
    }

    @Nested
    @DisplayName("DefenseMetricsBuilder")
    class Defense {

        @Test
        @DisplayName("no season data → league errors per game, floor confidence")
        void noData() {
            DefenseMetrics m = DefenseMetricsBuilder.build("NYY", null);
            assertEquals(MlbConstants.LEAGUE_ERRORS_PER_GAME, m.errorsPerGame().adjusted(), 1e-12);
            assertTrue(m.hasFlag(DefenseMetricsBuilder.NO_SEASON_DATA));
            assertEquals(0.5, m.confidence(), 1e-12);
        }

        @Test
        @DisplayName("complete line → errors per game shrunk toward league")
        void completeLine() {
            DefenseMetrics m = DefenseMetricsBuilder.build("NYY", GameFixtures.defense());
            assertEquals(1.0, m.confidence(), 1e-12);
            double observed = 38.0 / 70;
            double adjusted = m.errorsPerGame().adjusted();
            assertTrue(adjusted > Math.min(observed, 0.55) && adjusted < Math.max(observed, 0.55));
        }
    }

    @Nested
    @DisplayName("BullpenMetricsBuilder")
    class Bullpen {

        @Test
        @DisplayName("no data → league bullpen ERA, team_estimate + no_data, 0.30")
        void noData() {
            BullpenMetrics m = BullpenMetricsBuilder.build("NYY", null);
            assertEquals(MlbConstants.LEAGUE_BULLPEN_ERA, m.era().adjusted(), 1e-12);
            assertTrue(m.hasFlag(BullpenMetricsBuilder.NO_DATA));
            assertTrue(m.hasFlag(BullpenMetricsBuilder.TEAM_ESTIMATE));
            assertEquals(0.30, m.confidence(), 1e-12);
        }

        @Test
        @DisplayName("team-line estimate uses 40% of team innings")
        void teamEstimate() {
            BullpenMetrics m = BullpenMetricsBuilder.build("NYY",
                new BullpenStatLine(null, null, 500.0, 4.00, true, true));
            assertEquals(200.0, m.inningsPitched(), 1e-12);
            assertTrue(m.hasFlag(BullpenMetricsBuilder.TEAM_ESTIMATE));
            assertEquals(0.85, m.confidence(), 1e-12);
        }

        @Test
        @DisplayName("direct reliever line with everything available → confidence 1.0")
        void directLine() {
            BullpenMetrics m = BullpenMetricsBuilder.build("NYY", GameFixtures.bullpen());
            assertEquals(1.0, m.confidence(), 1e-12);
            assertTrue(m.flags().isEmpty());
        }
    }

    @Nested
    @DisplayName("ContextBuilder")
    class Context {

        @Test
        @DisplayName("known park matches case-insensitively by keyword")
        void parkFactor() {
            assertEquals(1.34, ContextBuilder.parkFactor("COORS FIELD"), 1e-12);
            assertEquals(0.92, ContextBuilder.parkFactor("Petco Park"), 1e-12);
            assertNull(ContextBuilder.parkFactor("Somewhere Else"));
            assertNull(ContextBuilder.parkFactor(null));
        }

        @Test
        @DisplayName("neutral weather → zero delta; heat and wind add runs")
        void weatherDelta() {
            assertEquals(0.0, ContextBuilder.weatherDelta(22.0, 10.0), 1e-12);
            assertEquals(0.05 + 0.02, ContextBuilder.weatherDelta(32.0, 20.0), 1e-12);
        }

        @Test
        @DisplayName("no weather, unknown park and back-to-back are all flagged")
        void allDeficiencies() {
            ContextRecord c = ContextBuilder.build("NYY", "Unknown Park", null, null, true);
            assertTrue(c.hasFlag(ContextBuilder.NO_WEATHER));
            assertTrue(c.hasFlag(ContextBuilder.NO_PARK_FACTOR));
            assertTrue(c.hasFlag(ContextBuilder.BACK_TO_BACK));
            assertEquals(1.0, c.parkFactor(), 1e-12);
            assertEquals(0.05, c.fatiguePenalty(), 1e-12);
            assertEquals(0.70 * 0.95 * 0.90, c.confidence(), 1e-12);
        }
    }

    @Nested
    @DisplayName("HeadToHeadBuilder")
    class HeadToHead {

        @Test
        @DisplayName("no meetings → neutral record, no_data")
        void noData() {
            HeadToHeadRecord r = HeadToHeadBuilder.build(List.of(), 2025);
            assertEquals(0, r.totalGames());
            assertEquals(0.5, r.winRateWeighted(), 1e-12);
            assertTrue(r.hasFlag(HeadToHeadBuilder.NO_DATA));
        }

        @Test
        @DisplayName("seasons older than two years are ignored; recent ones weigh more")
        void seasonDecay() {
            HeadToHeadRecord r = HeadToHeadBuilder.build(List.of(
                new HeadToHeadGame(2025, 5, 1),
                new HeadToHeadGame(2023, 1, 5),
                new HeadToHeadGame(2019, 9, 0)), 2025);
            assertEquals(2, r.totalGames());
            assertEquals(0.5, r.winRate(), 1e-12);
            assertEquals(1.0 / 1.4, r.winRateWeighted(), 1e-12);
            assertTrue(r.hasFlag(HeadToHeadBuilder.VERY_LOW_SAMPLE));
        }
    }
}
