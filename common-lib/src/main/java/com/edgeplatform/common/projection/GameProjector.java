package com.edgeplatform.common.projection;

import com.edgeplatform.common.metrics.BullpenMetricsBuilder;
import com.edgeplatform.common.metrics.ContextBuilder;
import com.edgeplatform.common.metrics.DefenseMetricsBuilder;
import com.edgeplatform.common.metrics.GameReliabilityCalculator;
import com.edgeplatform.common.metrics.HeadToHeadBuilder;
import com.edgeplatform.common.metrics.OffenseMetricsBuilder;
import com.edgeplatform.common.metrics.PitchingMetricsBuilder;
import com.edgeplatform.common.metrics.QualityFlags;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.GameMetrics;
import com.edgeplatform.common.model.GameReliability;
import com.edgeplatform.common.model.HeadToHeadRecord;
import com.edgeplatform.common.model.ProjectionBreakdown;
import com.edgeplatform.common.model.TeamInputs;

import java.time.LocalDate;
import java.util.List;

/**
 * Runs the full analysis stage for one game: metric builders → run projection → reliability.
 * The market is copied from the event as-is; odds providers fill it afterwards.
 */
public final class GameProjector {

    private GameProjector() {}

    public static Analysis analyze(GameEvent event, String sport, String league) {
        TeamInputs home = event.home();
        TeamInputs away = event.away();
        int season = event.date() != null ? event.date().getYear() : LocalDate.now().getYear();

        HeadToHeadRecord h2h = HeadToHeadBuilder.build(event.headToHead(), season);
        GameMetrics metrics = new GameMetrics(
            PitchingMetricsBuilder.build(home.starter()),
            PitchingMetricsBuilder.build(away.starter()),
            OffenseMetricsBuilder.build(home.team(), home.offense()),
            OffenseMetricsBuilder.build(away.team(), away.offense()),
            DefenseMetricsBuilder.build(home.team(), home.defense()),
            DefenseMetricsBuilder.build(away.team(), away.defense()),
            BullpenMetricsBuilder.build(home.team(), home.bullpen()),
            BullpenMetricsBuilder.build(away.team(), away.bullpen()),
            ContextBuilder.build(home.team(), event.venue(), event.temperatureC(), event.windKph(),
                home.playedPreviousDay()),
            ContextBuilder.build(away.team(), event.venue(), event.temperatureC(), event.windKph(),
                away.playedPreviousDay()),
            h2h);

        ProjectionBreakdown homeProjection = RunProjectionModel.projectTeam(
            metrics.homeOffense(), metrics.awayPitcher(), metrics.awayDefense(),
            metrics.homeContext(), h2h, true);
        ProjectionBreakdown awayProjection = RunProjectionModel.projectTeam(
            metrics.awayOffense(), metrics.homePitcher(), metrics.homeDefense(),
            metrics.awayContext(), h2h, false);

        double confidence = (homeProjection.confidence() + awayProjection.confidence()) / 2.0;
        List<String> flags = QualityFlags.collect(metrics);
        GameReliability reliability = GameReliabilityCalculator.forGame(metrics, null);

        return new Analysis(event.eventId(), sport, league, event.date(), home.team(), away.team(),
            event.venue(), metrics, homeProjection, awayProjection,
            homeProjection.mu() + awayProjection.mu(), event.market(), confidence,
            List.copyOf(flags), reliability);
    }
}
