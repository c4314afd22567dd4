package com.edgeplatform.history.repository;

import com.edgeplatform.history.model.EventRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface EventRepository extends ReactiveCrudRepository<EventRecord, Long> {

    Mono<EventRecord> findByEventId(String eventId);

    /**
     * Atomic UPSERT keyed by {@code event_id}. A re-analyzed game keeps its row id and
     * {@code created_at}; everything else is replaced.
     */
    @Modifying
    @Query("""
        INSERT INTO events
            (event_id, sport, league, game_date, home_team, away_team, venue, analysis, created_at)
        VALUES
            (:eventId, :sport, :league, :gameDate, :homeTeam, :awayTeam, :venue, :analysis, NOW())
        ON CONFLICT (event_id) DO UPDATE SET
            sport     = EXCLUDED.sport,
            league    = EXCLUDED.league,
            game_date = EXCLUDED.game_date,
            home_team = EXCLUDED.home_team,
            away_team = EXCLUDED.away_team,
            venue     = EXCLUDED.venue,
            analysis  = EXCLUDED.analysis
        """)
    Mono<Void> upsertEvent(String eventId, String sport, String league, LocalDate gameDate,
                           String homeTeam, String awayTeam, String venue, String analysis);
}
