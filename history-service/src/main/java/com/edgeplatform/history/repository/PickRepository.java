package com.edgeplatform.history.repository;

import com.edgeplatform.history.model.PickRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface PickRepository extends ReactiveCrudRepository<PickRecord, Long> {

    Flux<PickRecord> findByStatusOrderByGameDateAsc(String status);

    Flux<PickRecord> findByGameDateOrderByEdgeDesc(LocalDate gameDate);

    Flux<PickRecord> findByEventIdOrderByCreatedAtAsc(String eventId);

    Mono<Long> countByStatus(String status);

    @Query("""
        SELECT * FROM picks
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<PickRecord> findRecent(int limit);

    /**
     * Filtered scan for performance statistics. Every filter is optional; a null argument
     * matches all rows.
     */
    @Query("""
        SELECT * FROM picks
        WHERE (CAST(:market AS VARCHAR) IS NULL OR market = :market)
          AND (CAST(:fromDate AS DATE) IS NULL OR game_date >= :fromDate)
          AND (CAST(:toDate AS DATE) IS NULL OR game_date <= :toDate)
        ORDER BY game_date ASC, id ASC
        """)
    Flux<PickRecord> findForStats(String market, LocalDate fromDate, LocalDate toDate);

    /**
     * Records a settlement. {@code roi} is derived from the stored stake.
     *
     * @return number of rows updated, 0 when the pick does not exist
     */
    @Modifying
    @Query("""
        UPDATE picks
        SET status         = :status,
            actual_outcome = :actualOutcome,
            profit         = :profit,
            roi            = CASE WHEN CAST(:profit AS DOUBLE PRECISION) IS NULL THEN NULL
                                  WHEN stake IS NULL OR stake <= 0 THEN 0.0
                                  ELSE CAST(:profit AS DOUBLE PRECISION) / stake END,
            settled_at     = NOW()
        WHERE id = :id
        """)
    Mono<Integer> updateResult(Long id, String status, String actualOutcome, Double profit);
}
