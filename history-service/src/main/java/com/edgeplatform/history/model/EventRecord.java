package com.edgeplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One analyzed game. {@code eventId} is unique; re-saving an event replaces its analysis.
 *
 * analysis: JSON-serialised {@code Analysis} as produced by analysis-engine
 */
@Data
@NoArgsConstructor
@Table("events")
public class EventRecord {

    @Id
    private Long id;

    private String eventId;

    private String sport;

    private String league;

    private LocalDate gameDate;

    private String homeTeam;

    private String awayTeam;

    private String venue;

    /** JSON-serialised {@code Analysis} */
    private String analysis;

    private LocalDateTime createdAt;
}
