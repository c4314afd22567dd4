package com.edgeplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Persisted pick and its settlement.
 *
 * Column mapping (R2DBC snake_case convention):
 *   eventId       → event_id
 *   gameDate      → game_date
 *   modelProb     → model_prob
 *   impliedProb   → implied_prob
 *   stakePct      → stake_pct
 *   actualOutcome → actual_outcome
 *   settledAt     → settled_at
 *
 * status is PENDING until settled, then WIN, LOSS or PUSH. {@code actualOutcome} holds the final
 * score ("5-3"); {@code roi} is profit/stake, 0 when nothing was staked.
 */
@Data
@NoArgsConstructor
@Table("picks")
public class PickRecord {

    public static final String PENDING = "PENDING";

    @Id
    private Long id;

    private String eventId;

    private LocalDate gameDate;

    private String market;

    private String side;

    private String team;

    private Double line;

    private double odds;

    private double modelProb;

    private double impliedProb;

    private double edge;

    private double confidence;

    private Double correlationMultiplier;

    private Double stakePct;

    private Double stake;

    private String rationale;

    private String status;

    private String actualOutcome;

    private Double profit;

    private Double roi;

    private LocalDateTime createdAt;

    private LocalDateTime settledAt;
}
