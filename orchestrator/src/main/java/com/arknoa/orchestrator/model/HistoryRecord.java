package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of a request's append-only stage history.
 *
 * (request_id, stage, attempt) is unique: a resolved attempt is never
 * recorded twice.
 *
 * DB table: stage_history  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_history")
public class HistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(nullable = false, updatable = false)
    private String stage;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StageOutcome outcome;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String error;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected HistoryRecord() {}   // required by JPA

    public HistoryRecord(UUID requestId, HistoryEntry entry) {
        this.requestId  = requestId;
        this.stage      = entry.stage();
        this.position   = entry.position();
        this.attempt    = entry.attempt();
        this.outcome    = entry.outcome();
        this.error      = entry.error();
        this.recordedAt = entry.at();
    }

    public Long    getId()        { return id; }
    public UUID    getRequestId() { return requestId; }
    public String  getStage()     { return stage; }
    public int     getPosition()  { return position; }
    public int     getAttempt()   { return attempt; }

    public HistoryEntry toEntry() {
        return new HistoryEntry(stage, position, attempt, outcome, error, recordedAt);
    }
}
