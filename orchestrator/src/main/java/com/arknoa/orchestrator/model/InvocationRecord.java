package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Marks that the terminal event for (request, stage, attempt) has been
 * emitted. The invoker inserts this before publishing, so a redelivered
 * dispatch never produces a second terminal event.
 *
 * DB table: invocation_outcomes  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "invocation_outcomes")
@IdClass(InvocationRecord.Key.class)
public class InvocationRecord implements Persistable<InvocationRecord.Key> {

    @Id
    @Column(name = "request_id")
    private UUID requestId;

    @Id
    private String stage;

    @Id
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventType outcome;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected InvocationRecord() {}   // required by JPA

    // Rows are insert-only; save() must INSERT (and fail on a duplicate key)
    // rather than merge into an existing row.
    @Transient
    private boolean fresh = true;

    @PostLoad
    @PostPersist
    void markPersisted() { this.fresh = false; }

    @Override public InvocationRecord.Key getId() { return new Key(requestId, stage, attempt); }
    @Override public boolean isNew() { return fresh; }

    public InvocationRecord(UUID requestId, String stage, int attempt, EventType outcome, Instant recordedAt) {
        this.requestId  = requestId;
        this.stage      = stage;
        this.attempt    = attempt;
        this.outcome    = outcome;
        this.recordedAt = recordedAt;
    }

    public UUID      getRequestId() { return requestId; }
    public String    getStage()     { return stage; }
    public int       getAttempt()   { return attempt; }
    public EventType getOutcome()   { return outcome; }

    public static class Key implements Serializable {
        private UUID   requestId;
        private String stage;
        private int    attempt;

        protected Key() {}

        public Key(UUID requestId, String stage, int attempt) {
            this.requestId = requestId;
            this.stage     = stage;
            this.attempt   = attempt;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key k)) return false;
            return attempt == k.attempt
                    && Objects.equals(requestId, k.requestId)
                    && Objects.equals(stage, k.stage);
        }

        @Override
        public int hashCode() {
            return Objects.hash(requestId, stage, attempt);
        }
    }
}
