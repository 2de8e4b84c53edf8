package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Output reference produced by one stage for one request.
 * Keyed by (request_id, stage); rows are never updated.
 *
 * DB table: stage_outputs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_outputs")
@IdClass(StageOutput.Key.class)
public class StageOutput implements Persistable<StageOutput.Key> {

    @Id
    @Column(name = "request_id")
    private UUID requestId;

    @Id
    private String stage;

    @Column(name = "output_ref", nullable = false, updatable = false)
    private String outputRef;

    @Column(name = "merged_at", nullable = false, updatable = false)
    private Instant mergedAt;

    protected StageOutput() {}   // required by JPA

    // Rows are insert-only; save() must INSERT (and fail on a duplicate key)
    // rather than merge into an existing row.
    @Transient
    private boolean fresh = true;

    @PostLoad
    @PostPersist
    void markPersisted() { this.fresh = false; }

    @Override public StageOutput.Key getId() { return new Key(requestId, stage); }
    @Override public boolean isNew() { return fresh; }

    public StageOutput(UUID requestId, String stage, String outputRef, Instant mergedAt) {
        this.requestId = requestId;
        this.stage     = stage;
        this.outputRef = outputRef;
        this.mergedAt  = mergedAt;
    }

    public UUID    getRequestId() { return requestId; }
    public String  getStage()     { return stage; }
    public String  getOutputRef() { return outputRef; }
    public Instant getMergedAt()  { return mergedAt; }

    public static class Key implements Serializable {
        private UUID   requestId;
        private String stage;

        protected Key() {}

        public Key(UUID requestId, String stage) {
            this.requestId = requestId;
            this.stage     = stage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key k)) return false;
            return Objects.equals(requestId, k.requestId) && Objects.equals(stage, k.stage);
        }

        @Override
        public int hashCode() {
            return Objects.hash(requestId, stage);
        }
    }
}
