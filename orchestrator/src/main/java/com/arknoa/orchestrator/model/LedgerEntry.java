package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable ledger row for one digest request.
 *
 * state holds the label the conditional UPDATE compares against
 * (e.g. "classifier_IN_PROGRESS"); status and stage are the same
 * information split out for queries.
 *
 * DB table: digest_requests  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "digest_requests")
public class LedgerEntry {

    // Assigned at intake, never regenerated.
    @Id
    private UUID id;

    @Column(name = "payload_ref", nullable = false, updatable = false)
    private String payloadRef;

    @Column(nullable = false)
    private String state;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status;

    // Null only while INTAKE_PENDING or COMPLETED.
    private String stage;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    // Backoff deadline for RETRY_PENDING.
    @Column(name = "not_before")
    private Instant notBefore;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected LedgerEntry() {}   // required by JPA

    public LedgerEntry(UUID id, String payloadRef, Instant now) {
        this.id         = id;
        this.payloadRef = payloadRef;
        this.createdAt  = now;
        this.updatedAt  = now;
        setPipelineState(PipelineState.intakePending());
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()            { return id; }
    public String        getPayloadRef()    { return payloadRef; }
    public String        getState()         { return state; }
    public RequestStatus getStatus()        { return status; }
    public String        getStage()         { return stage; }
    public int           getAttemptCount()  { return attemptCount; }
    public Instant       getNotBefore()     { return notBefore; }
    public String        getFailureReason() { return failureReason; }
    public Instant       getCreatedAt()     { return createdAt; }
    public Instant       getUpdatedAt()     { return updatedAt; }

    public void setAttemptCount(int v)        { this.attemptCount = v; }
    public void setNotBefore(Instant t)       { this.notBefore = t; }
    public void setFailureReason(String v)    { this.failureReason = v; }
    public void setUpdatedAt(Instant t)       { this.updatedAt = t; }

    public PipelineState getPipelineState() {
        return new PipelineState(status, stage);
    }

    public void setPipelineState(PipelineState s) {
        this.status = s.status();
        this.stage  = s.stage();
        this.state  = s.label();
    }

    public DigestRequest toSnapshot(List<HistoryEntry> history) {
        return new DigestRequest(id, payloadRef, getPipelineState(), attemptCount,
                notBefore, failureReason, history, createdAt, updatedAt);
    }
}
