package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.Instant;
import java.util.UUID;

/**
 * Lease table row. One row per request at most (request_id is the key), which
 * is what keeps a request to a single live lease.
 *
 * DB table: request_leases  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "request_leases")
public class LeaseRecord implements Persistable<UUID> {

    @Id
    @Column(name = "request_id")
    private UUID requestId;

    @Column(name = "holder_id", nullable = false)
    private String holderId;

    @Column(nullable = false)
    private long token;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected LeaseRecord() {}   // required by JPA

    // Rows are insert-only; save() must INSERT (and fail on a duplicate key)
    // rather than merge into an existing row.
    @Transient
    private boolean fresh = true;

    @PostLoad
    @PostPersist
    void markPersisted() { this.fresh = false; }

    @Override public UUID getId() { return requestId; }
    @Override public boolean isNew() { return fresh; }

    public LeaseRecord(UUID requestId, String holderId, long token, Instant acquiredAt, Instant expiresAt) {
        this.requestId  = requestId;
        this.holderId   = holderId;
        this.token      = token;
        this.acquiredAt = acquiredAt;
        this.expiresAt  = expiresAt;
    }

    public UUID    getRequestId()  { return requestId; }
    public String  getHolderId()   { return holderId; }
    public long    getToken()      { return token; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public Instant getExpiresAt()  { return expiresAt; }

    public Lease toLease() {
        return new Lease(requestId, holderId, token, acquiredAt, expiresAt);
    }
}
