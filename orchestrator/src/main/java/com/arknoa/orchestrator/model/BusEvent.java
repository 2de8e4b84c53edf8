package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Retained bus message. The identity column doubles as the per-partition
 * offset: consumers read rows with id greater than their committed offset.
 *
 * DB table: bus_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "bus_events")
public class BusEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String topic;

    @Column(name = "partition_no", nullable = false, updatable = false)
    private int partitionNo;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(nullable = false, updatable = false)
    private String stage;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @Column(name = "payload_ref", updatable = false)
    private String payloadRef;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String error;

    @Column(nullable = false, updatable = false)
    private boolean permanent;

    @Column(name = "lease_token", nullable = false, updatable = false)
    private long leaseToken;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected BusEvent() {}   // required by JPA

    public BusEvent(String topic, int partitionNo, PipelineEvent e) {
        this.topic       = topic;
        this.partitionNo = partitionNo;
        this.requestId   = e.requestId();
        this.stage       = e.stage();
        this.attempt     = e.attempt();
        this.eventType   = e.type();
        this.payloadRef  = e.payloadRef();
        this.error       = e.error();
        this.permanent   = e.permanent();
        this.leaseToken  = e.leaseToken();
        this.occurredAt  = e.occurredAt();
    }

    public Long   getId()          { return id; }
    public String getTopic()       { return topic; }
    public int    getPartitionNo() { return partitionNo; }

    public PipelineEvent toEvent() {
        return new PipelineEvent(requestId, stage, attempt, eventType,
                payloadRef, error, permanent, leaseToken, occurredAt);
    }
}
