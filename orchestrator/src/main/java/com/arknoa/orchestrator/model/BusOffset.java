package com.arknoa.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.io.Serializable;
import java.util.Objects;

/**
 * Committed position of one consumer group in one topic partition.
 * The row is locked FOR UPDATE SKIP LOCKED while a batch is processed, so a
 * partition has at most one active consumer per group.
 *
 * DB table: bus_offsets  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "bus_offsets")
@IdClass(BusOffset.Key.class)
public class BusOffset implements Persistable<BusOffset.Key> {

    @Id
    @Column(name = "consumer_group")
    private String consumerGroup;

    @Id
    private String topic;

    @Id
    @Column(name = "partition_no")
    private int partitionNo;

    @Column(name = "committed_id", nullable = false)
    private long committedId = 0;

    // Offset rows are created once and then only moved forward; a save() of a
    // new row must never merge over a row another instance already advanced.
    @Transient
    private boolean fresh = true;

    @PostLoad
    @PostPersist
    void markPersisted() { this.fresh = false; }

    @Override public Key     getId() { return new Key(consumerGroup, topic, partitionNo); }
    @Override public boolean isNew() { return fresh; }

    protected BusOffset() {}   // required by JPA

    public BusOffset(String consumerGroup, String topic, int partitionNo) {
        this.consumerGroup = consumerGroup;
        this.topic         = topic;
        this.partitionNo   = partitionNo;
    }

    public String getConsumerGroup() { return consumerGroup; }
    public String getTopic()         { return topic; }
    public int    getPartitionNo()   { return partitionNo; }
    public long   getCommittedId()   { return committedId; }

    public static class Key implements Serializable {
        private String consumerGroup;
        private String topic;
        private int    partitionNo;

        protected Key() {}

        public Key(String consumerGroup, String topic, int partitionNo) {
            this.consumerGroup = consumerGroup;
            this.topic         = topic;
            this.partitionNo   = partitionNo;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key k)) return false;
            return partitionNo == k.partitionNo
                    && Objects.equals(consumerGroup, k.consumerGroup)
                    && Objects.equals(topic, k.topic);
        }

        @Override
        public int hashCode() {
            return Objects.hash(consumerGroup, topic, partitionNo);
        }
    }
}
