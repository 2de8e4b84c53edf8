package com.arknoa.orchestrator.bus;

import com.arknoa.orchestrator.config.PipelineProperties;
import com.arknoa.orchestrator.model.BusEvent;
import com.arknoa.orchestrator.model.BusOffset;
import com.arknoa.orchestrator.model.PipelineEvent;
import com.arknoa.orchestrator.repository.BusEventRepository;
import com.arknoa.orchestrator.repository.BusOffsetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaEventBusTest {

    static final String  GROUP = Topics.ORCHESTRATOR_GROUP;
    static final String  TOPIC = Topics.result("classifier");
    static final Instant NOW   = Instant.parse("2025-03-01T10:00:00Z");

    @Mock BusEventRepository         eventRepo;
    @Mock BusOffsetRepository        offsetRepo;
    @Mock PlatformTransactionManager txManager;

    SimpleTransactionStatus txStatus;
    JpaEventBus bus;

    @BeforeEach
    void setUp() {
        txStatus = new SimpleTransactionStatus();
        when(txManager.getTransaction(any())).thenReturn(txStatus);
        when(offsetRepo.existsById(new BusOffset.Key(GROUP, TOPIC, 0))).thenReturn(true);

        PipelineProperties props = new PipelineProperties();
        props.setPartitions(1);
        bus = new JpaEventBus(eventRepo, offsetRepo, txManager, props);
    }

    @Test
    void consume_handlerWritingToTheLedger_stillCommitsTheOffset() {
        // Offset row at 10; the handler's ledger write clears the persistence
        // context, so the claimed entity is detached by the time the batch ends.
        BusOffset claimed = new BusOffset(GROUP, TOPIC, 0);
        setField(claimed, "committedId", 10L);
        when(offsetRepo.claimPartition(GROUP, TOPIC, 0)).thenReturn(Optional.of(claimed));
        when(eventRepo.findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
                eq(TOPIC), eq(0), eq(10L), any(Pageable.class)))
                .thenReturn(List.of(event(11), event(12)));

        List<PipelineEvent> seen = new ArrayList<>();
        int handled = bus.consume(GROUP, TOPIC, 50, seen::add);

        assertThat(handled).isEqualTo(2);
        assertThat(seen).hasSize(2);
        verify(offsetRepo).commitOffset(GROUP, TOPIC, 0, 12L);
        verify(txManager, atLeastOnce()).commit(txStatus);
    }

    @Test
    void consume_handlerFailure_commitsUpToThePreviousEvent() {
        when(offsetRepo.claimPartition(GROUP, TOPIC, 0)).thenReturn(Optional.of(new BusOffset(GROUP, TOPIC, 0)));
        BusEvent poisoned = event(2);
        when(eventRepo.findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
                eq(TOPIC), eq(0), eq(0L), any(Pageable.class)))
                .thenReturn(List.of(event(1), poisoned, event(3)));

        List<Long> seen = new ArrayList<>();
        int handled = bus.consume(GROUP, TOPIC, 50, e -> {
            seen.add(e.leaseToken());
            if (e.leaseToken() == 2L) {
                throw new IllegalStateException("worker registry unavailable");
            }
        });

        assertThat(handled).isEqualTo(1);
        assertThat(seen).containsExactly(1L, 2L);
        verify(offsetRepo).commitOffset(GROUP, TOPIC, 0, 1L);
    }

    @Test
    void consume_failureAfterParticipatingWriteRolledBack_commitsNothing() {
        when(offsetRepo.claimPartition(GROUP, TOPIC, 0)).thenReturn(Optional.of(new BusOffset(GROUP, TOPIC, 0)));
        when(eventRepo.findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
                eq(TOPIC), eq(0), eq(0L), any(Pageable.class)))
                .thenReturn(List.of(event(1), event(2)));

        int handled = bus.consume(GROUP, TOPIC, 50, e -> {
            if (e.leaseToken() == 2L) {
                txStatus.setRollbackOnly();
                throw new IllegalStateException("constraint violation");
            }
        });

        assertThat(handled).isZero();
        verify(offsetRepo, never()).commitOffset(anyString(), anyString(), anyInt(), anyLong());
    }

    @Test
    void consume_partitionHeldByAnotherConsumer_isSkipped() {
        when(offsetRepo.claimPartition(GROUP, TOPIC, 0)).thenReturn(Optional.empty());

        List<PipelineEvent> seen = new ArrayList<>();
        int handled = bus.consume(GROUP, TOPIC, 50, seen::add);

        assertThat(handled).isZero();
        assertThat(seen).isEmpty();
        verifyNoInteractions(eventRepo);
        verify(offsetRepo, never()).commitOffset(anyString(), anyString(), anyInt(), anyLong());
    }

    @Test
    void consume_nothingNew_leavesTheOffsetAlone() {
        when(offsetRepo.claimPartition(GROUP, TOPIC, 0)).thenReturn(Optional.of(new BusOffset(GROUP, TOPIC, 0)));
        when(eventRepo.findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
                eq(TOPIC), eq(0), eq(0L), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(bus.consume(GROUP, TOPIC, 50, e -> {})).isZero();
        verify(offsetRepo, never()).commitOffset(anyString(), anyString(), anyInt(), anyLong());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** A stored result event whose row id is {@code id}; the lease token mirrors it for easy matching. */
    private static BusEvent event(long id) {
        PipelineEvent dispatch = PipelineEvent.dispatched(UUID.randomUUID(), "classifier", 1, "blob://in", id, NOW);
        BusEvent row = new BusEvent(TOPIC, 0, PipelineEvent.succeeded(dispatch, "blob://out-" + id, NOW));
        setField(row, "id", id);
        return row;
    }

    private static void setField(Object target, String name, Object value) {
        try {
            Field f = target.getClass().getDeclaredField(name);
            f.setAccessible(true);
            f.set(target, value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }
}
