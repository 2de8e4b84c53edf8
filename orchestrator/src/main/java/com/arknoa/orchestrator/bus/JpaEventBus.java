package com.arknoa.orchestrator.bus;

import com.arknoa.orchestrator.config.PipelineProperties;
import com.arknoa.orchestrator.model.BusEvent;
import com.arknoa.orchestrator.model.BusOffset;
import com.arknoa.orchestrator.model.PipelineEvent;
import com.arknoa.orchestrator.repository.BusEventRepository;
import com.arknoa.orchestrator.repository.BusOffsetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event bus on PostgreSQL: the database IS the queue.
 *
 * publish() is an INSERT into bus_events. consume() claims each partition's
 * bus_offsets row with SELECT ... FOR UPDATE SKIP LOCKED, reads the events past
 * the committed id, runs the handler and moves the offset with an explicit
 * UPDATE, all in one transaction per partition. Handler writes that join that
 * transaction commit or roll back together with the offset.
 */
@Component
public class JpaEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(JpaEventBus.class);

    private final BusEventRepository  eventRepo;
    private final BusOffsetRepository offsetRepo;
    private final TransactionTemplate partitionTx;
    private final TransactionTemplate offsetInitTx;
    private final int                 partitions;

    // Offset rows already known to exist, to skip the existence check.
    private final Set<BusOffset.Key> knownOffsets = ConcurrentHashMap.newKeySet();

    public JpaEventBus(BusEventRepository eventRepo,
                       BusOffsetRepository offsetRepo,
                       PlatformTransactionManager txManager,
                       PipelineProperties props) {
        this.eventRepo    = eventRepo;
        this.offsetRepo   = offsetRepo;
        this.partitions   = props.getPartitions();
        this.partitionTx  = new TransactionTemplate(txManager);
        this.offsetInitTx = new TransactionTemplate(txManager);
        this.offsetInitTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional
    public void publish(String topic, PipelineEvent event) {
        int partition = Topics.partitionFor(event.requestId(), partitions);
        BusEvent saved = eventRepo.save(new BusEvent(topic, partition, event));
        log.debug("Published {} {} attempt {} to {}[{}] (id={})",
                event.type(), event.requestId(), event.attempt(), topic, partition, saved.getId());
    }

    @Override
    public int consume(String group, String topic, int maxEvents, EventHandler handler) {
        int handled = 0;
        for (int p = 0; p < partitions && handled < maxEvents; p++) {
            ensureOffset(group, topic, p);
            int partition = p;
            int budget    = maxEvents - handled;
            Integer n = partitionTx.execute(status -> {
                Optional<BusOffset> claim = offsetRepo.claimPartition(group, topic, partition);
                if (claim.isEmpty()) {
                    return 0;  // another consumer of the group holds it
                }
                List<BusEvent> batch = eventRepo.findByTopicAndPartitionNoAndIdGreaterThanOrderByIdAsc(
                        topic, partition, claim.get().getCommittedId(), PageRequest.of(0, budget));
                long committed = claim.get().getCommittedId();
                int count = 0;
                for (BusEvent e : batch) {
                    try {
                        handler.handle(e.toEvent());
                    } catch (RuntimeException ex) {
                        log.warn("Handler failed on {}[{}] event {} for group {}, will redeliver: {}",
                                topic, partition, e.getId(), group, ex.getMessage());
                        if (status.isRollbackOnly()) {
                            // A participating write failed; nothing in this batch can commit.
                            status.setRollbackOnly();
                            return 0;
                        }
                        break;
                    }
                    committed = e.getId();
                    count++;
                }
                if (count > 0) {
                    offsetRepo.commitOffset(group, topic, partition, committed);
                }
                return count;
            });
            handled += n == null ? 0 : n;
        }
        return handled;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PipelineEvent> replay(UUID requestId) {
        return eventRepo.findByRequestIdOrderByIdAsc(requestId).stream()
                .map(BusEvent::toEvent)
                .toList();
    }

    private void ensureOffset(String group, String topic, int partition) {
        BusOffset.Key key = new BusOffset.Key(group, topic, partition);
        if (knownOffsets.contains(key)) {
            return;
        }
        try {
            offsetInitTx.executeWithoutResult(status -> {
                if (!offsetRepo.existsById(key)) {
                    offsetRepo.saveAndFlush(new BusOffset(group, topic, partition));
                    log.info("Created offset for group {} on {}[{}]", group, topic, partition);
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Offset for group {} on {}[{}] created concurrently", group, topic, partition);
        }
        knownOffsets.add(key);
    }
}
