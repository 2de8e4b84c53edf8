package com.arknoa.orchestrator.service;

import com.arknoa.orchestrator.model.CompositeResult;
import com.arknoa.orchestrator.model.StageOutput;
import com.arknoa.orchestrator.repository.StageOutputRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Result accumulator on the stage_outputs table. The (request_id, stage)
 * primary key makes the merge idempotent across instances; each insert
 * commits on its own so a duplicate never rolls back the caller.
 */
@Component
@Transactional(propagation = Propagation.NOT_SUPPORTED)
public class JpaResultAccumulator implements ResultAccumulator {

    private static final Logger log = LoggerFactory.getLogger(JpaResultAccumulator.class);

    private final StageOutputRepository outputRepo;
    private final Clock                 clock;

    public JpaResultAccumulator(StageOutputRepository outputRepo, Clock clock) {
        this.outputRepo = outputRepo;
        this.clock      = clock;
    }

    @Override
    public boolean merge(UUID requestId, String stage, String outputRef) {
        Optional<StageOutput> existing = outputRepo.findById(new StageOutput.Key(requestId, stage));
        if (existing.isPresent()) {
            warnIfDifferent(existing.get(), outputRef);
            return false;
        }
        try {
            outputRepo.saveAndFlush(new StageOutput(requestId, stage, outputRef, clock.instant()));
            log.debug("Merged {} output of {}: {}", stage, requestId, outputRef);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race; the other writer's output stands.
            outputRepo.findById(new StageOutput.Key(requestId, stage))
                    .ifPresent(winner -> warnIfDifferent(winner, outputRef));
            return false;
        }
    }

    @Override
    public Map<String, String> outputs(UUID requestId) {
        Map<String, String> result = new LinkedHashMap<>();
        for (StageOutput o : outputRepo.findByRequestId(requestId)) {
            result.put(o.getStage(), o.getOutputRef());
        }
        return result;
    }

    @Override
    public CompositeResult composite(UUID requestId, List<String> order) {
        Map<String, String> merged = outputs(requestId);
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String stage : order) {
            if (merged.containsKey(stage)) {
                ordered.put(stage, merged.get(stage));
            }
        }
        return new CompositeResult(requestId, ordered, clock.instant());
    }

    private static void warnIfDifferent(StageOutput kept, String offered) {
        if (!kept.getOutputRef().equals(offered)) {
            log.warn("Ignoring second output for {} stage {}: kept {}, got {}",
                    kept.getRequestId(), kept.getStage(), kept.getOutputRef(), offered);
        }
    }
}
