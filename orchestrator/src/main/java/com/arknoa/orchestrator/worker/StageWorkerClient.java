package com.arknoa.orchestrator.worker;

import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.worker.dto.StageWorkRequest;

/**
 * The "invoke stage" RPC. One implementation per transport; the orchestrator
 * only ever sees an output reference or a {@link StageException}.
 */
public interface StageWorkerClient {

    /**
     * Run one attempt of a stage, bounded by the descriptor's timeout.
     *
     * @return reference to the stage output
     * @throws StageTimeoutException    the worker did not answer in time
     * @throws TransientStageException  the attempt may succeed if repeated
     * @throws PermanentStageException  the worker rejected the input
     */
    String invoke(StageDescriptor stage, StageWorkRequest request);

    /** @return true if the stage worker reports itself healthy */
    boolean ping(StageDescriptor stage);
}
