package com.arknoa.orchestrator.model;

import java.util.Objects;

/**
 * Position of a request in the pipeline state machine: a status plus the stage
 * it applies to.
 *
 * The {@link #label()} form ("classifier_IN_PROGRESS", "INTAKE_PENDING",
 * "COMPLETED") is what the ledger compares on every conditional write.
 * Terminal labels carry no stage; the stage of a FAILED or ABORTED request is
 * kept for diagnosis only.
 */
public record PipelineState(RequestStatus status, String stage) {

    public PipelineState {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal() && status != RequestStatus.INTAKE_PENDING
                && (stage == null || stage.isBlank())) {
            throw new IllegalArgumentException(status + " requires a stage");
        }
    }

    public static PipelineState intakePending()              { return new PipelineState(RequestStatus.INTAKE_PENDING, null); }
    public static PipelineState inProgress(String stage)     { return new PipelineState(RequestStatus.IN_PROGRESS, stage); }
    public static PipelineState succeeded(String stage)      { return new PipelineState(RequestStatus.SUCCEEDED, stage); }
    public static PipelineState retryPending(String stage)   { return new PipelineState(RequestStatus.RETRY_PENDING, stage); }
    public static PipelineState completed()                  { return new PipelineState(RequestStatus.COMPLETED, null); }
    public static PipelineState failed(String stage)         { return new PipelineState(RequestStatus.FAILED, stage); }
    public static PipelineState aborted(String stage)        { return new PipelineState(RequestStatus.ABORTED, stage); }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public String label() {
        if (status.isTerminal() || status == RequestStatus.INTAKE_PENDING) {
            return status.name();
        }
        return stage + "_" + status.name();
    }

    @Override
    public String toString() {
        return label();
    }
}
