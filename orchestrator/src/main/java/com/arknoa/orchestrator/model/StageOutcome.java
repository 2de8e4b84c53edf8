package com.arknoa.orchestrator.model;

/** Result recorded in a request's stage history for one attempt. */
public enum StageOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
