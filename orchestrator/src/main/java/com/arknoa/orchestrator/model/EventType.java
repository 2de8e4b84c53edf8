package com.arknoa.orchestrator.model;

/** Kinds of message carried on the pipeline topics. */
public enum EventType {
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != DISPATCHED;
    }
}
