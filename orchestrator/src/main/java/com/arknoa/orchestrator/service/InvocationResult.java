package com.arknoa.orchestrator.service;

/** What the invoker did with one dispatch. */
public enum InvocationResult {
    /** Handed to the worker pool; the outcome arrives later on the result topic. */
    ACCEPTED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    /** The attempt already has a terminal outcome; nothing was called. */
    DUPLICATE
}
