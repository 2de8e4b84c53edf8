package com.arknoa.orchestrator.worker;

/** Worker unavailable, 5xx, connection reset: worth another attempt. */
public class TransientStageException extends StageException {

    public TransientStageException(String message) {
        super(Kind.TRANSIENT, message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(Kind.TRANSIENT, message, cause);
    }
}
