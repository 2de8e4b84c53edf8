package com.arknoa.orchestrator.worker;

/** The worker rejected the input; retrying cannot help. */
public class PermanentStageException extends StageException {

    public PermanentStageException(String message) {
        super(Kind.PERMANENT, message);
    }

    public PermanentStageException(String message, Throwable cause) {
        super(Kind.PERMANENT, message, cause);
    }
}
