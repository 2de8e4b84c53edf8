package com.arknoa.orchestrator.worker;

/**
 * A stage invocation did not produce an output.
 *
 * The kind decides what the orchestrator does next: TRANSIENT and TIMEOUT are
 * retried under the stage's backoff policy, PERMANENT fails the request.
 */
public class StageException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT, TIMEOUT }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public StageException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isRetryable() {
        return kind != Kind.PERMANENT;
    }
}
