package com.arknoa.orchestrator.ledger;

import java.util.UUID;

/**
 * A history append was refused.
 *
 * ALREADY_RESOLVED: the (stage, attempt) already has an outcome. Orchestrator
 * code treats this as a duplicate delivery.
 * OUT_OF_ORDER: the entry would move the history back to an earlier stage.
 * The request can no longer progress and is failed.
 */
public class HistoryConflictException extends Exception {

    public enum Kind { ALREADY_RESOLVED, OUT_OF_ORDER }

    private final Kind kind;

    public HistoryConflictException(UUID requestId, Kind kind, String message) {
        super("History conflict for request " + requestId + " [" + kind + "]: " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isDuplicate() {
        return kind == Kind.ALREADY_RESOLVED;
    }
}
