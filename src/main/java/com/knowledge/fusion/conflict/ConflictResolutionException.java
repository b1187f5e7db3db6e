package com.knowledge.fusion.conflict;

/**
 * Raised when a resolution strategy cannot produce a value for a conflict.
 * {@link ConflictResolver} catches it and applies the first-item fallback.
 */
public class ConflictResolutionException extends RuntimeException {

    private final String conflictId;

    public ConflictResolutionException(String conflictId, String message) {
        super(message);
        this.conflictId = conflictId;
    }

    public String getConflictId() {
        return conflictId;
    }
}
