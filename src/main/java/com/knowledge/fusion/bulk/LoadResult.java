package com.knowledge.fusion.bulk;

import java.util.List;

/**
 * Result of loading a persisted store. Records that could not be loaded are
 * counted and described; loading never stops on one bad record.
 */
public record LoadResult(
        long entitiesLoaded,
        long relationsLoaded,
        long entitiesSkipped,
        long relationsSkipped,
        List<LoadError> errors
) {
    public LoadResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that was skipped.
     *
     * @param section  "entities" or "relations"
     * @param index    0-based position of the record in its section
     * @param recordId id of the record, when it had one
     * @param message  why it was skipped
     */
    public record LoadError(String section, int index, String recordId, String message) {}

    @Override
    public String toString() {
        return "LoadResult{entities=" + entitiesLoaded +
                ", relations=" + relationsLoaded +
                ", entitiesSkipped=" + entitiesSkipped +
                ", relationsSkipped=" + relationsSkipped + '}';
    }
}
