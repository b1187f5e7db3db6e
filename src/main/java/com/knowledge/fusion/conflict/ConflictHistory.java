package com.knowledge.fusion.conflict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only log of resolved conflicts, kept for the lifetime of its resolver.
 */
public class ConflictHistory {

    private final List<Conflict> conflicts = new CopyOnWriteArrayList<>();

    void append(Conflict conflict) {
        if (!conflict.isResolved()) {
            throw new IllegalArgumentException("Only resolved conflicts are recorded: " + conflict.getId());
        }
        conflicts.add(conflict);
    }

    /**
     * All recorded conflicts (immutable view), in resolution order.
     */
    public List<Conflict> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(conflicts));
    }

    public List<Conflict> getByType(ConflictType type) {
        return conflicts.stream()
                .filter(c -> c.getType() == type)
                .collect(Collectors.toList());
    }

    public List<Conflict> getBySubject(String subjectId) {
        return conflicts.stream()
                .filter(c -> subjectId.equals(c.getSubjectId()))
                .collect(Collectors.toList());
    }

    public int size() {
        return conflicts.size();
    }
}
