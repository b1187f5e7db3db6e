package com.knowledge.fusion.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a store: every issue found plus the store statistics.
 */
public record ValidationReport(List<ValidationIssue> issues, GraphStatistics statistics) {

    public ValidationReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<ValidationIssue> issuesOfKind(ValidationIssue.Kind kind) {
        return issues.stream()
                .filter(issue -> issue.kind() == kind)
                .collect(Collectors.toList());
    }
}
