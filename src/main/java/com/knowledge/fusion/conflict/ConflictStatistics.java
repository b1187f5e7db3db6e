package com.knowledge.fusion.conflict;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counts and averages over a set of conflicts.
 */
public record ConflictStatistics(
        int totalConflicts,
        int resolvedConflicts,
        int fallbackResolutions,
        double averageResolutionConfidence,
        Map<ConflictType, Integer> byType,
        Map<ResolutionStrategy, Integer> byStrategy
) {
    public ConflictStatistics {
        byType = Collections.unmodifiableMap(byType.isEmpty()
                ? new EnumMap<>(ConflictType.class) : new EnumMap<>(byType));
        byStrategy = Collections.unmodifiableMap(byStrategy.isEmpty()
                ? new EnumMap<>(ResolutionStrategy.class) : new EnumMap<>(byStrategy));
    }

    public static ConflictStatistics of(Collection<Conflict> conflicts) {
        int resolved = 0;
        int fallbacks = 0;
        double totalConfidence = 0.0;
        Map<ConflictType, Integer> byType = new EnumMap<>(ConflictType.class);
        Map<ResolutionStrategy, Integer> byStrategy = new EnumMap<>(ResolutionStrategy.class);
        for (Conflict conflict : conflicts) {
            byType.merge(conflict.getType(), 1, Integer::sum);
            if (conflict.isResolved()) {
                resolved++;
                totalConfidence += conflict.getResolutionConfidence();
                byStrategy.merge(conflict.getStrategy(), 1, Integer::sum);
                if (conflict.isFallback()) {
                    fallbacks++;
                }
            }
        }
        return new ConflictStatistics(conflicts.size(), resolved, fallbacks,
                resolved == 0 ? 0.0 : totalConfidence / resolved, byType, byStrategy);
    }

    /**
     * Plain-text summary, one line per figure.
     */
    public String toReport() {
        StringBuilder report = new StringBuilder();
        report.append("Conflict report\n");
        report.append("  total conflicts: ").append(totalConflicts).append('\n');
        report.append("  resolved: ").append(resolvedConflicts).append('\n');
        report.append("  fallback resolutions: ").append(fallbackResolutions).append('\n');
        report.append(String.format(Locale.ROOT, "  average resolution confidence: %.3f",
                averageResolutionConfidence)).append('\n');
        report.append("  by type:\n");
        byType.forEach((type, count) ->
                report.append("    ").append(type.getLabel()).append(": ").append(count).append('\n'));
        report.append("  by strategy:\n");
        byStrategy.forEach((strategy, count) ->
                report.append("    ").append(strategy.name()).append(": ").append(count).append('\n'));
        return report.toString();
    }
}
