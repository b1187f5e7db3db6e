package com.knowledge.fusion.metrics;

import com.knowledge.fusion.conflict.ConflictType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link FusionMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fusion.pass.duration} - Timer (tag: itemKind)</li>
 *   <li>{@code fusion.pass.input} - DistributionSummary (tag: itemKind)</li>
 *   <li>{@code fusion.pass.clusters} - DistributionSummary (tag: itemKind)</li>
 *   <li>{@code fusion.confidence} - DistributionSummary (tag: itemKind)</li>
 *   <li>{@code conflict.detected} - Counter (tag: conflictType)</li>
 *   <li>{@code conflict.fallback} - Counter (tag: conflictType)</li>
 *   <li>{@code graph.relation.rejected} - Counter</li>
 *   <li>{@code graph.merge.duration} - Timer</li>
 *   <li>{@code graph.merge.entities}, {@code graph.merge.relations} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerFusionMetrics implements FusionMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter relationRejectedCounter;
    private final Timer graphMergeTimer;
    private final DistributionSummary graphMergeEntities;
    private final DistributionSummary graphMergeRelations;

    public MicrometerFusionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.relationRejectedCounter = Counter.builder("graph.relation.rejected")
                .description("Relations refused because an endpoint was missing")
                .register(registry);
        this.graphMergeTimer = Timer.builder("graph.merge.duration")
                .description("Duration of full graph merges")
                .register(registry);
        this.graphMergeEntities = DistributionSummary.builder("graph.merge.entities")
                .description("Entities in the store after a merge")
                .register(registry);
        this.graphMergeRelations = DistributionSummary.builder("graph.merge.relations")
                .description("Relations in the store after a merge")
                .register(registry);
    }

    @Override
    public void recordFusionPass(String itemKind, int inputCount, int clusterCount, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("pass:" + itemKind, k ->
                Timer.builder("fusion.pass.duration")
                        .description("Duration of one fusion pass")
                        .tag("itemKind", itemKind)
                        .register(registry));
        timer.record(duration);
        summary("fusion.pass.input", "Input items per fusion pass", itemKind).record(inputCount);
        summary("fusion.pass.clusters", "Clusters produced per fusion pass", itemKind).record(clusterCount);
    }

    @Override
    public void recordFusionConfidence(String itemKind, double confidence) {
        summary("fusion.confidence", "Confidence of fused items", itemKind).record(confidence);
    }

    @Override
    public void incrementConflictDetected(ConflictType type) {
        counter("conflict.detected", "Conflicts detected", type).increment();
    }

    @Override
    public void incrementConflictFallback(ConflictType type) {
        counter("conflict.fallback", "Conflict resolutions that fell back after a strategy failure", type).increment();
    }

    @Override
    public void incrementRelationRejected() {
        relationRejectedCounter.increment();
    }

    @Override
    public void recordGraphMerge(int entityCount, int relationCount, Duration duration) {
        graphMergeTimer.record(duration);
        graphMergeEntities.record(entityCount);
        graphMergeRelations.record(relationCount);
    }

    private DistributionSummary summary(String name, String description, String itemKind) {
        return summaryCache.computeIfAbsent(name + ":" + itemKind, k ->
                DistributionSummary.builder(name)
                        .description(description)
                        .tag("itemKind", itemKind)
                        .register(registry));
    }

    private Counter counter(String name, String description, ConflictType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("conflictType", type.name())
                        .register(registry));
    }
}
