package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.EntityPair;
import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.logging.LogContext;
import com.knowledge.fusion.metrics.FusionMetrics;
import com.knowledge.fusion.metrics.NoOpFusionMetrics;
import com.knowledge.fusion.similarity.SimilarityCalculator;
import com.knowledge.fusion.similarity.SimilarityClustering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Clusters candidate relations describing the same edge and merges each cluster.
 *
 * <p>Two relations are duplicates when (type, head, tail) match exactly, or when
 * their {@link #matchScore} reaches the relation threshold. The score weighs type
 * equality (0.6), the entity pair (0.8; 1.0 same direction, 0.8 swapped) and, only
 * when both carry a {@code context} property, context similarity (0.4), normalised
 * by the weights applied. Clustering follows {@link FusionOptions#getClusteringMode()}.</p>
 */
public class RelationFusionEngine {
    private static final Logger log = LoggerFactory.getLogger(RelationFusionEngine.class);

    static final double TYPE_WEIGHT = 0.6;
    static final double PAIR_WEIGHT = 0.8;
    static final double CONTEXT_WEIGHT = 0.4;
    static final double SWAPPED_PAIR_SCORE = 0.8;
    static final double SATURATING_SOURCE_COUNT = 5.0;
    static final double MAX_SOURCE_BOOST = 0.2;
    static final String SOURCE_QUALITY_PROPERTY = "source_quality";
    static final String TIMESTAMP_PROPERTY = "timestamp";
    static final String MULTI_RELATION_FUSION = "multi_relation_fusion";

    private final SimilarityCalculator similarity;
    private final FusionOptions options;
    private final FusionMetrics metrics;

    public RelationFusionEngine() {
        this(new SimilarityCalculator(), FusionOptions.defaults(), NoOpFusionMetrics.INSTANCE);
    }

    public RelationFusionEngine(FusionOptions options) {
        this(new SimilarityCalculator(), options, NoOpFusionMetrics.INSTANCE);
    }

    public RelationFusionEngine(SimilarityCalculator similarity, FusionOptions options, FusionMetrics metrics) {
        this.similarity = similarity;
        this.options = options;
        this.metrics = metrics != null ? metrics : NoOpFusionMetrics.INSTANCE;
    }

    public List<FusionResult<Relation>> batchFuse(List<Relation> relations) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forFusion(LogContext.generateCorrelationId(), "relation")) {
            List<RelationCluster> clusters = cluster(relations);
            List<FusionResult<Relation>> results = new ArrayList<>(clusters.size());
            for (RelationCluster cluster : clusters) {
                FusionResult<Relation> result = fuseCluster(cluster);
                metrics.recordFusionConfidence("relation", result.confidence());
                results.add(result);
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordFusionPass("relation", relations.size(), clusters.size(), duration);
            log.info("fusion.relations.completed inputCount={} clusterCount={} durationMs={}",
                    relations.size(), clusters.size(), duration.toMillis());
            return results;
        }
    }

    public List<RelationCluster> cluster(List<Relation> relations) {
        SimilarityClustering.PairTest test = SimilarityClustering.precompute(relations.size(),
                (i, j) -> isDuplicate(relations.get(i), relations.get(j)),
                options.isParallelScoring());
        List<List<Integer>> groups = options.getClusteringMode() == ClusteringMode.SEED
                ? SimilarityClustering.seedGroups(relations.size(), test)
                : SimilarityClustering.connectedComponents(relations.size(), test);

        List<RelationCluster> clusters = new ArrayList<>(groups.size());
        for (List<Integer> group : groups) {
            List<Relation> members = new ArrayList<>(group.size());
            for (int index : group) {
                members.add(relations.get(index));
            }
            clusters.add(toCluster(members));
        }
        return clusters;
    }

    public boolean isDuplicate(Relation first, Relation second) {
        if (isExactMatch(first, second)) {
            return true;
        }
        return matchScore(first, second) >= options.getRelationThreshold();
    }

    public double matchScore(Relation first, Relation second) {
        if (isExactMatch(first, second)) {
            return 1.0;
        }
        double score = first.getType().equals(second.getType()) ? TYPE_WEIGHT : 0.0;
        double weights = TYPE_WEIGHT;

        EntityPair firstPair = first.pair();
        EntityPair secondPair = second.pair();
        if (firstPair.equals(secondPair)) {
            score += PAIR_WEIGHT;
        } else if (firstPair.equals(secondPair.reversed())) {
            score += PAIR_WEIGHT * SWAPPED_PAIR_SCORE;
        }
        weights += PAIR_WEIGHT;

        Optional<String> firstContext = first.context();
        Optional<String> secondContext = second.context();
        if (firstContext.isPresent() && secondContext.isPresent()) {
            score += CONTEXT_WEIGHT * similarity.contextSimilarity(firstContext.get(), secondContext.get());
            weights += CONTEXT_WEIGHT;
        }
        return score / weights;
    }

    /**
     * Fuses one cluster. A singleton comes back unchanged at confidence 1.0.
     * Otherwise the representative supplies id, type and endpoints.
     */
    public FusionResult<Relation> fuseCluster(RelationCluster cluster) {
        if (cluster.isSingleton()) {
            return FusionResult.single(cluster.members().get(0));
        }
        List<Relation> members = cluster.members();
        List<Map<String, PropertyValue>> properties = new ArrayList<>();
        List<Double> confidences = new ArrayList<>(members.size());
        for (Relation member : members) {
            if (!member.getProperties().isEmpty()) {
                properties.add(member.getProperties());
            }
            confidences.add(member.getConfidence());
        }
        double confidence = fuseConfidence(confidences, options.getConfidenceStrategy());
        Relation representative = cluster.representative();
        Relation fused = Relation.builder(representative)
                .properties(PropertyMerger.mergeRelationProperties(properties, options.getPropertyStrategy()))
                .confidence(confidence)
                .build();

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(FusionResult.METHOD, MULTI_RELATION_FUSION);
        evidence.put(FusionResult.SOURCE_COUNT, members.size());
        evidence.put(FusionResult.CLUSTER_CONFIDENCE, cluster.confidence());
        evidence.put("confidence_strategy", options.getConfidenceStrategy().name());
        evidence.put("property_strategy", options.getPropertyStrategy().name());
        log.debug("fusion.relation.fused id={} type={} sourceCount={} confidence={}",
                fused.getId(), fused.getType(), members.size(), confidence);
        return new FusionResult<>(fused, members, confidence, evidence);
    }

    public FusionStatistics statistics(List<FusionResult<Relation>> results) {
        return FusionStatistics.of(results, Relation::getType);
    }

    /**
     * Keeps at most one relation per type for each (head, tail) pair, choosing the
     * highest confidence (earliest on ties). Groups keep first-seen order. No fusion
     * of properties takes place.
     */
    public List<Relation> removeRedundantRelations(List<Relation> relations) {
        Map<EntityPair, Map<String, Relation>> byPair = new LinkedHashMap<>();
        for (Relation relation : relations) {
            Map<String, Relation> byType = byPair.computeIfAbsent(relation.pair(), k -> new LinkedHashMap<>());
            Relation current = byType.get(relation.getType());
            if (current == null || relation.getConfidence() > current.getConfidence()) {
                byType.put(relation.getType(), relation);
            }
        }
        List<Relation> kept = new ArrayList<>();
        byPair.values().forEach(byType -> kept.addAll(byType.values()));
        if (kept.size() < relations.size()) {
            log.debug("fusion.relations.redundantRemoved removed={}", relations.size() - kept.size());
        }
        return kept;
    }

    /**
     * Highest {@link #representativeScore}; the earliest member wins ties.
     */
    public Relation selectRepresentative(List<Relation> members) {
        Relation best = members.get(0);
        double bestScore = representativeScore(best);
        for (int i = 1; i < members.size(); i++) {
            double score = representativeScore(members.get(i));
            if (score > bestScore) {
                best = members.get(i);
                bestScore = score;
            }
        }
        return best;
    }

    static double representativeScore(Relation relation) {
        double score = 0.5 * relation.getConfidence() + 0.1 * relation.getProperties().size();
        if (relation.getProperties().get(SOURCE_QUALITY_PROPERTY) instanceof PropertyValue.NumberValue quality) {
            score += 0.3 * quality.value();
        }
        if (relation.getProperties().containsKey(TIMESTAMP_PROPERTY)) {
            score += 0.1;
        }
        return score;
    }

    static double fuseConfidence(List<Double> confidences, ConfidenceFusionStrategy strategy) {
        double sum = 0.0;
        double max = 0.0;
        for (double confidence : confidences) {
            sum += confidence;
            max = Math.max(max, confidence);
        }
        double average = sum / confidences.size();
        return switch (strategy) {
            case MAX -> max;
            case AVERAGE -> average;
            case WEIGHTED_AVERAGE -> {
                double sourceWeight = Math.min(1.0, confidences.size() / SATURATING_SOURCE_COUNT);
                yield Math.min(1.0, average * (1.0 + sourceWeight * MAX_SOURCE_BOOST));
            }
        };
    }

    private static boolean isExactMatch(Relation first, Relation second) {
        return first.getType().equals(second.getType())
                && first.getHeadEntityId().equals(second.getHeadEntityId())
                && first.getTailEntityId().equals(second.getTailEntityId());
    }

    private RelationCluster toCluster(List<Relation> members) {
        if (members.size() == 1) {
            Relation only = members.get(0);
            return new RelationCluster(UUID.randomUUID().toString(), members, only, only.getConfidence(),
                    RelationCluster.SINGLE_RELATION);
        }
        double totalScore = 0.0;
        int pairs = 0;
        double totalConfidence = 0.0;
        for (int i = 0; i < members.size(); i++) {
            totalConfidence += members.get(i).getConfidence();
            for (int j = i + 1; j < members.size(); j++) {
                totalScore += matchScore(members.get(i), members.get(j));
                pairs++;
            }
        }
        double confidence = 0.6 * (totalScore / pairs) + 0.4 * (totalConfidence / members.size());
        return new RelationCluster(UUID.randomUUID().toString(), members, selectRepresentative(members),
                confidence, RelationCluster.SIMILARITY_BASED);
    }
}
