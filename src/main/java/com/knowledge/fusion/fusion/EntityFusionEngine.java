package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.PropertyValue;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Clusters candidate entities and merges each cluster into one canonical entity.
 *
 * <p>Clustering is seed-based by default: every still-unclustered entity, in input
 * order, becomes a seed and absorbs each later unclustered entity whose
 * {@link SimilarityCalculator#entitySimilarity} with the seed reaches the entity
 * threshold. Members are never compared with each other, so on a chain
 * a~b, b~c, a!~c the result is {a, b} and {c}. {@link ClusteringMode#CONNECTED_COMPONENTS}
 * switches to the transitive grouping, which yields {a, b, c}.</p>
 *
 * <p>Merge rules for a multi-member cluster:</p>
 * <ul>
 *   <li>id: the representative's id</li>
 *   <li>name: longest name that is not a short all-caps token, else the most frequent name</li>
 *   <li>type: majority vote, ties to the longest type string, then to input order</li>
 *   <li>properties: see {@link PropertyMerger#mergeEntityProperties}</li>
 *   <li>aliases: every member name and alias except the winning name</li>
 * </ul>
 */
public class EntityFusionEngine {
    private static final Logger log = LoggerFactory.getLogger(EntityFusionEngine.class);

    static final int MAX_ABBREVIATION_LENGTH = 5;
    static final double SATURATING_SOURCE_COUNT = 5.0;
    static final double SOURCE_WEIGHT = 0.3;
    static final double COMPLETENESS_WEIGHT = 0.4;
    static final double CONSISTENCY_WEIGHT = 0.3;
    static final String MULTI_ENTITY_FUSION = "multi_entity_fusion";

    private final SimilarityCalculator similarity;
    private final FusionOptions options;
    private final FusionMetrics metrics;

    public EntityFusionEngine() {
        this(new SimilarityCalculator(), FusionOptions.defaults(), NoOpFusionMetrics.INSTANCE);
    }

    public EntityFusionEngine(FusionOptions options) {
        this(new SimilarityCalculator(), options, NoOpFusionMetrics.INSTANCE);
    }

    public EntityFusionEngine(SimilarityCalculator similarity, FusionOptions options, FusionMetrics metrics) {
        this.similarity = similarity;
        this.options = options;
        this.metrics = metrics != null ? metrics : NoOpFusionMetrics.INSTANCE;
    }

    /**
     * Clusters the candidates and fuses every cluster. Exactly one result per
     * cluster, in the order clusters were formed.
     */
    public List<FusionResult<Entity>> batchFuse(List<Entity> entities) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forFusion(LogContext.generateCorrelationId(), "entity")) {
            List<EntityCluster> clusters = cluster(entities);
            List<FusionResult<Entity>> results = new ArrayList<>(clusters.size());
            for (EntityCluster cluster : clusters) {
                FusionResult<Entity> result = fuseCluster(cluster);
                metrics.recordFusionConfidence("entity", result.confidence());
                results.add(result);
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordFusionPass("entity", entities.size(), clusters.size(), duration);
            log.info("fusion.entities.completed inputCount={} clusterCount={} durationMs={}",
                    entities.size(), clusters.size(), duration.toMillis());
            return results;
        }
    }

    public List<EntityCluster> cluster(List<Entity> entities) {
        double threshold = options.getEntityThreshold();
        SimilarityClustering.PairTest test = SimilarityClustering.precompute(entities.size(),
                (i, j) -> similarity.entitySimilarity(entities.get(i), entities.get(j)) >= threshold,
                options.isParallelScoring());
        List<List<Integer>> groups = options.getClusteringMode() == ClusteringMode.SEED
                ? SimilarityClustering.seedGroups(entities.size(), test)
                : SimilarityClustering.connectedComponents(entities.size(), test);

        List<EntityCluster> clusters = new ArrayList<>(groups.size());
        for (List<Integer> group : groups) {
            List<Entity> members = new ArrayList<>(group.size());
            for (int index : group) {
                members.add(entities.get(index));
            }
            clusters.add(toCluster(members));
        }
        log.debug("fusion.entities.clustered inputCount={} clusterCount={} mode={}",
                entities.size(), clusters.size(), options.getClusteringMode());
        return clusters;
    }

    /**
     * Fuses one cluster. A singleton comes back unchanged at confidence 1.0.
     */
    public FusionResult<Entity> fuseCluster(EntityCluster cluster) {
        if (cluster.isSingleton()) {
            return FusionResult.single(cluster.members().get(0));
        }
        List<Entity> members = cluster.members();
        List<String> names = new ArrayList<>(members.size());
        List<String> types = new ArrayList<>(members.size());
        List<Map<String, PropertyValue>> properties = new ArrayList<>(members.size());
        for (Entity member : members) {
            names.add(member.getName());
            types.add(member.getType());
            properties.add(member.getProperties());
        }

        String name = fuseNames(names);
        Set<String> aliases = new LinkedHashSet<>();
        for (Entity member : members) {
            aliases.add(member.getName());
            aliases.addAll(member.getAliases());
        }
        aliases.remove(name);

        Entity fused = Entity.builder()
                .id(cluster.representative().getId())
                .name(name)
                .type(fuseTypes(types))
                .properties(PropertyMerger.mergeEntityProperties(properties))
                .aliases(aliases)
                .build();

        double confidence = fusionConfidence(members, fused);
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(FusionResult.METHOD, MULTI_ENTITY_FUSION);
        evidence.put(FusionResult.SOURCE_COUNT, members.size());
        evidence.put(FusionResult.CLUSTER_CONFIDENCE, cluster.confidence());
        evidence.put("representative_id", cluster.representative().getId());
        log.debug("fusion.entity.fused id={} name={} sourceCount={} confidence={}",
                fused.getId(), fused.getName(), members.size(), confidence);
        return new FusionResult<>(fused, members, confidence, evidence);
    }

    public FusionStatistics statistics(List<FusionResult<Entity>> results) {
        return FusionStatistics.of(results, Entity::getType);
    }

    /**
     * Highest {@link #representativeScore}; the earliest member wins ties.
     */
    public Entity selectRepresentative(List<Entity> members) {
        Entity best = members.get(0);
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

    static double representativeScore(Entity entity) {
        return 0.1 * entity.getName().length()
                + 0.2 * entity.getProperties().size()
                + 0.1 * entity.getAliases().size()
                + 0.5 * entity.declaredConfidence().orElse(0.0);
    }

    static String fuseNames(List<String> names) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(names));
        if (distinct.size() == 1) {
            return distinct.get(0);
        }
        String longest = null;
        for (String name : distinct) {
            if (isAbbreviation(name)) {
                continue;
            }
            if (longest == null || name.length() > longest.length()) {
                longest = name;
            }
        }
        return longest != null ? longest : mostFrequent(names);
    }

    static String fuseTypes(List<String> types) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String type : types) {
            counts.merge(type, 1, Integer::sum);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > best || (count == best && entry.getKey().length() > winner.length())) {
                winner = entry.getKey();
                best = count;
            }
        }
        return winner;
    }

    /**
     * A short token whose cased characters are all upper case, e.g. "IBM".
     * Strings without cased characters (such as CJK names) are never abbreviations.
     */
    static boolean isAbbreviation(String name) {
        if (name.length() > MAX_ABBREVIATION_LENGTH) {
            return false;
        }
        boolean cased = false;
        for (int i = 0; i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (Character.isLowerCase(cp) || Character.isTitleCase(cp)) {
                return false;
            }
            if (Character.isUpperCase(cp)) {
                cased = true;
            }
            i += Character.charCount(cp);
        }
        return cased;
    }

    static double fusionConfidence(List<Entity> members, Entity fused) {
        if (members.size() == 1) {
            return 1.0;
        }
        double sourceFactor = Math.min(1.0, members.size() / SATURATING_SOURCE_COUNT);
        int totalProperties = 0;
        Set<String> names = new LinkedHashSet<>();
        Set<String> types = new LinkedHashSet<>();
        for (Entity member : members) {
            totalProperties += member.getProperties().size();
            names.add(member.getName());
            types.add(member.getType());
        }
        double completeness = totalProperties > 0
                ? (double) fused.getProperties().size() / totalProperties
                : 0.5;
        double consistency = ((names.size() == 1 ? 1.0 : 0.0) + (types.size() == 1 ? 1.0 : 0.0)) / 2.0;
        double confidence = SOURCE_WEIGHT * sourceFactor
                + COMPLETENESS_WEIGHT * completeness
                + CONSISTENCY_WEIGHT * consistency;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private EntityCluster toCluster(List<Entity> members) {
        if (members.size() == 1) {
            return new EntityCluster(UUID.randomUUID().toString(), members, members.get(0), 1.0,
                    EntityCluster.SINGLE_ENTITY);
        }
        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                total += similarity.entitySimilarity(members.get(i), members.get(j));
                pairs++;
            }
        }
        return new EntityCluster(UUID.randomUUID().toString(), members, selectRepresentative(members),
                total / pairs, EntityCluster.SIMILARITY_BASED);
    }

    private static String mostFrequent(List<String> values) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        String winner = values.get(0);
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner;
    }
}
