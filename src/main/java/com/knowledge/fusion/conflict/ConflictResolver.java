package com.knowledge.fusion.conflict;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.logging.LogContext;
import com.knowledge.fusion.metrics.FusionMetrics;
import com.knowledge.fusion.metrics.NoOpFusionMetrics;
import com.knowledge.fusion.review.ReviewItem;
import com.knowledge.fusion.review.ReviewQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.knowledge.fusion.conflict.ResolutionStrategy.*;

/**
 * Detects residual contradictions in a fused entity/relation set and resolves
 * them through a per-kind strategy table.
 *
 * <p>Detection groups entities by id and relations by (head, tail), both in
 * first-seen order. Resolution never aborts a batch: a failing strategy is
 * replaced by "first conflicting item, confidence 0.1". Every resolved conflict,
 * including fallbacks, is appended to the {@link ConflictHistory}.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final double FALLBACK_CONFIDENCE = 0.1;
    static final double NOT_APPLICABLE_CONFIDENCE = 0.5;

    /**
     * Strategies applicable to each kind; the first one is the default.
     */
    static final Map<ConflictType, List<ResolutionStrategy>> STRATEGIES;

    static {
        Map<ConflictType, List<ResolutionStrategy>> strategies = new EnumMap<>(ConflictType.class);
        strategies.put(ConflictType.ENTITY_NAME_CONFLICT,
                List.of(HIGHEST_CONFIDENCE, MOST_FREQUENT, LONGEST_NAME, MANUAL_REVIEW));
        strategies.put(ConflictType.ENTITY_TYPE_CONFLICT,
                List.of(MOST_SPECIFIC_TYPE, HIGHEST_CONFIDENCE, VOTE, MANUAL_REVIEW));
        strategies.put(ConflictType.PROPERTY_VALUE_CONFLICT,
                List.of(HIGHEST_CONFIDENCE, VOTE, AVERAGE_NUMERIC, UNION_LISTS, MANUAL_REVIEW));
        strategies.put(ConflictType.RELATION_TYPE_CONFLICT,
                List.of(HIGHEST_CONFIDENCE, MOST_FREQUENT, MANUAL_REVIEW));
        strategies.put(ConflictType.TEMPORAL_CONFLICT,
                List.of(HIGHEST_CONFIDENCE, MANUAL_REVIEW));
        strategies.put(ConflictType.CONTRADICTORY_RELATIONS,
                List.of(HIGHEST_CONFIDENCE, SOURCE_AUTHORITY, MANUAL_REVIEW));
        STRATEGIES = Collections.unmodifiableMap(strategies);
    }

    /**
     * Relation type pairs that cannot both hold between the same two entities.
     */
    static final List<List<String>> CONTRADICTORY_PAIRS = List.of(
            List.of("parent_of", "child_of"),
            List.of("spouse_of", "sibling_of"),
            List.of("works_for", "competes_with"),
            List.of("located_in", "not_located_in"));

    private final ConflictHistory history = new ConflictHistory();
    private final ReviewQueue reviewQueue;
    private final FusionMetrics metrics;

    public ConflictResolver() {
        this(null, NoOpFusionMetrics.INSTANCE);
    }

    /**
     * @param reviewQueue receives {@link ResolutionStrategy#MANUAL_REVIEW} conflicts; may be null
     */
    public ConflictResolver(ReviewQueue reviewQueue, FusionMetrics metrics) {
        this.reviewQueue = reviewQueue;
        this.metrics = metrics != null ? metrics : NoOpFusionMetrics.INSTANCE;
    }

    public List<Conflict> detectEntityConflicts(List<Entity> entities) {
        Map<String, List<Entity>> byId = new LinkedHashMap<>();
        for (Entity entity : entities) {
            byId.computeIfAbsent(entity.getId(), k -> new ArrayList<>()).add(entity);
        }
        List<Conflict> conflicts = new ArrayList<>();
        byId.forEach((id, group) -> {
            if (group.size() < 2) {
                return;
            }
            List<Double> confidences = new ArrayList<>(group.size());
            List<String> names = new ArrayList<>(group.size());
            List<String> types = new ArrayList<>(group.size());
            for (Entity entity : group) {
                confidences.add(entity.declaredConfidence().orElse(1.0));
                names.add(entity.getName());
                types.add(entity.getType());
            }
            if (new LinkedHashSet<>(names).size() > 1) {
                conflicts.add(new Conflict("name_conflict_" + id, ConflictType.ENTITY_NAME_CONFLICT,
                        "Entity " + id + " has several names", id, null, names, confidences));
            }
            if (new LinkedHashSet<>(types).size() > 1) {
                conflicts.add(new Conflict("type_conflict_" + id, ConflictType.ENTITY_TYPE_CONFLICT,
                        "Entity " + id + " has several types", id, null, types, confidences));
            }
            conflicts.addAll(detectPropertyConflicts(id, group));
        });
        conflicts.forEach(c -> metrics.incrementConflictDetected(c.getType()));
        log.debug("conflicts.entities.detected entityCount={} conflictCount={}", entities.size(), conflicts.size());
        return conflicts;
    }

    public List<Conflict> detectRelationConflicts(List<Relation> relations) {
        Map<List<String>, List<Relation>> byPair = new LinkedHashMap<>();
        for (Relation relation : relations) {
            byPair.computeIfAbsent(List.of(relation.getHeadEntityId(), relation.getTailEntityId()),
                    k -> new ArrayList<>()).add(relation);
        }
        List<Conflict> conflicts = new ArrayList<>();
        byPair.forEach((pair, group) -> {
            if (group.size() < 2) {
                return;
            }
            String head = pair.get(0);
            String tail = pair.get(1);
            List<String> types = new ArrayList<>(group.size());
            List<Double> confidences = new ArrayList<>(group.size());
            for (Relation relation : group) {
                types.add(relation.getType());
                confidences.add(relation.getConfidence());
            }
            Set<String> distinctTypes = new LinkedHashSet<>(types);
            if (distinctTypes.size() < 2) {
                return;
            }
            String subject = head + "->" + tail;
            if (areContradictory(distinctTypes)) {
                conflicts.add(new Conflict("contradictory_relations_" + head + "_" + tail,
                        ConflictType.CONTRADICTORY_RELATIONS,
                        "Entities " + head + " and " + tail + " have contradictory relations",
                        subject, null, group, confidences));
            } else {
                conflicts.add(new Conflict("relation_type_conflict_" + head + "_" + tail,
                        ConflictType.RELATION_TYPE_CONFLICT,
                        "Entities " + head + " and " + tail + " have several relation types",
                        subject, null, types, confidences));
            }
        });
        conflicts.forEach(c -> metrics.incrementConflictDetected(c.getType()));
        log.debug("conflicts.relations.detected relationCount={} conflictCount={}", relations.size(), conflicts.size());
        return conflicts;
    }

    /**
     * Resolves with the default (first) strategy of the conflict's kind.
     */
    public Conflict resolveConflict(Conflict conflict) {
        return resolveConflict(conflict, null);
    }

    /**
     * Resolves the conflict in place and records it in the history.
     * A strategy outside the kind's table picks the first item with confidence 0.5.
     *
     * @param strategy strategy to apply, or null for the kind's default
     * @throws IllegalStateException if the conflict was already resolved
     */
    public Conflict resolveConflict(Conflict conflict, ResolutionStrategy strategy) {
        if (conflict.isResolved()) {
            throw new IllegalStateException("Conflict already resolved: " + conflict.getId());
        }
        ResolutionStrategy chosen = strategy != null ? strategy : defaultStrategy(conflict.getType());
        try {
            Resolution resolution = apply(conflict, chosen);
            conflict.resolve(chosen, resolution.value(), resolution.confidence(), false);
        } catch (RuntimeException e) {
            log.error("conflicts.resolve.failed conflictId={} strategy={}, falling back to first item",
                    conflict.getId(), chosen, e);
            metrics.incrementConflictFallback(conflict.getType());
            conflict.resolve(chosen, conflict.getConflictingItems().get(0), FALLBACK_CONFIDENCE, true);
        }
        history.append(conflict);
        return conflict;
    }

    /**
     * Resolves every conflict, using the override for its kind when one is given.
     * A single failing conflict never stops the batch. Conflicts that are already
     * resolved are returned as they are and not recorded again.
     */
    public List<Conflict> batchResolve(List<Conflict> conflicts, Map<ConflictType, ResolutionStrategy> overrides) {
        try (LogContext ctx = LogContext.forConflicts(LogContext.generateCorrelationId())) {
            List<Conflict> resolved = new ArrayList<>(conflicts.size());
            for (Conflict conflict : conflicts) {
                if (conflict.isResolved()) {
                    log.warn("conflicts.batch.alreadyResolved conflictId={}", conflict.getId());
                    resolved.add(conflict);
                    continue;
                }
                ResolutionStrategy override = overrides != null ? overrides.get(conflict.getType()) : null;
                resolved.add(resolveConflict(conflict, override));
            }
            long fallbacks = resolved.stream().filter(Conflict::isFallback).count();
            log.info("conflicts.batch.completed conflictCount={} fallbackCount={}", resolved.size(), fallbacks);
            return resolved;
        }
    }

    public List<Conflict> batchResolve(List<Conflict> conflicts) {
        return batchResolve(conflicts, Map.of());
    }

    public ConflictHistory getHistory() {
        return history;
    }

    public ConflictStatistics statistics(List<Conflict> conflicts) {
        return ConflictStatistics.of(conflicts);
    }

    public static List<ResolutionStrategy> availableStrategies(ConflictType type) {
        return STRATEGIES.getOrDefault(type, List.of(HIGHEST_CONFIDENCE));
    }

    public static ResolutionStrategy defaultStrategy(ConflictType type) {
        return availableStrategies(type).get(0);
    }

    static boolean areContradictory(Set<String> types) {
        for (List<String> pair : CONTRADICTORY_PAIRS) {
            if (types.contains(pair.get(0)) && types.contains(pair.get(1))) {
                return true;
            }
        }
        return false;
    }

    private List<Conflict> detectPropertyConflicts(String entityId, List<Entity> group) {
        Map<String, List<PropertyValue>> valuesByKey = new LinkedHashMap<>();
        Map<String, List<Double>> confidencesByKey = new LinkedHashMap<>();
        for (Entity entity : group) {
            double confidence = entity.declaredConfidence().orElse(1.0);
            entity.getProperties().forEach((key, value) -> {
                valuesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
                confidencesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(confidence);
            });
        }
        List<Conflict> conflicts = new ArrayList<>();
        valuesByKey.forEach((key, values) -> {
            Set<String> distinct = new LinkedHashSet<>();
            values.forEach(v -> distinct.add(v.asText()));
            if (distinct.size() > 1) {
                conflicts.add(new Conflict("property_conflict_" + entityId + "_" + key,
                        ConflictType.PROPERTY_VALUE_CONFLICT,
                        "Entity " + entityId + " has conflicting values for " + key,
                        entityId, key, values, confidencesByKey.get(key)));
            }
        });
        return conflicts;
    }

    private Resolution apply(Conflict conflict, ResolutionStrategy strategy) {
        List<Object> items = conflict.getConflictingItems();
        if (strategy != MANUAL_REVIEW && !availableStrategies(conflict.getType()).contains(strategy)) {
            log.warn("conflicts.strategy.notApplicable conflictId={} strategy={}", conflict.getId(), strategy);
            return new Resolution(items.get(0), NOT_APPLICABLE_CONFIDENCE);
        }
        return switch (strategy) {
            case HIGHEST_CONFIDENCE -> highestConfidence(conflict);
            case MOST_FREQUENT, VOTE -> vote(items);
            case LONGEST_NAME -> new Resolution(longest(items), 0.7);
            case MOST_SPECIFIC_TYPE -> new Resolution(longest(items), 0.8);
            case AVERAGE_NUMERIC -> averageNumeric(items);
            case UNION_LISTS -> unionLists(items);
            case SOURCE_AUTHORITY -> new Resolution(items.get(0), 0.6);
            case MANUAL_REVIEW -> manualReview(conflict);
        };
    }

    private Resolution highestConfidence(Conflict conflict) {
        List<Object> items = conflict.getConflictingItems();
        List<Double> scores = conflict.getConfidenceScores();
        if (scores.size() != items.size()) {
            throw new ConflictResolutionException(conflict.getId(),
                    "Expected " + items.size() + " confidence scores, got " + scores.size());
        }
        int best = 0;
        for (int i = 1; i < scores.size(); i++) {
            if (scores.get(i) > scores.get(best)) {
                best = i;
            }
        }
        return new Resolution(items.get(best), scores.get(best));
    }

    private static Resolution vote(List<Object> items) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Object> firstByText = new LinkedHashMap<>();
        for (Object item : items) {
            String text = textOf(item);
            counts.merge(text, 1, Integer::sum);
            firstByText.putIfAbsent(text, item);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return new Resolution(firstByText.get(winner), (double) best / items.size());
    }

    private static Object longest(List<Object> items) {
        Object longest = items.get(0);
        for (Object item : items) {
            if (textOf(item).length() > textOf(longest).length()) {
                longest = item;
            }
        }
        return longest;
    }

    private static Resolution averageNumeric(List<Object> items) {
        double sum = 0.0;
        for (Object item : items) {
            Double number = numericValue(item);
            if (number == null) {
                return vote(items);
            }
            sum += number;
        }
        return new Resolution(PropertyValue.of(sum / items.size()), 0.8);
    }

    private static Resolution unionLists(List<Object> items) {
        List<PropertyValue> lists = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof PropertyValue.ListValue list)) {
                return vote(items);
            }
            lists.add(list);
        }
        Set<PropertyValue> union = new LinkedHashSet<>();
        lists.forEach(list -> union.addAll(((PropertyValue.ListValue) list).items()));
        return new Resolution(PropertyValue.ofList(new ArrayList<>(union)), 0.9);
    }

    private Resolution manualReview(Conflict conflict) {
        if (reviewQueue != null) {
            List<String> candidates = new ArrayList<>();
            conflict.getConflictingItems().forEach(item -> candidates.add(textOf(item)));
            ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                    .conflictId(conflict.getId())
                    .conflictType(conflict.getType())
                    .subjectId(conflict.getSubjectId())
                    .description(conflict.getDescription())
                    .candidateValues(candidates)
                    .build());
            log.info("conflicts.review.submitted conflictId={} reviewId={}", conflict.getId(), item.getId());
        } else {
            log.warn("conflicts.review.noQueue conflictId={}", conflict.getId());
        }
        return new Resolution(conflict.getConflictingItems().get(0), 0.0);
    }

    private static Double numericValue(Object item) {
        if (item instanceof PropertyValue.NumberValue number) {
            return number.value();
        }
        if (item instanceof PropertyValue.StringValue text) {
            try {
                return Double.parseDouble(text.value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (item instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    static String textOf(Object item) {
        if (item instanceof PropertyValue value) {
            return value.asText();
        }
        if (item instanceof Relation relation) {
            return relation.getType();
        }
        return String.valueOf(item);
    }

    private record Resolution(Object value, double confidence) {
    }
}
