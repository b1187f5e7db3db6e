package com.knowledge.fusion.graph;

import com.knowledge.fusion.conflict.Conflict;
import com.knowledge.fusion.conflict.ConflictResolver;
import com.knowledge.fusion.conflict.ConflictType;
import com.knowledge.fusion.conflict.ResolutionStrategy;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.EntityPair;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.fusion.EntityFusionEngine;
import com.knowledge.fusion.fusion.FusionResult;
import com.knowledge.fusion.fusion.RelationFusionEngine;
import com.knowledge.fusion.logging.LogContext;
import com.knowledge.fusion.metrics.FusionMetrics;
import com.knowledge.fusion.metrics.NoOpFusionMetrics;
import com.knowledge.fusion.ontology.InMemoryOntology;
import com.knowledge.fusion.ontology.Ontology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory, multi-indexed knowledge graph.
 *
 * <p>Besides the entity and relation maps the store keeps a type index for each,
 * a (head, tail) index, a name index over names and aliases, and an incident-relation
 * index per entity. Every mutating call leaves all indices consistent with the maps;
 * {@link #checkIndexConsistency()} verifies this.</p>
 *
 * <p>Name collisions between different entities resolve to the entity added last.</p>
 *
 * <p>Not thread-safe: callers serialize access, one writer at a time.</p>
 */
public class KnowledgeGraphStore {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphStore.class);

    private final Ontology ontology;
    private final EntityFusionEngine entityFusion;
    private final RelationFusionEngine relationFusion;
    private final ConflictResolver conflictResolver;
    private final FusionMetrics metrics;

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<String, Relation> relations = new LinkedHashMap<>();
    private final Map<String, Set<String>> entityTypeIndex = new LinkedHashMap<>();
    private final Map<String, Set<String>> relationTypeIndex = new LinkedHashMap<>();
    private final Map<EntityPair, Set<String>> pairIndex = new LinkedHashMap<>();
    private final Map<String, String> nameIndex = new LinkedHashMap<>();
    private final Map<String, Set<String>> incidentIndex = new LinkedHashMap<>();

    public KnowledgeGraphStore() {
        this(InMemoryOntology.defaults());
    }

    public KnowledgeGraphStore(Ontology ontology) {
        this(ontology, new EntityFusionEngine(), new RelationFusionEngine(), new ConflictResolver(),
                NoOpFusionMetrics.INSTANCE);
    }

    public KnowledgeGraphStore(Ontology ontology,
                               EntityFusionEngine entityFusion,
                               RelationFusionEngine relationFusion,
                               ConflictResolver conflictResolver,
                               FusionMetrics metrics) {
        this.ontology = Objects.requireNonNull(ontology, "ontology is required");
        this.entityFusion = Objects.requireNonNull(entityFusion, "entityFusion is required");
        this.relationFusion = Objects.requireNonNull(relationFusion, "relationFusion is required");
        this.conflictResolver = Objects.requireNonNull(conflictResolver, "conflictResolver is required");
        this.metrics = metrics != null ? metrics : NoOpFusionMetrics.INSTANCE;
    }

    // --- mutation ---

    /**
     * Inserts the entity, replacing any entity with the same id. Relations
     * incident to that id stay attached.
     */
    public void addEntity(Entity entity) {
        Entity previous = entities.put(entity.getId(), entity);
        if (previous != null) {
            unindexEntity(previous);
        }
        entityTypeIndex.computeIfAbsent(entity.getType(), k -> new LinkedHashSet<>()).add(entity.getId());
        nameIndex.put(entity.getName(), entity.getId());
        for (String alias : entity.getAliases()) {
            nameIndex.put(alias, entity.getId());
        }
        incidentIndex.computeIfAbsent(entity.getId(), k -> new LinkedHashSet<>());
    }

    /**
     * Inserts the relation, replacing any relation with the same id.
     *
     * @throws GraphValidationException if the head or tail entity is not present;
     *                                  nothing is modified in that case
     */
    public void addRelation(Relation relation) {
        for (String endpoint : List.of(relation.getHeadEntityId(), relation.getTailEntityId())) {
            if (!entities.containsKey(endpoint)) {
                metrics.incrementRelationRejected();
                throw new GraphValidationException(relation.getId(), endpoint);
            }
        }
        Relation previous = relations.put(relation.getId(), relation);
        if (previous != null) {
            unindexRelation(previous);
        }
        relationTypeIndex.computeIfAbsent(relation.getType(), k -> new LinkedHashSet<>()).add(relation.getId());
        pairIndex.computeIfAbsent(relation.pair(), k -> new LinkedHashSet<>()).add(relation.getId());
        incidentIndex.get(relation.getHeadEntityId()).add(relation.getId());
        incidentIndex.get(relation.getTailEntityId()).add(relation.getId());
    }

    public int batchAddEntities(Collection<Entity> batch) {
        batch.forEach(this::addEntity);
        return batch.size();
    }

    /**
     * Adds each relation; one refused relation never stops the batch.
     */
    public IngestResult batchAddRelations(Collection<Relation> batch) {
        int accepted = 0;
        List<IngestResult.RejectedRelation> rejected = new ArrayList<>();
        for (Relation relation : batch) {
            try {
                addRelation(relation);
                accepted++;
            } catch (GraphValidationException e) {
                log.warn("graph.relation.rejected relationId={} missingEntityId={}",
                        e.getRelationId(), e.getMissingEntityId());
                rejected.add(new IngestResult.RejectedRelation(relation.getId(), e.getMessage()));
            }
        }
        return new IngestResult(accepted, rejected);
    }

    public boolean removeRelation(String relationId) {
        Relation removed = relations.remove(relationId);
        if (removed == null) {
            return false;
        }
        unindexRelation(removed);
        return true;
    }

    /**
     * Removes the entity and every relation incident to it.
     */
    public boolean removeEntity(String entityId) {
        Entity removed = entities.get(entityId);
        if (removed == null) {
            return false;
        }
        List<String> incident = new ArrayList<>(incidentIndex.getOrDefault(entityId, Set.of()));
        incident.forEach(this::removeRelation);
        entities.remove(entityId);
        unindexEntity(removed);
        incidentIndex.remove(entityId);
        log.debug("graph.entity.removed entityId={} cascadedRelations={}", entityId, incident.size());
        return true;
    }

    public void clear() {
        entities.clear();
        relations.clear();
        entityTypeIndex.clear();
        relationTypeIndex.clear();
        pairIndex.clear();
        nameIndex.clear();
        incidentIndex.clear();
    }

    // --- lookup ---

    public Optional<Entity> getEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    /**
     * Looks an entity up by name or alias.
     */
    public Optional<Entity> getEntityByName(String name) {
        String id = nameIndex.get(name);
        return id != null ? Optional.ofNullable(entities.get(id)) : Optional.empty();
    }

    public Optional<Relation> getRelation(String relationId) {
        return Optional.ofNullable(relations.get(relationId));
    }

    public List<Entity> getEntities() {
        return new ArrayList<>(entities.values());
    }

    public List<Relation> getRelations() {
        return new ArrayList<>(relations.values());
    }

    public List<Entity> getEntitiesByType(String type) {
        List<Entity> result = new ArrayList<>();
        entityTypeIndex.getOrDefault(type, Set.of()).forEach(id -> result.add(entities.get(id)));
        return result;
    }

    public List<Relation> getRelationsByType(String type) {
        return resolveRelations(relationTypeIndex.getOrDefault(type, Set.of()));
    }

    /**
     * Relations from head to tail, in insertion order. Direction matters.
     */
    public List<Relation> getRelationsBetween(String headEntityId, String tailEntityId) {
        return resolveRelations(pairIndex.getOrDefault(new EntityPair(headEntityId, tailEntityId), Set.of()));
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationCount() {
        return relations.size();
    }

    public Ontology getOntology() {
        return ontology;
    }

    // --- structural queries ---

    /**
     * Entities linked to the given one in either direction, optionally through
     * relations of one type only. Each neighbour appears once.
     *
     * @param relationType relation type filter, or null for all types
     */
    public Set<String> neighbors(String entityId, String relationType) {
        Set<String> result = new LinkedHashSet<>();
        for (String relationId : incidentIndex.getOrDefault(entityId, Set.of())) {
            Relation relation = relations.get(relationId);
            if (relationType != null && !relationType.equals(relation.getType())) {
                continue;
            }
            if (relation.getHeadEntityId().equals(entityId)) {
                result.add(relation.getTailEntityId());
            }
            if (relation.getTailEntityId().equals(entityId)) {
                result.add(relation.getHeadEntityId());
            }
        }
        return result;
    }

    public Set<String> neighbors(String entityId) {
        return neighbors(entityId, null);
    }

    /**
     * Every simple path from start to end with at most {@code maxDepth} hops,
     * ignoring edge direction. Depth-first; an entity is on the current path at
     * most once and is released when the search backtracks.
     *
     * @return paths as entity id lists including both ends; empty when start equals
     * end, when either is absent, or when no path exists
     */
    public List<List<String>> findPath(String startId, String endId, int maxDepth) {
        List<List<String>> paths = new ArrayList<>();
        if (startId.equals(endId) || !entities.containsKey(startId) || !entities.containsKey(endId)
                || maxDepth < 1) {
            return paths;
        }
        Deque<String> path = new ArrayDeque<>();
        Set<String> onPath = new LinkedHashSet<>();
        path.addLast(startId);
        onPath.add(startId);
        searchPaths(startId, endId, maxDepth, path, onPath, paths);
        return paths;
    }

    private void searchPaths(String current, String endId, int remaining, Deque<String> path,
                             Set<String> onPath, List<List<String>> paths) {
        for (String next : neighbors(current)) {
            if (onPath.contains(next)) {
                continue;
            }
            if (next.equals(endId)) {
                List<String> found = new ArrayList<>(path);
                found.add(next);
                paths.add(found);
                continue;
            }
            if (remaining > 1) {
                path.addLast(next);
                onPath.add(next);
                searchPaths(next, endId, remaining - 1, path, onPath, paths);
                onPath.remove(next);
                path.removeLast();
            }
        }
    }

    /**
     * Expands the seeds through {@link #neighbors} for {@code depth} rounds and
     * returns a new store holding the reached entities and the relations between them.
     */
    public KnowledgeGraphStore querySubgraph(Collection<String> seedIds, int depth) {
        Set<String> reached = new LinkedHashSet<>();
        for (String seed : seedIds) {
            if (entities.containsKey(seed)) {
                reached.add(seed);
            }
        }
        for (int round = 0; round < depth; round++) {
            Set<String> frontier = new LinkedHashSet<>();
            for (String id : reached) {
                frontier.addAll(neighbors(id));
            }
            if (!reached.addAll(frontier)) {
                break;
            }
        }
        KnowledgeGraphStore subgraph = new KnowledgeGraphStore(ontology, entityFusion, relationFusion,
                conflictResolver, metrics);
        for (Entity entity : entities.values()) {
            if (reached.contains(entity.getId())) {
                subgraph.addEntity(entity);
            }
        }
        for (Relation relation : relations.values()) {
            if (reached.contains(relation.getHeadEntityId()) && reached.contains(relation.getTailEntityId())) {
                subgraph.addRelation(relation);
            }
        }
        return subgraph;
    }

    // --- merge, conflicts, validation ---

    /**
     * Merges another store into this one by re-fusing the combined graph.
     *
     * <p>Entities of both stores are fused together; every relation's endpoints are
     * rewritten to the fused ids (relations whose endpoint did not survive are dropped);
     * the remapped relations are fused; this store is then cleared and re-populated.
     * The whole combined graph is reprocessed on every call. The other store is not
     * modified.</p>
     */
    public MergeReport mergeKnowledgeGraph(KnowledgeGraphStore other) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forGraphMerge(LogContext.generateCorrelationId())) {
            List<Entity> allEntities = new ArrayList<>(entities.values());
            allEntities.addAll(other.entities.values());
            List<Relation> allRelations = new ArrayList<>(relations.values());
            allRelations.addAll(other.relations.values());

            List<FusionResult<Entity>> entityResults = entityFusion.batchFuse(allEntities);
            Map<String, String> remap = new LinkedHashMap<>();
            Map<String, Entity> fusedEntities = new LinkedHashMap<>();
            for (FusionResult<Entity> result : entityResults) {
                Entity fused = result.fusedItem();
                fusedEntities.put(fused.getId(), fused);
                for (Entity source : result.sourceItems()) {
                    remap.put(source.getId(), fused.getId());
                }
            }

            List<Relation> remapped = new ArrayList<>(allRelations.size());
            int dropped = 0;
            for (Relation relation : allRelations) {
                String head = remap.getOrDefault(relation.getHeadEntityId(), relation.getHeadEntityId());
                String tail = remap.getOrDefault(relation.getTailEntityId(), relation.getTailEntityId());
                if (!fusedEntities.containsKey(head) || !fusedEntities.containsKey(tail)) {
                    dropped++;
                    log.warn("graph.merge.relationDropped relationId={} head={} tail={}",
                            relation.getId(), head, tail);
                    continue;
                }
                remapped.add(Relation.builder(relation).headEntityId(head).tailEntityId(tail).build());
            }
            List<FusionResult<Relation>> relationResults = relationFusion.batchFuse(remapped);

            clear();
            fusedEntities.values().forEach(this::addEntity);
            for (FusionResult<Relation> result : relationResults) {
                addRelation(result.fusedItem());
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordGraphMerge(entities.size(), relations.size(), duration);
            MergeReport report = new MergeReport(allEntities.size(), entities.size(),
                    allRelations.size(), relations.size(), dropped, remap);
            log.info("graph.merge.completed inputEntities={} outputEntities={} inputRelations={} "
                            + "outputRelations={} droppedRelations={} durationMs={}",
                    report.inputEntities(), report.outputEntities(), report.inputRelations(),
                    report.outputRelations(), dropped, duration.toMillis());
            return report;
        }
    }

    /**
     * Detects conflicts over the store's current content and resolves them with
     * each kind's default strategy. The store itself is not modified.
     */
    public List<Conflict> detectAndResolveConflicts() {
        return detectAndResolveConflicts(Map.of());
    }

    public List<Conflict> detectAndResolveConflicts(Map<ConflictType, ResolutionStrategy> overrides) {
        List<Conflict> conflicts = new ArrayList<>(conflictResolver.detectEntityConflicts(getEntities()));
        conflicts.addAll(conflictResolver.detectRelationConflicts(getRelations()));
        return conflictResolver.batchResolve(conflicts, overrides);
    }

    /**
     * Reports orphaned relations and relations the ontology rejects. Never throws.
     */
    public ValidationReport validate() {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Relation relation : relations.values()) {
            Entity head = entities.get(relation.getHeadEntityId());
            Entity tail = entities.get(relation.getTailEntityId());
            if (head == null || tail == null) {
                issues.add(new ValidationIssue(ValidationIssue.Kind.ORPHANED_RELATION, relation.getId(),
                        "Relation " + relation.getId() + " references a missing entity"));
                continue;
            }
            if (!ontology.validateRelation(relation.getType(), head.getType(), tail.getType())) {
                issues.add(new ValidationIssue(ValidationIssue.Kind.ONTOLOGY_MISMATCH, relation.getId(),
                        "Relation " + relation.getId() + " (" + head.getType() + " -" + relation.getType()
                                + "-> " + tail.getType() + ") is not allowed by the ontology"));
            }
        }
        if (!issues.isEmpty()) {
            log.warn("graph.validate.issues issueCount={}", issues.size());
        }
        return new ValidationReport(issues, getStatistics());
    }

    public GraphStatistics getStatistics() {
        Map<String, Integer> entityTypes = new LinkedHashMap<>();
        entities.values().forEach(e -> entityTypes.merge(e.getType(), 1, Integer::sum));
        Map<String, Integer> relationTypes = new LinkedHashMap<>();
        relations.values().forEach(r -> relationTypes.merge(r.getType(), 1, Integer::sum));

        int n = entities.size();
        int m = relations.size();
        double averageDegree = n > 0 ? 2.0 * m / n : 0.0;
        double density = n > 1 ? (double) m / ((double) n * (n - 1)) : 0.0;
        return new GraphStatistics(n, m, entityTypes, relationTypes, averageDegree,
                countWeakComponents(), density);
    }

    /**
     * Lists every broken index invariant; an empty list means the store is consistent.
     */
    public List<String> checkIndexConsistency() {
        List<String> problems = new ArrayList<>();
        checkMembership(problems, "entity type", entityTypeIndex, entities.keySet(),
                id -> entities.get(id).getType());
        checkMembership(problems, "relation type", relationTypeIndex, relations.keySet(),
                id -> relations.get(id).getType());
        checkMembership(problems, "pair", pairIndex, relations.keySet(), id -> relations.get(id).pair());

        nameIndex.forEach((name, id) -> {
            Entity entity = entities.get(id);
            if (entity == null) {
                problems.add("name index: '" + name + "' points to missing entity " + id);
            } else if (!entity.getName().equals(name) && !entity.getAliases().contains(name)) {
                problems.add("name index: '" + name + "' points to " + id + " which has no such name");
            }
        });
        for (Entity entity : entities.values()) {
            List<String> names = new ArrayList<>(entity.getAliases());
            names.add(entity.getName());
            for (String name : names) {
                if (!nameIndex.containsKey(name)) {
                    problems.add("name index: '" + name + "' of entity " + entity.getId() + " is not indexed");
                }
            }
        }

        if (!incidentIndex.keySet().equals(entities.keySet())) {
            problems.add("incident index keys differ from entity ids");
        }
        for (Relation relation : relations.values()) {
            for (String endpoint : List.of(relation.getHeadEntityId(), relation.getTailEntityId())) {
                if (!entities.containsKey(endpoint)) {
                    problems.add("relation " + relation.getId() + " references missing entity " + endpoint);
                } else if (!incidentIndex.get(endpoint).contains(relation.getId())) {
                    problems.add("incident index: relation " + relation.getId() + " missing for " + endpoint);
                }
            }
        }
        incidentIndex.forEach((entityId, relationIds) -> relationIds.forEach(relationId -> {
            if (!relations.containsKey(relationId)) {
                problems.add("incident index: " + entityId + " lists missing relation " + relationId);
            }
        }));
        return problems;
    }

    // --- internals ---

    private void unindexEntity(Entity entity) {
        removeFromIndex(entityTypeIndex, entity.getType(), entity.getId());
        List<String> freed = new ArrayList<>();
        if (nameIndex.remove(entity.getName(), entity.getId())) {
            freed.add(entity.getName());
        }
        for (String alias : entity.getAliases()) {
            if (nameIndex.remove(alias, entity.getId())) {
                freed.add(alias);
            }
        }
        freed.forEach(this::repointName);
    }

    // Hands a freed name to the last remaining entity carrying it.
    private void repointName(String name) {
        String holder = null;
        for (Entity candidate : entities.values()) {
            if (candidate.getName().equals(name) || candidate.getAliases().contains(name)) {
                holder = candidate.getId();
            }
        }
        if (holder != null) {
            nameIndex.put(name, holder);
        }
    }

    private void unindexRelation(Relation relation) {
        removeFromIndex(relationTypeIndex, relation.getType(), relation.getId());
        removeFromIndex(pairIndex, relation.pair(), relation.getId());
        Set<String> headIncident = incidentIndex.get(relation.getHeadEntityId());
        if (headIncident != null) {
            headIncident.remove(relation.getId());
        }
        Set<String> tailIncident = incidentIndex.get(relation.getTailEntityId());
        if (tailIncident != null) {
            tailIncident.remove(relation.getId());
        }
    }

    private static <K> void removeFromIndex(Map<K, Set<String>> index, K key, String id) {
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private List<Relation> resolveRelations(Set<String> ids) {
        List<Relation> result = new ArrayList<>(ids.size());
        ids.forEach(id -> result.add(relations.get(id)));
        return result;
    }

    private int countWeakComponents() {
        Set<String> seen = new LinkedHashSet<>();
        int components = 0;
        for (String id : entities.keySet()) {
            if (!seen.add(id)) {
                continue;
            }
            components++;
            Deque<String> queue = new ArrayDeque<>();
            queue.add(id);
            while (!queue.isEmpty()) {
                for (String next : neighbors(queue.poll())) {
                    if (seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }
        return components;
    }

    private static <K> void checkMembership(List<String> problems, String indexName,
                                            Map<K, Set<String>> index, Set<String> liveIds,
                                            Function<String, K> keyOf) {
        int indexed = 0;
        for (Map.Entry<K, Set<String>> entry : index.entrySet()) {
            if (entry.getValue().isEmpty()) {
                problems.add(indexName + " index: empty bucket " + entry.getKey());
            }
            for (String id : entry.getValue()) {
                indexed++;
                if (!liveIds.contains(id)) {
                    problems.add(indexName + " index: " + entry.getKey() + " lists missing id " + id);
                } else if (!keyOf.apply(id).equals(entry.getKey())) {
                    problems.add(indexName + " index: " + id + " filed under " + entry.getKey());
                }
            }
        }
        if (indexed != liveIds.size()) {
            problems.add(indexName + " index holds " + indexed + " ids for " + liveIds.size() + " items");
        }
    }
}
