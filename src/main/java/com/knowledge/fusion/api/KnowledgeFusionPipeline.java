package com.knowledge.fusion.api;

import com.knowledge.fusion.conflict.Conflict;
import com.knowledge.fusion.conflict.ConflictResolver;
import com.knowledge.fusion.conflict.ConflictStatistics;
import com.knowledge.fusion.conflict.ConflictType;
import com.knowledge.fusion.conflict.ResolutionStrategy;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.ExtractedEntity;
import com.knowledge.fusion.core.model.ExtractedRelation;
import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.fusion.EntityFusionEngine;
import com.knowledge.fusion.fusion.FusionResult;
import com.knowledge.fusion.fusion.RelationFusionEngine;
import com.knowledge.fusion.graph.IngestResult;
import com.knowledge.fusion.graph.KnowledgeGraphStore;
import com.knowledge.fusion.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a batch of candidates through fusion, conflict resolution and ingestion.
 *
 * <p>Phases run in order on fully materialised inputs:</p>
 * <ol>
 *   <li>entity fusion; relation endpoints are rewritten to the fused ids</li>
 *   <li>relation fusion over the rewritten relations</li>
 *   <li>conflict detection over the fused items and resolution with the configured strategies</li>
 *   <li>entities sharing an id are collapsed using the resolved values; relations that lost a
 *       contradictory-relation conflict are dropped</li>
 *   <li>ingestion into the target store; relations with a missing endpoint are rejected there</li>
 * </ol>
 */
public class KnowledgeFusionPipeline {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeFusionPipeline.class);

    private final EntityFusionEngine entityFusion;
    private final RelationFusionEngine relationFusion;
    private final ConflictResolver conflictResolver;
    private final CandidateMapper candidateMapper;
    private final Map<ConflictType, ResolutionStrategy> strategyOverrides = new EnumMap<>(ConflictType.class);

    public KnowledgeFusionPipeline() {
        this(new EntityFusionEngine(), new RelationFusionEngine(), new ConflictResolver());
    }

    public KnowledgeFusionPipeline(EntityFusionEngine entityFusion,
                                   RelationFusionEngine relationFusion,
                                   ConflictResolver conflictResolver) {
        this.entityFusion = Objects.requireNonNull(entityFusion, "entityFusion is required");
        this.relationFusion = Objects.requireNonNull(relationFusion, "relationFusion is required");
        this.conflictResolver = Objects.requireNonNull(conflictResolver, "conflictResolver is required");
        this.candidateMapper = new CandidateMapper();
    }

    /**
     * Uses the given strategy for every conflict of that kind instead of the kind's default.
     */
    public KnowledgeFusionPipeline withStrategy(ConflictType type, ResolutionStrategy strategy) {
        strategyOverrides.put(type, strategy);
        return this;
    }

    public PipelineResult run(List<ExtractedEntity> entityMentions,
                              List<ExtractedRelation> relationMentions,
                              KnowledgeGraphStore target) {
        return run(candidateMapper.map(entityMentions, relationMentions), target);
    }

    public PipelineResult run(MappedCandidates candidates, KnowledgeGraphStore target) {
        return run(candidates.entities(), candidates.relations(), candidates.unresolvedRelations().size(), target);
    }

    /**
     * Runs already-mapped entity and relation candidates.
     */
    public PipelineResult runCandidates(List<Entity> entities, List<Relation> relations, KnowledgeGraphStore target) {
        return run(entities, relations, 0, target);
    }

    private PipelineResult run(List<Entity> entities, List<Relation> relations, int unresolved,
                               KnowledgeGraphStore target) {
        Objects.requireNonNull(target, "target store is required");
        String batchId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forFusion(batchId, "pipeline")) {
            List<FusionResult<Entity>> entityResults = entityFusion.batchFuse(entities);
            Map<String, String> remap = new HashMap<>();
            List<Entity> fusedEntities = new ArrayList<>(entityResults.size());
            for (FusionResult<Entity> result : entityResults) {
                fusedEntities.add(result.fusedItem());
                for (Entity source : result.sourceItems()) {
                    remap.put(source.getId(), result.fusedItem().getId());
                }
            }

            List<Relation> remapped = new ArrayList<>(relations.size());
            for (Relation relation : relations) {
                remapped.add(Relation.builder(relation)
                        .headEntityId(remap.getOrDefault(relation.getHeadEntityId(), relation.getHeadEntityId()))
                        .tailEntityId(remap.getOrDefault(relation.getTailEntityId(), relation.getTailEntityId()))
                        .build());
            }
            List<FusionResult<Relation>> relationResults = relationFusion.batchFuse(remapped);
            List<Relation> fusedRelations = new ArrayList<>(relationResults.size());
            relationResults.forEach(r -> fusedRelations.add(r.fusedItem()));

            List<Conflict> detected = new ArrayList<>(conflictResolver.detectEntityConflicts(fusedEntities));
            detected.addAll(conflictResolver.detectRelationConflicts(fusedRelations));
            List<Conflict> conflicts = conflictResolver.batchResolve(detected, strategyOverrides);

            List<Entity> finalEntities = collapseEntities(fusedEntities, conflicts);
            List<Relation> dropped = new ArrayList<>();
            List<Relation> finalRelations = dropContradictionLosers(fusedRelations, conflicts, dropped);

            int ingested = target.batchAddEntities(finalEntities);
            IngestResult relationIngest = target.batchAddRelations(finalRelations);

            ConflictStatistics conflictStatistics = conflictResolver.statistics(conflicts);
            log.info("pipeline.completed batchId={} entitiesIn={} entitiesOut={} relationsIn={} relationsOut={} "
                            + "conflicts={} droppedRelations={} rejectedRelations={}",
                    batchId, entities.size(), finalEntities.size(), relations.size(), relationIngest.accepted(),
                    conflicts.size(), dropped.size(), relationIngest.rejectedCount());
            return new PipelineResult(entityResults, relationResults, conflicts, dropped, unresolved,
                    ingested, relationIngest,
                    entityFusion.statistics(entityResults), relationFusion.statistics(relationResults),
                    conflictStatistics);
        }
    }

    /**
     * Collapses fused entities that share an id into one, taking name, type and
     * property values from the resolved conflicts. Losing names become aliases.
     */
    static List<Entity> collapseEntities(List<Entity> fused, List<Conflict> conflicts) {
        Map<String, List<Entity>> byId = new LinkedHashMap<>();
        for (Entity entity : fused) {
            byId.computeIfAbsent(entity.getId(), k -> new ArrayList<>()).add(entity);
        }
        Map<String, List<Conflict>> conflictsBySubject = new HashMap<>();
        for (Conflict conflict : conflicts) {
            conflictsBySubject.computeIfAbsent(conflict.getSubjectId(), k -> new ArrayList<>()).add(conflict);
        }

        List<Entity> collapsed = new ArrayList<>(byId.size());
        byId.forEach((id, group) -> {
            if (group.size() == 1) {
                collapsed.add(group.get(0));
                return;
            }
            Entity first = group.get(0);
            String name = first.getName();
            String type = first.getType();
            Map<String, PropertyValue> properties = new LinkedHashMap<>();
            Set<String> aliases = new LinkedHashSet<>();
            for (Entity entity : group) {
                entity.getProperties().forEach(properties::putIfAbsent);
                aliases.add(entity.getName());
                aliases.addAll(entity.getAliases());
            }
            for (Conflict conflict : conflictsBySubject.getOrDefault(id, List.of())) {
                Object value = conflict.getResolvedValue();
                if (value == null) {
                    continue;
                }
                switch (conflict.getType()) {
                    case ENTITY_NAME_CONFLICT -> name = value.toString();
                    case ENTITY_TYPE_CONFLICT -> type = value.toString();
                    case PROPERTY_VALUE_CONFLICT -> properties.put(conflict.getPropertyKey(), PropertyValue.from(value));
                    default -> { }
                }
            }
            aliases.remove(name);
            collapsed.add(Entity.builder(first)
                    .name(name)
                    .type(type)
                    .properties(properties)
                    .aliases(aliases)
                    .build());
        });
        return collapsed;
    }

    static List<Relation> dropContradictionLosers(List<Relation> fused, List<Conflict> conflicts,
                                                  List<Relation> dropped) {
        Set<String> losers = new HashSet<>();
        for (Conflict conflict : conflicts) {
            if (conflict.getType() != ConflictType.CONTRADICTORY_RELATIONS
                    || !(conflict.getResolvedValue() instanceof Relation winner)) {
                continue;
            }
            for (Object item : conflict.getConflictingItems()) {
                Relation relation = (Relation) item;
                if (!relation.getId().equals(winner.getId())) {
                    losers.add(relation.getId());
                }
            }
        }
        List<Relation> kept = new ArrayList<>(fused.size());
        for (Relation relation : fused) {
            if (losers.contains(relation.getId())) {
                dropped.add(relation);
            } else {
                kept.add(relation);
            }
        }
        return kept;
    }
}
