package com.knowledge.fusion.api;

import com.knowledge.fusion.conflict.Conflict;
import com.knowledge.fusion.conflict.ConflictStatistics;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.fusion.FusionResult;
import com.knowledge.fusion.fusion.FusionStatistics;
import com.knowledge.fusion.graph.IngestResult;

import java.util.List;

/**
 * Everything one pipeline run produced, phase by phase.
 *
 * @param droppedRelations    relations removed because they lost a contradictory-relation conflict
 * @param unresolvedRelations extracted relations dropped before fusion because an endpoint
 *                            matched no entity mention
 */
public record PipelineResult(
        List<FusionResult<Entity>> entityResults,
        List<FusionResult<Relation>> relationResults,
        List<Conflict> conflicts,
        List<Relation> droppedRelations,
        int unresolvedRelations,
        int entitiesIngested,
        IngestResult relationIngest,
        FusionStatistics entityStatistics,
        FusionStatistics relationStatistics,
        ConflictStatistics conflictStatistics
) {
    public PipelineResult {
        entityResults = List.copyOf(entityResults);
        relationResults = List.copyOf(relationResults);
        conflicts = List.copyOf(conflicts);
        droppedRelations = List.copyOf(droppedRelations);
    }
}
