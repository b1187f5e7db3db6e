package com.knowledge.fusion.graph;

import com.knowledge.fusion.conflict.Conflict;
import com.knowledge.fusion.conflict.ConflictResolver;
import com.knowledge.fusion.conflict.ConflictType;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.fusion.EntityFusionEngine;
import com.knowledge.fusion.fusion.RelationFusionEngine;
import com.knowledge.fusion.metrics.FusionMetrics;
import com.knowledge.fusion.ontology.InMemoryOntology;
import com.knowledge.fusion.ontology.Ontology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("KnowledgeGraphStore Tests")
class KnowledgeGraphStoreTest {

    private KnowledgeGraphStore store;

    @BeforeEach
    void setUp() {
        store = new KnowledgeGraphStore();
    }

    private static Entity entity(String id, String name, String type) {
        return Entity.builder().id(id).name(name).type(type).build();
    }

    private static Relation relation(String id, String type, String head, String tail) {
        return Relation.builder().id(id).type(type).headEntityId(head).tailEntityId(tail).build();
    }

    @Nested
    @DisplayName("Mutation and referential integrity")
    class Mutation {

        @Test
        @DisplayName("A relation with a missing endpoint is refused and no index changes")
        void missingEndpointLeavesIndicesUntouched() {
            FusionMetrics metrics = mock(FusionMetrics.class);
            store = new KnowledgeGraphStore(InMemoryOntology.defaults(), new EntityFusionEngine(),
                    new RelationFusionEngine(), new ConflictResolver(), metrics);
            store.addEntity(entity("h", "Ma Huateng", "Person"));

            GraphValidationException e = assertThrows(GraphValidationException.class,
                    () -> store.addRelation(relation("r1", "founder_of", "h", "missing")));

            assertEquals("r1", e.getRelationId());
            assertEquals("missing", e.getMissingEntityId());
            assertEquals(0, store.relationCount());
            assertTrue(store.getRelationsByType("founder_of").isEmpty());
            assertTrue(store.getRelationsBetween("h", "missing").isEmpty());
            assertTrue(store.neighbors("h").isEmpty());
            assertEquals(List.of(), store.checkIndexConsistency());
            verify(metrics).incrementRelationRejected();
        }

        @Test
        @DisplayName("Batch ingestion reports refused relations and keeps going")
        void batchIngest() {
            store.batchAddEntities(List.of(entity("p", "Zhang San", "Person"), entity("o", "Tencent", "Organization")));

            IngestResult result = store.batchAddRelations(List.of(
                    relation("r1", "works_for", "p", "o"),
                    relation("r2", "works_for", "p", "ghost"),
                    relation("r3", "located_in", "o", "p")));

            assertEquals(2, result.accepted());
            assertEquals(1, result.rejectedCount());
            assertEquals("r2", result.rejected().get(0).relationId());
            assertTrue(result.hasRejections());
        }

        @Test
        @DisplayName("Removing an entity cascades to its relations")
        void removeEntityCascades() {
            store.batchAddEntities(List.of(entity("a", "A", "Person"), entity("b", "B", "Person"),
                    entity("c", "C", "Person")));
            store.batchAddRelations(List.of(relation("r1", "friend_of", "a", "b"),
                    relation("r2", "friend_of", "b", "c"), relation("r3", "friend_of", "c", "a")));

            assertTrue(store.removeEntity("b"));

            assertEquals(2, store.entityCount());
            assertEquals(List.of("r3"), store.getRelations().stream().map(Relation::getId).toList());
            assertEquals(Set.of("c"), store.neighbors("a"));
            assertEquals(List.of(), store.checkIndexConsistency());
            assertFalse(store.removeEntity("b"));
        }

        @Test
        @DisplayName("Replacing an entity re-indexes its type and names")
        void replaceEntity() {
            store.addEntity(Entity.builder().id("e1").name("Tencent").type("Organization").alias("腾讯").build());
            store.addEntity(entity("e1", "Tencent Holdings", "Company"));

            assertTrue(store.getEntityByName("腾讯").isEmpty());
            assertEquals("e1", store.getEntityByName("Tencent Holdings").orElseThrow().getId());
            assertTrue(store.getEntitiesByType("Organization").isEmpty());
            assertEquals(1, store.getEntitiesByType("Company").size());
            assertEquals(List.of(), store.checkIndexConsistency());
        }

        @Test
        @DisplayName("Name collisions resolve to the entity added last")
        void nameCollision() {
            store.addEntity(entity("e1", "Apple", "Organization"));
            store.addEntity(entity("e2", "Apple", "Product"));

            assertEquals("e2", store.getEntityByName("Apple").orElseThrow().getId());
            store.removeEntity("e1");
            assertEquals("e2", store.getEntityByName("Apple").orElseThrow().getId());
            assertEquals(List.of(), store.checkIndexConsistency());
        }

        @Test
        @DisplayName("Removing the winner of a name collision hands the name to the survivor")
        void nameCollisionWinnerRemoved() {
            store.addEntity(entity("e1", "Apple", "Organization"));
            store.addEntity(Entity.builder().id("e2").name("Apple").type("Product").alias("iPhone maker").build());
            store.addEntity(Entity.builder().id("e3").name("Apple Inc").type("Organization")
                    .alias("iPhone maker").build());

            store.removeEntity("e2");
            assertEquals("e1", store.getEntityByName("Apple").orElseThrow().getId());
            assertEquals("e3", store.getEntityByName("iPhone maker").orElseThrow().getId());
            assertEquals(List.of(), store.checkIndexConsistency());

            store.removeEntity("e3");
            assertTrue(store.getEntityByName("iPhone maker").isEmpty());
            assertEquals(List.of(), store.checkIndexConsistency());
        }

        @Test
        @DisplayName("Removing a relation updates every index")
        void removeRelation() {
            store.batchAddEntities(List.of(entity("a", "A", "Person"), entity("b", "B", "Person")));
            store.addRelation(relation("r1", "friend_of", "a", "b"));

            assertTrue(store.removeRelation("r1"));
            assertFalse(store.removeRelation("r1"));
            assertTrue(store.getRelationsByType("friend_of").isEmpty());
            assertTrue(store.getRelationsBetween("a", "b").isEmpty());
            assertEquals(List.of(), store.checkIndexConsistency());
        }
    }

    @Nested
    @DisplayName("Structural queries")
    class Queries {

        @BeforeEach
        void square() {
            store.batchAddEntities(List.of(entity("a", "A", "Person"), entity("b", "B", "Person"),
                    entity("c", "C", "Person"), entity("d", "D", "Person")));
            store.batchAddRelations(List.of(
                    relation("r1", "friend_of", "a", "b"),
                    relation("r2", "friend_of", "b", "c"),
                    relation("r3", "friend_of", "c", "d"),
                    relation("r4", "parent_of", "d", "a")));
        }

        @Test
        @DisplayName("Paths ignore direction and respect the depth limit")
        void findPath() {
            assertEquals(List.of(List.of("a", "b", "c", "d"), List.of("a", "d")), store.findPath("a", "d", 3));
            assertEquals(List.of(List.of("a", "d")), store.findPath("a", "d", 1));
        }

        @Test
        @DisplayName("Degenerate path queries return no paths")
        void findPathEdgeCases() {
            assertTrue(store.findPath("a", "a", 3).isEmpty());
            assertTrue(store.findPath("a", "zzz", 3).isEmpty());
            assertTrue(store.findPath("a", "c", 0).isEmpty());
        }

        @Test
        @DisplayName("Neighbours can be filtered by relation type")
        void neighbors() {
            assertEquals(Set.of("b", "d"), store.neighbors("a"));
            assertEquals(Set.of("d"), store.neighbors("a", "parent_of"));
            assertTrue(store.neighbors("unknown").isEmpty());
        }

        @Test
        @DisplayName("Subgraph keeps reached entities and relations between them")
        void subgraph() {
            KnowledgeGraphStore sub = store.querySubgraph(List.of("a"), 1);

            assertEquals(3, sub.entityCount());
            assertEquals(Set.of("r1", "r4"), Set.copyOf(sub.getRelations().stream().map(Relation::getId).toList()));
            assertEquals(4, store.entityCount());
            assertEquals(1, store.querySubgraph(List.of("a"), 0).entityCount());
        }

        @Test
        @DisplayName("Statistics describe size, degree, density and components")
        void statistics() {
            store.addEntity(entity("e", "E", "Organization"));

            GraphStatistics stats = store.getStatistics();

            assertEquals(5, stats.entityCount());
            assertEquals(4, stats.relationCount());
            assertEquals(1.6, stats.averageDegree(), 1e-9);
            assertEquals(4.0 / 20.0, stats.density(), 1e-9);
            assertEquals(2, stats.weaklyConnectedComponents());
            assertEquals(Integer.valueOf(3), stats.relationTypes().get("friend_of"));
            assertEquals(Integer.valueOf(4), stats.entityTypes().get("Person"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Ontology mismatches are reported, not thrown")
        void ontologyMismatch() {
            Ontology ontology = mock(Ontology.class);
            when(ontology.validateRelation(anyString(), anyString(), anyString())).thenReturn(true);
            when(ontology.validateRelation(eq("knows"), anyString(), anyString())).thenReturn(false);
            store = new KnowledgeGraphStore(ontology);
            store.batchAddEntities(List.of(entity("a", "A", "Person"), entity("b", "B", "Person")));
            store.batchAddRelations(List.of(relation("r1", "knows", "a", "b"), relation("r2", "friend_of", "a", "b")));

            ValidationReport report = store.validate();

            assertFalse(report.isValid());
            assertEquals(1, report.issues().size());
            ValidationIssue issue = report.issuesOfKind(ValidationIssue.Kind.ONTOLOGY_MISMATCH).get(0);
            assertEquals("r1", issue.relationId());
            assertEquals(2, report.statistics().entityCount());
        }

        @Test
        @DisplayName("A graph matching the default ontology is valid")
        void valid() {
            store.batchAddEntities(List.of(entity("p", "Zhang San", "Person"), entity("o", "Tencent", "Organization")));
            store.addRelation(relation("r1", "works_for", "p", "o"));

            assertTrue(store.validate().isValid());
        }
    }

    @Nested
    @DisplayName("Merging and conflicts")
    class Merging {

        @Test
        @DisplayName("Same-named entities from two stores merge and relations follow the fused id")
        void mergeStores() {
            FusionMetrics metrics = mock(FusionMetrics.class);
            KnowledgeGraphStore first = new KnowledgeGraphStore(InMemoryOntology.defaults(),
                    new EntityFusionEngine(), new RelationFusionEngine(), new ConflictResolver(), metrics);
            first.batchAddEntities(List.of(entity("a1", "Apple Inc", "Organization"),
                    entity("p1", "Steve Jobs", "Person")));
            first.addRelation(relation("r1", "founder_of", "p1", "a1"));

            KnowledgeGraphStore second = new KnowledgeGraphStore();
            second.batchAddEntities(List.of(entity("b1", "Apple Inc", "Organization"),
                    entity("p2", "Tim Cook", "Person")));
            second.addRelation(relation("r2", "works_for", "p2", "b1"));

            MergeReport report = first.mergeKnowledgeGraph(second);

            List<Entity> apples = first.getEntities().stream().filter(e -> e.getName().equals("Apple Inc")).toList();
            assertEquals(1, apples.size());
            String fusedId = apples.get(0).getId();
            assertEquals(3, first.entityCount());
            assertEquals(2, first.relationCount());
            for (Relation relation : first.getRelations()) {
                assertEquals(fusedId, relation.getTailEntityId());
            }
            assertEquals(fusedId, report.entityIdRemap().get("a1"));
            assertEquals(fusedId, report.entityIdRemap().get("b1"));
            assertEquals(1, report.fusedEntities());
            assertEquals(0, report.droppedRelations());
            assertEquals(2, second.entityCount());
            assertEquals(List.of(), first.checkIndexConsistency());
            verify(metrics).recordGraphMerge(eq(3), eq(2), any(Duration.class));
        }

        @Test
        @DisplayName("Conflicts over the store content are detected and resolved without mutating it")
        void detectAndResolve() {
            store.batchAddEntities(List.of(entity("p1", "Li Lei", "Person"), entity("p2", "Li Ming", "Person")));
            store.batchAddRelations(List.of(
                    Relation.builder().id("r1").type("parent_of").headEntityId("p1").tailEntityId("p2")
                            .confidence(0.9).build(),
                    Relation.builder().id("r2").type("child_of").headEntityId("p1").tailEntityId("p2")
                            .confidence(0.4).build()));

            List<Conflict> conflicts = store.detectAndResolveConflicts();

            assertEquals(1, conflicts.size());
            assertEquals(ConflictType.CONTRADICTORY_RELATIONS, conflicts.get(0).getType());
            assertEquals("r1", ((Relation) conflicts.get(0).getResolvedValue()).getId());
            assertEquals(2, store.relationCount());
        }
    }

    @Test
    @DisplayName("Clear empties every index")
    void clear() {
        store.batchAddEntities(List.of(entity("a", "A", "Person"), entity("b", "B", "Person")));
        store.addRelation(relation("r1", "friend_of", "a", "b"));

        store.clear();

        assertEquals(0, store.entityCount());
        assertEquals(0, store.relationCount());
        assertTrue(store.getEntityByName("A").isEmpty());
        assertEquals(List.of(), store.checkIndexConsistency());
    }
}
