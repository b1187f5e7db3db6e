package com.knowledge.fusion.conflict;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.metrics.FusionMetrics;
import com.knowledge.fusion.review.InMemoryReviewQueue;
import com.knowledge.fusion.review.ReviewItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ConflictResolver Tests")
class ConflictResolverTest {

    private InMemoryReviewQueue reviewQueue;
    private FusionMetrics metrics;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        reviewQueue = new InMemoryReviewQueue();
        metrics = mock(FusionMetrics.class);
        resolver = new ConflictResolver(reviewQueue, metrics);
    }

    private static Relation relation(String id, String type, String head, String tail, double confidence) {
        return Relation.builder().id(id).type(type).headEntityId(head).tailEntityId(tail)
                .confidence(confidence).build();
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("Two names under one id give exactly one name conflict")
        void nameConflict() {
            List<Conflict> conflicts = resolver.detectEntityConflicts(List.of(
                    Entity.builder().id("e1").name("Tencent").type("Organization").build(),
                    Entity.builder().id("e1").name("腾讯公司").type("Organization").build()));

            assertEquals(1, conflicts.size());
            Conflict conflict = conflicts.get(0);
            assertEquals(ConflictType.ENTITY_NAME_CONFLICT, conflict.getType());
            assertEquals(List.of("Tencent", "腾讯公司"), conflict.getConflictingItems());
            assertEquals("e1", conflict.getSubjectId());
            assertFalse(conflict.isResolved());
            verify(metrics).incrementConflictDetected(ConflictType.ENTITY_NAME_CONFLICT);
        }

        @Test
        @DisplayName("Type and property disagreements are reported separately")
        void typeAndPropertyConflicts() {
            List<Conflict> conflicts = resolver.detectEntityConflicts(List.of(
                    Entity.builder().id("e1").name("Tencent").type("Org").property("employees", 100).build(),
                    Entity.builder().id("e1").name("Tencent").type("Organization").property("employees", 200)
                            .build(),
                    Entity.builder().id("e2").name("Alibaba").type("Organization").build()));

            assertEquals(2, conflicts.size());
            assertEquals(ConflictType.ENTITY_TYPE_CONFLICT, conflicts.get(0).getType());
            Conflict property = conflicts.get(1);
            assertEquals(ConflictType.PROPERTY_VALUE_CONFLICT, property.getType());
            assertEquals("employees", property.getPropertyKey());
        }

        @Test
        @DisplayName("Equal values under one id are not conflicts")
        void noConflict() {
            Entity e = Entity.builder().id("e1").name("Tencent").type("Organization").property("hq", "Shenzhen")
                    .build();

            assertTrue(resolver.detectEntityConflicts(List.of(e, Entity.builder(e).build())).isEmpty());
        }

        @Test
        @DisplayName("Contradictory types on one pair carry the relations themselves")
        void contradictoryRelations() {
            Relation parent = relation("r1", "parent_of", "p1", "p2", 0.9);
            Relation child = relation("r2", "child_of", "p1", "p2", 0.6);

            List<Conflict> conflicts = resolver.detectRelationConflicts(List.of(parent, child));

            assertEquals(1, conflicts.size());
            assertEquals(ConflictType.CONTRADICTORY_RELATIONS, conflicts.get(0).getType());
            assertEquals(List.of(parent, child), conflicts.get(0).getConflictingItems());
            assertEquals("p1->p2", conflicts.get(0).getSubjectId());
        }

        @Test
        @DisplayName("Compatible types on one pair give a relation type conflict")
        void relationTypeConflict() {
            List<Conflict> conflicts = resolver.detectRelationConflicts(List.of(
                    relation("r1", "works_for", "p1", "o1", 0.9),
                    relation("r2", "founder_of", "p1", "o1", 0.8),
                    relation("r3", "works_for", "p2", "o1", 0.8),
                    relation("r4", "works_for", "p2", "o1", 0.7)));

            assertEquals(1, conflicts.size());
            assertEquals(ConflictType.RELATION_TYPE_CONFLICT, conflicts.get(0).getType());
            assertEquals(List.of("works_for", "founder_of"), conflicts.get(0).getConflictingItems());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Default strategy for names is highest confidence, earliest on ties")
        void highestConfidence() {
            Conflict conflict = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("Tencent", "腾讯公司", "Tencent Holdings"), List.of(0.8, 0.9, 0.9));

            resolver.resolveConflict(conflict);

            assertTrue(conflict.isResolved());
            assertEquals("腾讯公司", conflict.getResolvedValue());
            assertEquals(0.9, conflict.getResolutionConfidence());
            assertEquals(ResolutionStrategy.HIGHEST_CONFIDENCE, conflict.getStrategy());
            assertFalse(conflict.isFallback());
        }

        @Test
        @DisplayName("Most specific type picks the longest type name")
        void mostSpecificType() {
            Conflict conflict = new Conflict("c1", ConflictType.ENTITY_TYPE_CONFLICT, "types", "e1", null,
                    List.of("Org", "Organization"), List.of(1.0, 1.0));

            resolver.resolveConflict(conflict);

            assertEquals("Organization", conflict.getResolvedValue());
            assertEquals(0.8, conflict.getResolutionConfidence());
        }

        @Test
        @DisplayName("Numeric average and list union for property conflicts")
        void propertyStrategies() {
            Conflict numeric = new Conflict("c1", ConflictType.PROPERTY_VALUE_CONFLICT, "employees", "e1",
                    "employees", List.of(PropertyValue.of(100.0), PropertyValue.of("200")), List.of(1.0, 1.0));
            Conflict lists = new Conflict("c2", ConflictType.PROPERTY_VALUE_CONFLICT, "products", "e1",
                    "products", List.of(PropertyValue.ofStrings("QQ"), PropertyValue.ofStrings("QQ", "WeChat")),
                    List.of(1.0, 1.0));

            resolver.resolveConflict(numeric, ResolutionStrategy.AVERAGE_NUMERIC);
            resolver.resolveConflict(lists, ResolutionStrategy.UNION_LISTS);

            assertEquals(PropertyValue.of(150.0), numeric.getResolvedValue());
            assertEquals(0.8, numeric.getResolutionConfidence());
            assertEquals(PropertyValue.ofStrings("QQ", "WeChat"), lists.getResolvedValue());
            assertEquals(0.9, lists.getResolutionConfidence());
        }

        @Test
        @DisplayName("Vote returns the majority with its share as confidence")
        void vote() {
            Conflict conflict = new Conflict("c1", ConflictType.RELATION_TYPE_CONFLICT, "types", "a->b", null,
                    List.of("works_for", "founder_of", "works_for"), List.of(0.5, 0.9, 0.5));

            resolver.resolveConflict(conflict, ResolutionStrategy.MOST_FREQUENT);

            assertEquals("works_for", conflict.getResolvedValue());
            assertEquals(2.0 / 3.0, conflict.getResolutionConfidence(), 1e-9);
        }

        @Test
        @DisplayName("A strategy outside the kind's table picks the first item at 0.5")
        void notApplicable() {
            Conflict conflict = new Conflict("c1", ConflictType.PROPERTY_VALUE_CONFLICT, "hq", "e1", "hq",
                    List.of(PropertyValue.of("Shenzhen"), PropertyValue.of("Beijing, China")), List.of(1.0, 1.0));

            resolver.resolveConflict(conflict, ResolutionStrategy.LONGEST_NAME);

            assertEquals(PropertyValue.of("Shenzhen"), conflict.getResolvedValue());
            assertEquals(0.5, conflict.getResolutionConfidence());
            assertFalse(conflict.isFallback());
        }

        @Test
        @DisplayName("A mismatched confidence list falls back to the first item at 0.1")
        void fallback() {
            Conflict conflict = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("Tencent", "腾讯公司"), List.of(0.9));

            resolver.resolveConflict(conflict);

            assertTrue(conflict.isFallback());
            assertEquals("Tencent", conflict.getResolvedValue());
            assertEquals(0.1, conflict.getResolutionConfidence());
            assertEquals(List.of(conflict), resolver.getHistory().getAll());
            verify(metrics).incrementConflictFallback(ConflictType.ENTITY_NAME_CONFLICT);
        }

        @Test
        @DisplayName("Manual review submits a review item and resolves provisionally")
        void manualReview() {
            Conflict conflict = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("Tencent", "腾讯公司"), List.of(0.9, 0.8));

            resolver.resolveConflict(conflict, ResolutionStrategy.MANUAL_REVIEW);

            assertEquals(0.0, conflict.getResolutionConfidence());
            assertEquals("Tencent", conflict.getResolvedValue());
            List<ReviewItem> pending = reviewQueue.getPending();
            assertEquals(1, pending.size());
            assertEquals("c1", pending.get(0).getConflictId());
            assertEquals(List.of("Tencent", "腾讯公司"), pending.get(0).getCandidateValues());
        }

        @Test
        @DisplayName("Resolving twice is rejected")
        void resolveTwice() {
            Conflict conflict = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("a", "b"), List.of(0.5, 0.6));
            resolver.resolveConflict(conflict);

            assertThrows(IllegalStateException.class, () -> resolver.resolveConflict(conflict));
            assertEquals(1, resolver.getHistory().size());
        }

        @Test
        @DisplayName("Batch passes over already resolved conflicts and resolves the rest")
        void batchSkipsResolved() {
            Conflict first = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("a", "b"), List.of(0.5, 0.6));
            Conflict second = new Conflict("c2", ConflictType.ENTITY_NAME_CONFLICT, "names", "e2", null,
                    List.of("x", "y"), List.of(0.9, 0.1));
            resolver.resolveConflict(first);

            List<Conflict> resolved = resolver.batchResolve(List.of(first, second));

            assertEquals(List.of(first, second), resolved);
            assertTrue(second.isResolved());
            assertEquals("x", second.getResolvedValue());
            assertEquals("b", first.getResolvedValue());
            assertEquals(2, resolver.getHistory().size());
        }

        @Test
        @DisplayName("Contradictory relations resolve to the most confident relation")
        void contradictory() {
            Relation parent = relation("r1", "parent_of", "p1", "p2", 0.9);
            Relation child = relation("r2", "child_of", "p1", "p2", 0.6);
            Conflict conflict = resolver.detectRelationConflicts(List.of(parent, child)).get(0);

            resolver.resolveConflict(conflict);

            assertSame(parent, conflict.getResolvedValue());
        }
    }

    @Nested
    @DisplayName("Batches and reporting")
    class Batches {

        @Test
        @DisplayName("Batch resolution honours overrides and never stops on a failure")
        void batchWithOverrides() {
            Conflict broken = new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "names", "e1", null,
                    List.of("a", "b"), List.of());
            Conflict types = new Conflict("c2", ConflictType.ENTITY_TYPE_CONFLICT, "types", "e2", null,
                    List.of("Org", "Organization", "Org"), List.of(1.0, 1.0, 1.0));

            List<Conflict> resolved = resolver.batchResolve(List.of(broken, types),
                    Map.of(ConflictType.ENTITY_TYPE_CONFLICT, ResolutionStrategy.VOTE));

            assertEquals(2, resolved.size());
            assertTrue(resolved.get(0).isFallback());
            assertEquals("Org", resolved.get(1).getResolvedValue());
            assertEquals(ResolutionStrategy.VOTE, resolved.get(1).getStrategy());

            ConflictStatistics stats = resolver.statistics(resolved);
            assertEquals(2, stats.totalConflicts());
            assertEquals(2, stats.resolvedConflicts());
            assertEquals(1, stats.fallbackResolutions());
            assertEquals(Integer.valueOf(1), stats.byType().get(ConflictType.ENTITY_TYPE_CONFLICT));
            assertTrue(stats.toReport().contains("entity_name_conflict: 1"));
        }

        @Test
        @DisplayName("History can be filtered by type and subject")
        void historyQueries() {
            resolver.batchResolve(List.of(
                    new Conflict("c1", ConflictType.ENTITY_NAME_CONFLICT, "n", "e1", null, List.of("a", "b"),
                            List.of(1.0, 1.0)),
                    new Conflict("c2", ConflictType.ENTITY_TYPE_CONFLICT, "t", "e1", null, List.of("x", "y"),
                            List.of(1.0, 1.0)),
                    new Conflict("c3", ConflictType.ENTITY_NAME_CONFLICT, "n", "e2", null, List.of("c", "d"),
                            List.of(1.0, 1.0))));

            ConflictHistory history = resolver.getHistory();
            assertEquals(3, history.size());
            assertEquals(2, history.getByType(ConflictType.ENTITY_NAME_CONFLICT).size());
            assertEquals(2, history.getBySubject("e1").size());
            assertThrows(UnsupportedOperationException.class, () -> history.getAll().clear());
        }

        @Test
        @DisplayName("Strategy table exposes defaults per kind")
        void strategyTable() {
            assertEquals(ResolutionStrategy.MOST_SPECIFIC_TYPE,
                    ConflictResolver.defaultStrategy(ConflictType.ENTITY_TYPE_CONFLICT));
            assertTrue(ConflictResolver.availableStrategies(ConflictType.PROPERTY_VALUE_CONFLICT)
                    .contains(ResolutionStrategy.AVERAGE_NUMERIC));
            for (ConflictType type : ConflictType.values()) {
                assertTrue(ConflictResolver.availableStrategies(type).contains(ResolutionStrategy.MANUAL_REVIEW));
            }
        }
    }
}
