package com.knowledge.fusion.fusion;

import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RelationFusionEngine Tests")
class RelationFusionEngineTest {

    private final RelationFusionEngine engine = new RelationFusionEngine();

    private static Relation relation(String id, String type, String head, String tail, double confidence) {
        return Relation.builder().id(id).type(type).headEntityId(head).tailEntityId(tail)
                .confidence(confidence).build();
    }

    @Nested
    @DisplayName("Duplicate detection")
    class DuplicateDetection {

        @Test
        @DisplayName("Same triple is an exact match")
        void exactMatch() {
            Relation a = relation("r1", "founder_of", "h", "t", 0.9);
            Relation b = relation("r2", "founder_of", "h", "t", 0.5);

            assertEquals(1.0, engine.matchScore(a, b));
            assertTrue(engine.isDuplicate(a, b));
        }

        @Test
        @DisplayName("Swapped endpoints of the same type still count as duplicates")
        void swappedEndpoints() {
            Relation a = relation("r1", "friend_of", "p1", "p2", 0.9);
            Relation b = relation("r2", "friend_of", "p2", "p1", 0.9);

            assertEquals((0.6 + 0.8 * 0.8) / 1.4, engine.matchScore(a, b), 1e-9);
            assertTrue(engine.isDuplicate(a, b));
        }

        @Test
        @DisplayName("Different types on the same pair are not duplicates")
        void differentTypes() {
            Relation a = relation("r1", "works_for", "p1", "o1", 0.9);
            Relation b = relation("r2", "founder_of", "p1", "o1", 0.9);

            assertEquals(0.8 / 1.4, engine.matchScore(a, b), 1e-9);
            assertFalse(engine.isDuplicate(a, b));
        }

        @Test
        @DisplayName("Context joins the score only when both sides have one")
        void contextWeight() {
            Relation a = Relation.builder().type("works_for").headEntityId("p1").tailEntityId("o1")
                    .property(Relation.CONTEXT_PROPERTY, "Zhang works at Tencent in Shenzhen").build();
            Relation b = Relation.builder().type("works_for").headEntityId("o1").tailEntityId("p1")
                    .property(Relation.CONTEXT_PROPERTY, "weather report").build();

            assertEquals((0.6 + 0.64) / 1.8, engine.matchScore(a, b), 1e-9);
        }
    }

    @Nested
    @DisplayName("Cluster fusion")
    class ClusterFusion {

        @Test
        @DisplayName("Two reports of one edge fuse with the source-count boost")
        void weightedAverageBoost() {
            List<FusionResult<Relation>> results = engine.batchFuse(List.of(
                    relation("r1", "founder_of", "h", "t", 0.90),
                    relation("r2", "founder_of", "h", "t", 0.95)));

            assertEquals(1, results.size());
            FusionResult<Relation> fused = results.get(0);
            assertEquals(0.925 * 1.08, fused.confidence(), 1e-9);
            assertEquals(fused.confidence(), fused.fusedItem().getConfidence(), 1e-12);
            assertEquals("r2", fused.fusedItem().getId());
            assertEquals("multi_relation_fusion", fused.evidence().get(FusionResult.METHOD));
        }

        @Test
        @DisplayName("Boost is capped at 1.0")
        void capped() {
            assertEquals(1.0, RelationFusionEngine.fuseConfidence(List.of(1.0, 1.0, 1.0, 1.0, 1.0),
                    ConfidenceFusionStrategy.WEIGHTED_AVERAGE));
            assertEquals(0.9, RelationFusionEngine.fuseConfidence(List.of(0.5, 0.9),
                    ConfidenceFusionStrategy.MAX));
            assertEquals(0.7, RelationFusionEngine.fuseConfidence(List.of(0.5, 0.9),
                    ConfidenceFusionStrategy.AVERAGE), 1e-9);
        }

        @Test
        @DisplayName("Singleton relation is returned unchanged")
        void singleton() {
            Relation only = relation("r1", "works_for", "p1", "o1", 0.7);

            List<RelationCluster> clusters = engine.cluster(List.of(only));
            FusionResult<Relation> result = engine.fuseCluster(clusters.get(0));

            assertEquals(0.7, clusters.get(0).confidence());
            assertEquals(1.0, result.confidence());
            assertTrue(result.fusedItem().sameContentAs(only));
        }

        @Test
        @DisplayName("Properties come only from members that have some")
        void propertiesFromNonEmptyMembers() {
            Relation withProps = Relation.builder().id("r1").type("works_for").headEntityId("p").tailEntityId("o")
                    .property("since", "2019").property("tags", List.of("a", "b")).build();
            Relation withOtherProps = Relation.builder().id("r2").type("works_for").headEntityId("p")
                    .tailEntityId("o").property("tags", List.of("b", "c")).build();
            Relation bare = relation("r3", "works_for", "p", "o", 1.0);

            FusionResult<Relation> fused = engine.batchFuse(List.of(withProps, withOtherProps, bare)).get(0);

            assertEquals(3, fused.sourceCount());
            assertEquals(PropertyValue.of("2019"), fused.fusedItem().getProperties().get("since"));
            assertEquals(PropertyValue.ofStrings("a", "b", "c"), fused.fusedItem().getProperties().get("tags"));
        }
    }

    @Test
    @DisplayName("Redundant relations keep the most confident one per pair and type")
    void removeRedundant() {
        Relation low = relation("r1", "works_for", "p", "o", 0.6);
        Relation high = relation("r2", "works_for", "p", "o", 0.9);
        Relation other = relation("r3", "founder_of", "p", "o", 0.5);
        Relation reversed = relation("r4", "works_for", "o", "p", 0.5);

        List<Relation> kept = engine.removeRedundantRelations(List.of(low, high, other, reversed));

        assertEquals(List.of(high, other, reversed), kept);
    }
}
