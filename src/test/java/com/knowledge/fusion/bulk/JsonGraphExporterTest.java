package com.knowledge.fusion.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.graph.KnowledgeGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonGraphExporterTest {

    private KnowledgeGraphStore store;
    private final JsonGraphExporter exporter = new JsonGraphExporter();
    private final JsonGraphLoader loader = new JsonGraphLoader();

    @BeforeEach
    void setUp() {
        store = new KnowledgeGraphStore();
        store.addEntity(Entity.builder().id("e1").name("Tencent").type("Organization")
                .property("founded", 1998)
                .property("revenue_share", 0.35)
                .property("listed", true)
                .property("products", List.of("QQ", "WeChat"))
                .alias("腾讯")
                .alias("Tencent Holdings")
                .build());
        store.addEntity(Entity.builder().id("p1").name("Ma Huateng").type("Person").build());
        store.addRelation(Relation.builder().id("r1").type("founder_of").headEntityId("p1").tailEntityId("e1")
                .confidence(0.85)
                .property(Relation.CONTEXT_PROPERTY, "Ma Huateng founded Tencent in 1998")
                .build());
    }

    @Test
    @DisplayName("Export then load reproduces every entity and relation")
    void roundTrip() throws Exception {
        StringWriter out = new StringWriter();
        ExportResult exported = exporter.export(store, out);

        KnowledgeGraphStore restored = new KnowledgeGraphStore();
        LoadResult loaded = loader.load(new StringReader(out.toString()), restored);

        assertEquals(2, exported.totalEntities());
        assertEquals(1, exported.totalRelations());
        assertFalse(loaded.hasErrors());
        assertEquals(2, loaded.entitiesLoaded());
        assertEquals(1, loaded.relationsLoaded());
        for (Entity original : store.getEntities()) {
            assertTrue(original.sameContentAs(restored.getEntity(original.getId()).orElseThrow()),
                    "entity differs after round trip: " + original.getId());
        }
        assertTrue(store.getRelation("r1").orElseThrow().sameContentAs(restored.getRelation("r1").orElseThrow()));
        assertEquals(List.of(), restored.checkIndexConsistency());
    }

    @Test
    @DisplayName("Output carries the statistics block with integral numbers kept integral")
    void statisticsBlock() throws Exception {
        StringWriter out = new StringWriter();
        exporter.export(store, out);

        JsonNode root = new ObjectMapper().readTree(out.toString());
        JsonNode stats = root.get("statistics");
        assertEquals(2, stats.get("entity_count").asInt());
        assertEquals(1, stats.get("relation_count").asInt());
        assertEquals(1, stats.get("entity_types").get("Person").asInt());
        assertEquals(1, stats.get("connected_components").asInt());
        assertEquals(0.5, stats.get("density").asDouble(), 1e-9);
        assertTrue(root.get("entities").get(0).get("properties").get("founded").isIntegralNumber());
        assertEquals(0.85, root.get("relations").get(0).get("confidence").asDouble());
    }

    @Test
    @DisplayName("Round trip through a file")
    void fileRoundTrip(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("graph.json");

        exporter.export(store, file);
        KnowledgeGraphStore restored = new KnowledgeGraphStore();
        loader.load(file, restored);

        assertEquals(2, restored.entityCount());
        assertEquals("e1", restored.getEntityByName("腾讯").orElseThrow().getId());
    }

    @Test
    @DisplayName("Bad records are skipped and reported while the rest loads")
    void skipsBadRecords() throws Exception {
        String json = """
                {
                  "entities": [
                    {"id": "a", "name": "A", "type": "Person", "properties": {}, "aliases": []},
                    {"id": "b", "type": "Person"},
                    {"id": "c", "name": "C", "type": "Person", "properties": {"age": null}}
                  ],
                  "relations": [
                    {"id": "r1", "type": "friend_of", "head_entity_id": "a", "tail_entity_id": "zzz"},
                    {"id": "r2", "type": "friend_of", "head_entity_id": "a", "tail_entity_id": "a",
                     "confidence": "high"},
                    {"id": "r3", "type": "friend_of", "head_entity_id": "a", "tail_entity_id": "a"}
                  ]
                }
                """;
        KnowledgeGraphStore target = new KnowledgeGraphStore();
        target.addEntity(Entity.builder().id("old").name("Old").type("Person").build());

        LoadResult result = loader.load(new StringReader(json), target);

        assertEquals(1, result.entitiesLoaded());
        assertEquals(2, result.entitiesSkipped());
        assertEquals(1, result.relationsLoaded());
        assertEquals(2, result.relationsSkipped());
        assertEquals("r1", result.errors().get(2).recordId());
        assertTrue(target.getEntity("old").isEmpty());
        assertEquals(1.0, target.getRelation("r3").orElseThrow().getConfidence());
    }

    @Test
    @DisplayName("Non-finite numbers never reach the graph")
    void nonFiniteNumbers() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> Entity.builder().id("x").name("X").type("Person").property("score", Double.POSITIVE_INFINITY));

        String json = """
                {
                  "entities": [
                    {"id": "a", "name": "A", "type": "Person", "properties": {"score": 1e400}},
                    {"id": "b", "name": "B", "type": "Person", "properties": {"score": 12.5}}
                  ],
                  "relations": []
                }
                """;
        KnowledgeGraphStore target = new KnowledgeGraphStore();

        LoadResult result = loader.load(new StringReader(json), target);

        assertEquals(1, result.entitiesLoaded());
        assertEquals(1, result.entitiesSkipped());
        assertEquals("a", result.errors().get(0).recordId());
        assertTrue(target.getEntity("b").isPresent());
    }

    @Test
    @DisplayName("Input that is not a JSON object is refused")
    void notAnObject() {
        assertThrows(java.io.IOException.class,
                () -> loader.load(new StringReader("[1, 2, 3]"), new KnowledgeGraphStore()));
    }
}
