package com.knowledge.fusion.bulk;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.graph.GraphStatistics;
import com.knowledge.fusion.graph.KnowledgeGraphStore;
import com.knowledge.fusion.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * {
 *   "entities": [{"id", "name", "type", "properties", "aliases"}],
 *   "relations": [{"id", "type", "head_entity_id", "tail_entity_id", "properties", "confidence"}],
 *   "statistics": {"entity_count", "relation_count", "entity_types", "relation_types",
 *                  "avg_degree", "connected_components", "density"}
 * }
 * </pre>
 */
public class JsonGraphExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonGraphExporter.class);

    private final ObjectMapper objectMapper;

    public JsonGraphExporter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public ExportResult export(KnowledgeGraphStore store, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            return export(store, writer);
        }
    }

    /**
     * Writes the store to the writer, which is flushed but left open.
     */
    public ExportResult export(KnowledgeGraphStore store, Writer writer) throws IOException {
        try (LogContext ctx = LogContext.forPersistence(LogContext.generateCorrelationId(), getFormat())) {
            ObjectNode root = objectMapper.createObjectNode();
            ArrayNode entities = root.putArray("entities");
            for (Entity entity : store.getEntities()) {
                ObjectNode node = entities.addObject();
                node.put("id", entity.getId());
                node.put("name", entity.getName());
                node.put("type", entity.getType());
                node.set("properties", PropertyJson.toNode(entity.getProperties()));
                ArrayNode aliases = node.putArray("aliases");
                entity.getAliases().forEach(aliases::add);
            }
            ArrayNode relations = root.putArray("relations");
            for (Relation relation : store.getRelations()) {
                ObjectNode node = relations.addObject();
                node.put("id", relation.getId());
                node.put("type", relation.getType());
                node.put("head_entity_id", relation.getHeadEntityId());
                node.put("tail_entity_id", relation.getTailEntityId());
                node.set("properties", PropertyJson.toNode(relation.getProperties()));
                node.put("confidence", relation.getConfidence());
            }
            root.set("statistics", statisticsNode(store.getStatistics()));

            objectMapper.writeValue(writer, root);
            writer.flush();
            ExportResult result = new ExportResult(entities.size(), relations.size(), getFormat());
            log.info("export.completed result={}", result);
            return result;
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private ObjectNode statisticsNode(GraphStatistics statistics) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("entity_count", statistics.entityCount());
        node.put("relation_count", statistics.relationCount());
        ObjectNode entityTypes = node.putObject("entity_types");
        statistics.entityTypes().forEach((type, count) -> entityTypes.put(type, count.intValue()));
        ObjectNode relationTypes = node.putObject("relation_types");
        statistics.relationTypes().forEach((type, count) -> relationTypes.put(type, count.intValue()));
        node.put("avg_degree", statistics.averageDegree());
        node.put("connected_components", statistics.weaklyConnectedComponents());
        node.put("density", statistics.density());
        return node;
    }
}
