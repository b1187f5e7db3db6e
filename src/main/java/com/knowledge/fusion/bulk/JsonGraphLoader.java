package com.knowledge.fusion.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.Relation;
import com.knowledge.fusion.graph.GraphValidationException;
import com.knowledge.fusion.graph.KnowledgeGraphStore;
import com.knowledge.fusion.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a store from the format written by {@link JsonGraphExporter}.
 *
 * <p>The target store is cleared first. Entities are loaded before relations. A
 * record that is malformed, or a relation whose endpoint is absent, is skipped and
 * reported in the {@link LoadResult}; the rest of the file still loads. The
 * {@code statistics} block is ignored.</p>
 */
public class JsonGraphLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonGraphLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public LoadResult load(Path source, KnowledgeGraphStore store) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            return load(reader, store);
        }
    }

    /**
     * @throws IOException if the input is not a JSON object at all
     */
    public LoadResult load(Reader reader, KnowledgeGraphStore store) throws IOException {
        try (LogContext ctx = LogContext.forPersistence(LogContext.generateCorrelationId(), "json")) {
            JsonNode root = objectMapper.readTree(reader);
            if (root == null || !root.isObject()) {
                throw new IOException("Expected a JSON object with 'entities' and 'relations'");
            }
            store.clear();
            List<LoadResult.LoadError> errors = new ArrayList<>();

            long entitiesLoaded = 0;
            long entitiesSkipped = 0;
            int index = 0;
            for (JsonNode node : root.path("entities")) {
                try {
                    store.addEntity(toEntity(node));
                    entitiesLoaded++;
                } catch (RuntimeException e) {
                    entitiesSkipped++;
                    errors.add(new LoadResult.LoadError("entities", index, node.path("id").asText(null),
                            e.getMessage()));
                    log.warn("load.entity.skipped index={} error={}", index, e.getMessage());
                }
                index++;
            }

            long relationsLoaded = 0;
            long relationsSkipped = 0;
            index = 0;
            for (JsonNode node : root.path("relations")) {
                try {
                    store.addRelation(toRelation(node));
                    relationsLoaded++;
                } catch (GraphValidationException e) {
                    relationsSkipped++;
                    errors.add(new LoadResult.LoadError("relations", index, e.getRelationId(), e.getMessage()));
                    log.warn("load.relation.skipped index={} relationId={} missingEntityId={}",
                            index, e.getRelationId(), e.getMissingEntityId());
                } catch (RuntimeException e) {
                    relationsSkipped++;
                    errors.add(new LoadResult.LoadError("relations", index, node.path("id").asText(null),
                            e.getMessage()));
                    log.warn("load.relation.skipped index={} error={}", index, e.getMessage());
                }
                index++;
            }

            LoadResult result = new LoadResult(entitiesLoaded, relationsLoaded, entitiesSkipped,
                    relationsSkipped, errors);
            log.info("load.completed result={}", result);
            return result;
        }
    }

    private static Entity toEntity(JsonNode node) {
        Entity.Builder builder = Entity.builder()
                .id(requiredText(node, "id"))
                .name(requiredText(node, "name"))
                .type(requiredText(node, "type"))
                .properties(PropertyJson.fromNode(node.get("properties")));
        for (JsonNode alias : node.path("aliases")) {
            builder.alias(alias.asText());
        }
        return builder.build();
    }

    private static Relation toRelation(JsonNode node) {
        JsonNode confidence = node.get("confidence");
        if (confidence != null && !confidence.isNull() && !confidence.isNumber()) {
            throw new IllegalArgumentException("confidence must be a number");
        }
        return Relation.builder()
                .id(requiredText(node, "id"))
                .type(requiredText(node, "type"))
                .headEntityId(requiredText(node, "head_entity_id"))
                .tailEntityId(requiredText(node, "tail_entity_id"))
                .properties(PropertyJson.fromNode(node.get("properties")))
                .confidence(confidence != null && confidence.isNumber() ? confidence.doubleValue() : 1.0)
                .build();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing or non-text field '" + field + "'");
        }
        return value.textValue();
    }
}
