package com.knowledge.fusion.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.PropertyValue;
import com.knowledge.fusion.core.model.Relation;
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
import java.util.Map;

/**
 * CSV exporter writing two files into a directory.
 *
 * <p>Output format:</p>
 * <pre>
 * entities.csv
 * id,name,type,aliases,properties
 * e1,Tencent,Organization,"Tencent Holdings,腾讯","{""founded"":1998}"
 *
 * relations.csv
 * id,type,head_entity_id,tail_entity_id,confidence,properties
 * r1,founder_of,p1,e1,0.95,{}
 * </pre>
 * Aliases are comma-joined; properties are a JSON object in one cell.
 */
public class CsvGraphExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvGraphExporter.class);

    public static final String ENTITIES_FILE = "entities.csv";
    public static final String RELATIONS_FILE = "relations.csv";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param target directory receiving {@value #ENTITIES_FILE} and {@value #RELATIONS_FILE};
     *               created if absent
     */
    @Override
    public ExportResult export(KnowledgeGraphStore store, Path target) throws IOException {
        Files.createDirectories(target);
        try (BufferedWriter entities = Files.newBufferedWriter(target.resolve(ENTITIES_FILE), StandardCharsets.UTF_8);
             BufferedWriter relations = Files.newBufferedWriter(target.resolve(RELATIONS_FILE), StandardCharsets.UTF_8)) {
            return export(store, entities, relations);
        }
    }

    public ExportResult export(KnowledgeGraphStore store, Writer entityWriter, Writer relationWriter)
            throws IOException {
        try (LogContext ctx = LogContext.forPersistence(LogContext.generateCorrelationId(), getFormat())) {
            long totalEntities = 0;
            entityWriter.write("id,name,type,aliases,properties\n");
            for (Entity entity : store.getEntities()) {
                entityWriter.write(String.join(",",
                        csvEscape(entity.getId()),
                        csvEscape(entity.getName()),
                        csvEscape(entity.getType()),
                        csvEscape(String.join(",", entity.getAliases())),
                        csvEscape(propertiesJson(entity.getProperties()))));
                entityWriter.write('\n');
                totalEntities++;
            }
            entityWriter.flush();

            long totalRelations = 0;
            relationWriter.write("id,type,head_entity_id,tail_entity_id,confidence,properties\n");
            for (Relation relation : store.getRelations()) {
                relationWriter.write(String.join(",",
                        csvEscape(relation.getId()),
                        csvEscape(relation.getType()),
                        csvEscape(relation.getHeadEntityId()),
                        csvEscape(relation.getTailEntityId()),
                        Double.toString(relation.getConfidence()),
                        csvEscape(propertiesJson(relation.getProperties()))));
                relationWriter.write('\n');
                totalRelations++;
            }
            relationWriter.flush();

            ExportResult result = new ExportResult(totalEntities, totalRelations, getFormat());
            log.info("export.completed result={}", result);
            return result;
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private String propertiesJson(Map<String, PropertyValue> properties) throws JsonProcessingException {
        return objectMapper.writeValueAsString(PropertyJson.toNode(properties));
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
