package com.knowledge.fusion.bulk;

import com.knowledge.fusion.graph.KnowledgeGraphStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the content of a store in one format.
 */
public interface GraphExporter {

    /**
     * Exports the store to the given location: a file for single-file formats,
     * a directory for formats that produce several files.
     */
    ExportResult export(KnowledgeGraphStore store, Path target) throws IOException;

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
