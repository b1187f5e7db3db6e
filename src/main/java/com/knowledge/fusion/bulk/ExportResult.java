package com.knowledge.fusion.bulk;

/**
 * Result of exporting a store.
 *
 * @param totalEntities  number of entities written
 * @param totalRelations number of relations written
 * @param format         "json" or "csv"
 */
public record ExportResult(long totalEntities, long totalRelations, String format) {
    @Override
    public String toString() {
        return "ExportResult{format=" + format +
                ", entities=" + totalEntities +
                ", relations=" + totalRelations + '}';
    }
}
