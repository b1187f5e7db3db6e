package com.knowledge.fusion.core.model;

import java.util.Objects;

/**
 * Raw entity mention produced by an upstream extractor.
 *
 * @param text       surface text of the mention
 * @param type       extracted type tag
 * @param startPos   start offset in the source text
 * @param endPos     end offset (exclusive) in the source text
 * @param confidence extractor confidence in [0, 1]
 * @param context    surrounding text window, may be null
 */
public record ExtractedEntity(
        String text,
        String type,
        int startPos,
        int endPos,
        double confidence,
        String context
) {
    public ExtractedEntity {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(type, "type is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}
