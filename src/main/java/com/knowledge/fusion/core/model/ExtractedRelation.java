package com.knowledge.fusion.core.model;

import java.util.Objects;

/**
 * Raw relation mention produced by an upstream extractor.
 * Endpoints are surface texts, not entity ids.
 *
 * @param headEntity   surface text of the head mention
 * @param relationType extracted relation type
 * @param tailEntity   surface text of the tail mention
 * @param confidence   extractor confidence in [0, 1]
 * @param context      sentence or window the relation was read from, may be null
 * @param startPos     start offset in the source text
 * @param endPos       end offset (exclusive) in the source text
 */
public record ExtractedRelation(
        String headEntity,
        String relationType,
        String tailEntity,
        double confidence,
        String context,
        int startPos,
        int endPos
) {
    public ExtractedRelation {
        Objects.requireNonNull(headEntity, "headEntity is required");
        Objects.requireNonNull(relationType, "relationType is required");
        Objects.requireNonNull(tailEntity, "tailEntity is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}
