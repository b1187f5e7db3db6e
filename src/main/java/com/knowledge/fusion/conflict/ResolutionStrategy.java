package com.knowledge.fusion.conflict;

/**
 * Ways of choosing one value among conflicting candidates.
 */
public enum ResolutionStrategy {
    /**
     * Candidate with the highest confidence; the first one on ties.
     */
    HIGHEST_CONFIDENCE,
    MOST_FREQUENT,
    LONGEST_NAME,
    /**
     * Longest type name, taken as the most specific one.
     */
    MOST_SPECIFIC_TYPE,
    VOTE,
    /**
     * Mean of numeric candidates; falls back to {@link #VOTE} otherwise.
     */
    AVERAGE_NUMERIC,
    /**
     * De-duplicated union of list candidates; falls back to {@link #VOTE} otherwise.
     */
    UNION_LISTS,
    /**
     * First candidate, i.e. the earliest source.
     */
    SOURCE_AUTHORITY,
    /**
     * Defers to a human through the review queue; the first candidate stands in
     * with confidence 0.0 until then.
     */
    MANUAL_REVIEW
}
