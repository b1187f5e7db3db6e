package com.knowledge.fusion.review;

/**
 * Status of a conflict awaiting a human decision.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
