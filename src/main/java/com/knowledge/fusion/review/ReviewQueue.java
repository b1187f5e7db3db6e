package com.knowledge.fusion.review;

import com.knowledge.fusion.conflict.ConflictType;

import java.util.List;

/**
 * Queue of conflicts that a resolution strategy deferred to a human.
 */
public interface ReviewQueue {

    /**
     * Submits a review item to the queue.
     *
     * @return the submitted item
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    List<ReviewItem> getPendingByConflictType(ConflictType conflictType);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the review item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
