package com.knowledge.fusion.review;

import com.knowledge.fusion.conflict.ConflictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.submitted id={} conflictId={} conflictType={}",
                item.getId(), item.getConflictId(), item.getConflictType());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<ReviewItem> getPendingByConflictType(ConflictType conflictType) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getConflictType() == conflictType)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .collect(Collectors.toList());
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        pendingItem(reviewId).markApproved(reviewerId, notes);
        log.info("review.approved id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        pendingItem(reviewId).markRejected(reviewerId, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
