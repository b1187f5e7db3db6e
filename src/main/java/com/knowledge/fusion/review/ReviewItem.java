package com.knowledge.fusion.review;

import com.knowledge.fusion.conflict.ConflictType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A conflict handed to a human reviewer by the manual-review strategy.
 * Candidate values are kept in their textual form, in conflict order.
 */
public class ReviewItem {

    private final String id;
    private final String conflictId;
    private final ConflictType conflictType;
    private final String subjectId;
    private final String description;
    private final List<String> candidateValues;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.conflictId = Objects.requireNonNull(builder.conflictId, "conflictId is required");
        this.conflictType = Objects.requireNonNull(builder.conflictType, "conflictType is required");
        this.subjectId = builder.subjectId;
        this.description = builder.description;
        this.candidateValues = builder.candidateValues != null ? List.copyOf(builder.candidateValues) : List.of();
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getConflictId() {
        return conflictId;
    }

    public ConflictType getConflictType() {
        return conflictType;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getCandidateValues() {
        return candidateValues;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    void markApproved(String reviewerId, String notes) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    void markRejected(String reviewerId, String notes) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", conflictId='" + conflictId + '\'' +
                ", conflictType=" + conflictType +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String conflictId;
        private ConflictType conflictType;
        private String subjectId;
        private String description;
        private List<String> candidateValues;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder conflictId(String conflictId) {
            this.conflictId = conflictId;
            return this;
        }

        public Builder conflictType(ConflictType conflictType) {
            this.conflictType = conflictType;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder candidateValues(List<String> candidateValues) {
            this.candidateValues = candidateValues;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
