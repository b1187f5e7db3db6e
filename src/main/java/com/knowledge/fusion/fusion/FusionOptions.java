package com.knowledge.fusion.fusion;

/**
 * Options for entity and relation fusion passes.
 */
public class FusionOptions {

    private static final double DEFAULT_ENTITY_THRESHOLD = 0.8;
    private static final double DEFAULT_RELATION_THRESHOLD = 0.8;
    private static final double STRICT_THRESHOLD = 0.9;

    private final double entityThreshold;
    private final double relationThreshold;
    private final ClusteringMode clusteringMode;
    private final ConfidenceFusionStrategy confidenceStrategy;
    private final PropertyFusionStrategy propertyStrategy;
    private final boolean parallelScoring;

    private FusionOptions(Builder builder) {
        this.entityThreshold = builder.entityThreshold;
        this.relationThreshold = builder.relationThreshold;
        this.clusteringMode = builder.clusteringMode;
        this.confidenceStrategy = builder.confidenceStrategy;
        this.propertyStrategy = builder.propertyStrategy;
        this.parallelScoring = builder.parallelScoring;
    }

    public double getEntityThreshold() {
        return entityThreshold;
    }

    public double getRelationThreshold() {
        return relationThreshold;
    }

    public ClusteringMode getClusteringMode() {
        return clusteringMode;
    }

    public ConfidenceFusionStrategy getConfidenceStrategy() {
        return confidenceStrategy;
    }

    public PropertyFusionStrategy getPropertyStrategy() {
        return propertyStrategy;
    }

    public boolean isParallelScoring() {
        return parallelScoring;
    }

    /**
     * Creates default options.
     */
    public static FusionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that merge only very close candidates.
     */
    public static FusionOptions strict() {
        return builder()
                .entityThreshold(STRICT_THRESHOLD)
                .relationThreshold(STRICT_THRESHOLD)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double entityThreshold = DEFAULT_ENTITY_THRESHOLD;
        private double relationThreshold = DEFAULT_RELATION_THRESHOLD;
        private ClusteringMode clusteringMode = ClusteringMode.SEED;
        private ConfidenceFusionStrategy confidenceStrategy = ConfidenceFusionStrategy.WEIGHTED_AVERAGE;
        private PropertyFusionStrategy propertyStrategy = PropertyFusionStrategy.UNION;
        private boolean parallelScoring = false;

        public Builder entityThreshold(double entityThreshold) {
            validateThreshold(entityThreshold, "entityThreshold");
            this.entityThreshold = entityThreshold;
            return this;
        }

        public Builder relationThreshold(double relationThreshold) {
            validateThreshold(relationThreshold, "relationThreshold");
            this.relationThreshold = relationThreshold;
            return this;
        }

        public Builder clusteringMode(ClusteringMode clusteringMode) {
            if (clusteringMode == null) {
                throw new IllegalArgumentException("clusteringMode is required");
            }
            this.clusteringMode = clusteringMode;
            return this;
        }

        public Builder confidenceStrategy(ConfidenceFusionStrategy confidenceStrategy) {
            if (confidenceStrategy == null) {
                throw new IllegalArgumentException("confidenceStrategy is required");
            }
            this.confidenceStrategy = confidenceStrategy;
            return this;
        }

        public Builder propertyStrategy(PropertyFusionStrategy propertyStrategy) {
            if (propertyStrategy == null) {
                throw new IllegalArgumentException("propertyStrategy is required");
            }
            this.propertyStrategy = propertyStrategy;
            return this;
        }

        /**
         * Scores candidate pairs on the common fork/join pool. Cluster assignment
         * stays sequential, so results are identical to a sequential pass.
         */
        public Builder parallelScoring(boolean parallelScoring) {
            this.parallelScoring = parallelScoring;
            return this;
        }

        public FusionOptions build() {
            return new FusionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
