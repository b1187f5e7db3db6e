package com.knowledge.fusion.fusion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FusionOptionsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        FusionOptions options = FusionOptions.defaults();

        assertEquals(0.8, options.getEntityThreshold());
        assertEquals(0.8, options.getRelationThreshold());
        assertEquals(ClusteringMode.SEED, options.getClusteringMode());
        assertEquals(ConfidenceFusionStrategy.WEIGHTED_AVERAGE, options.getConfidenceStrategy());
        assertEquals(PropertyFusionStrategy.UNION, options.getPropertyStrategy());
        assertFalse(options.isParallelScoring());
    }

    @Test
    @DisplayName("Strict preset raises both thresholds")
    void strict() {
        FusionOptions options = FusionOptions.strict();

        assertEquals(0.9, options.getEntityThreshold());
        assertEquals(0.9, options.getRelationThreshold());
    }

    @Test
    @DisplayName("Out-of-range thresholds and missing strategies are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> FusionOptions.builder().entityThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> FusionOptions.builder().relationThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> FusionOptions.builder().relationThreshold(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> FusionOptions.builder().clusteringMode(null));
        assertThrows(IllegalArgumentException.class, () -> FusionOptions.builder().confidenceStrategy(null));
    }
}
