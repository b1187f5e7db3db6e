package com.knowledge.fusion.fusion;

/**
 * How a fusion pass turns pairwise duplicate decisions into clusters.
 */
public enum ClusteringMode {
    /**
     * Each unassigned item, in input order, seeds a cluster and absorbs every later
     * unassigned item similar to the seed. Members are not compared to each other.
     */
    SEED,

    /**
     * Transitive closure of the duplicate relation (union-find).
     */
    CONNECTED_COMPONENTS
}
