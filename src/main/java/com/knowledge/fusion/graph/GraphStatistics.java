package com.knowledge.fusion.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Size and shape of a store.
 *
 * @param averageDegree              {@code 2m / n}, 0 for an empty store
 * @param weaklyConnectedComponents  components when edge direction is ignored
 * @param density                    {@code m / (n (n - 1))} over the directed multigraph, 0 when n &lt; 2
 */
public record GraphStatistics(
        int entityCount,
        int relationCount,
        Map<String, Integer> entityTypes,
        Map<String, Integer> relationTypes,
        double averageDegree,
        int weaklyConnectedComponents,
        double density
) {
    public GraphStatistics {
        entityTypes = Collections.unmodifiableMap(new LinkedHashMap<>(entityTypes));
        relationTypes = Collections.unmodifiableMap(new LinkedHashMap<>(relationTypes));
    }
}
