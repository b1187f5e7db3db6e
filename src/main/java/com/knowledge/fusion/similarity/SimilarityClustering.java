package com.knowledge.fusion.similarity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Grouping of indexed items given a pairwise "is duplicate" test.
 *
 * <p>Two semantics are provided and they differ on non-transitive chains
 * (a~b, b~c, a!~c):</p>
 * <ul>
 *   <li>{@link #seedGroups}: each still-unassigned item, in index order, becomes a seed and
 *       absorbs every later unassigned item linked to the seed itself. Members are never
 *       compared to each other. The chain above yields {a, b} and {c}.</li>
 *   <li>{@link #connectedComponents}: union-find over every linked pair; the chain above
 *       yields {a, b, c}.</li>
 * </ul>
 * <p>Both return every group (singletons included), ordered by their smallest index, with
 * members in ascending index order.</p>
 */
public final class SimilarityClustering {

    private SimilarityClustering() {
    }

    /**
     * Pairwise test over item indices, always called with {@code i < j}.
     */
    @FunctionalInterface
    public interface PairTest {
        boolean linked(int i, int j);
    }

    public static List<List<Integer>> seedGroups(int size, PairTest test) {
        boolean[] assigned = new boolean[size];
        List<List<Integer>> groups = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (assigned[i]) {
                continue;
            }
            List<Integer> group = new ArrayList<>();
            group.add(i);
            assigned[i] = true;
            for (int j = i + 1; j < size; j++) {
                if (!assigned[j] && test.linked(i, j)) {
                    group.add(j);
                    assigned[j] = true;
                }
            }
            groups.add(group);
        }
        return groups;
    }

    public static List<List<Integer>> connectedComponents(int size, PairTest test) {
        int[] parent = IntStream.range(0, size).toArray();
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (find(parent, i) != find(parent, j) && test.linked(i, j)) {
                    union(parent, i, j);
                }
            }
        }
        Map<Integer, List<Integer>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            byRoot.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(byRoot.values());
    }

    /**
     * Precomputes the upper triangle of a pairwise test, optionally on the common
     * fork/join pool. Each row is written by one task only.
     */
    public static PairTest precompute(int size, PairTest test, boolean parallel) {
        boolean[][] linked = new boolean[size][];
        IntStream rows = IntStream.range(0, size);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> {
            boolean[] row = new boolean[size];
            for (int j = i + 1; j < size; j++) {
                row[j] = test.linked(i, j);
            }
            linked[i] = row;
        });
        return (i, j) -> linked[i][j];
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int i, int j) {
        int rootI = find(parent, i);
        int rootJ = find(parent, j);
        // smaller root wins so each component is keyed by its first member
        if (rootI < rootJ) {
            parent[rootJ] = rootI;
        } else {
            parent[rootI] = rootJ;
        }
    }
}
