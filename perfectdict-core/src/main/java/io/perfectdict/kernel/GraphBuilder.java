package io.perfectdict.kernel;

import io.perfectdict.hash.VertexHasher;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the key graph for a single seed and checks that it is a forest.
 * <p>
 * Each call is independent: no state survives between attempts, so the seed
 * search is a plain loop over {@link #build(List, VertexHasher)}.
 */
public final class GraphBuilder {

    private GraphBuilder() {
    }

    /**
     * Hash every key to its two endpoints and accept the graph only if it has no
     * self-loop, no duplicate edge and no cycle.
     *
     * @param keys   distinct keys, edge {@code i} belongs to {@code keys.get(i)}
     * @param hasher endpoint derivation for this attempt's seed
     * @return the accepted forest, or the first failure found
     */
    public static GraphAttempt build(List<byte[]> keys, VertexHasher hasher) {
        if (keys == null) {
            throw new IllegalArgumentException("keys required");
        }
        if (hasher == null) {
            throw new IllegalArgumentException("hasher required");
        }
        int edgeCount = keys.size();
        int vertexCount = hasher.vertexCount();
        long seed = hasher.seed();
        int[] endpoints = new int[edgeCount * 2];
        long[] pairs = new long[edgeCount];

        for (int edge = 0; edge < edgeCount; edge++) {
            long draw = hasher.draw(keys.get(edge));
            int u = hasher.first(draw);
            int v = hasher.second(draw);
            if (u == v) {
                return new GraphAttempt.Rejected(seed, GraphFailure.SELF_LOOP);
            }
            endpoints[edge << 1] = u;
            endpoints[(edge << 1) | 1] = v;
            pairs[edge] = u < v ? ((long) u << 32) | v : ((long) v << 32) | u;
        }

        Arrays.sort(pairs);
        for (int i = 1; i < edgeCount; i++) {
            if (pairs[i] == pairs[i - 1]) {
                return new GraphAttempt.Rejected(seed, GraphFailure.DUPLICATE_EDGE);
            }
        }

        // A component is a tree iff no edge joins two vertices that are already connected.
        IntUnionFind components = new IntUnionFind(vertexCount);
        for (int edge = 0; edge < edgeCount; edge++) {
            if (!components.union(endpoints[edge << 1], endpoints[(edge << 1) | 1])) {
                return new GraphAttempt.Rejected(seed, GraphFailure.CYCLE);
            }
        }

        return new GraphAttempt.Accepted(seed, KeyGraph.of(vertexCount, endpoints));
    }
}
