package io.perfectdict.kernel;

import java.util.Arrays;

/**
 * Undirected multigraph with one edge per key, stored as arena adjacency lists.
 * <p>
 * Edge {@code e} joins {@code endpoint(e, 0)} and {@code endpoint(e, 1)}. Each
 * edge contributes two arcs: arc {@code 2e} leaves endpoint 0 and arc
 * {@code 2e + 1} leaves endpoint 1, so the edge of an arc is {@code arc >>> 1}
 * and its target is the opposite endpoint. Adjacency is a singly linked list
 * per vertex threaded through {@code head}/{@code next}.
 * <p>
 * Instances only exist while a dictionary is being built.
 */
public final class KeyGraph {
    public static final int NO_ARC = -1;

    private final int vertexCount;
    private final int edgeCount;
    private final int[] endpoints;
    private final int[] head;
    private final int[] next;

    private KeyGraph(int vertexCount, int[] endpoints) {
        this.vertexCount = vertexCount;
        this.edgeCount = endpoints.length / 2;
        this.endpoints = endpoints;
        this.head = new int[vertexCount];
        this.next = new int[endpoints.length];
        Arrays.fill(head, NO_ARC);
        // Inserted in reverse so every adjacency list runs in ascending arc order.
        for (int arc = endpoints.length - 1; arc >= 0; arc--) {
            int from = endpoints[arc];
            next[arc] = head[from];
            head[from] = arc;
        }
    }

    /**
     * Build the adjacency lists for the given endpoint pairs.
     *
     * @param vertexCount number of vertices
     * @param endpoints   {@code [u0, v0, u1, v1, ...]}, one pair per edge
     */
    public static KeyGraph of(int vertexCount, int[] endpoints) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must not be negative: " + vertexCount);
        }
        if (endpoints == null || (endpoints.length & 1) != 0) {
            throw new IllegalArgumentException("endpoints must hold pairs");
        }
        for (int vertex : endpoints) {
            if (vertex < 0 || vertex >= vertexCount) {
                throw new IllegalArgumentException("vertex out of range: " + vertex);
            }
        }
        return new KeyGraph(vertexCount, endpoints);
    }

    public int vertexCount() {
        return vertexCount;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public int endpoint(int edge, int side) {
        return endpoints[(edge << 1) | side];
    }

    public int firstArc(int vertex) {
        return head[vertex];
    }

    public int nextArc(int arc) {
        return next[arc];
    }

    public static int arcEdge(int arc) {
        return arc >>> 1;
    }

    public int arcTarget(int arc) {
        return endpoints[arc ^ 1];
    }

    public int degree(int vertex) {
        int degree = 0;
        for (int arc = head[vertex]; arc != NO_ARC; arc = next[arc]) {
            degree++;
        }
        return degree;
    }
}
