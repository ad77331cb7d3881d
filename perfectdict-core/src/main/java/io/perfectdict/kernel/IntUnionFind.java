package io.perfectdict.kernel;

/**
 * Disjoint-set forest over the integers {@code [0, size)}.
 * Path halving on find, union by size.
 */
public final class IntUnionFind {
    private final int[] parent;
    private final int[] size;

    public IntUnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        this.parent = new int[size];
        this.size = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            this.size[i] = 1;
        }
    }

    public int find(int element) {
        int node = element;
        while (parent[node] != node) {
            parent[node] = parent[parent[node]];
            node = parent[node];
        }
        return node;
    }

    /**
     * Unifies the sets containing {@code a} and {@code b}.
     *
     * @return true if the sets were different and are now merged, false if they
     * were already the same
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        return true;
    }

    public int setSize(int element) {
        return size[find(element)];
    }
}
