package io.perfectdict.kernel;

/**
 * Vertex labels and per-key ranks produced by {@link AssignmentSolver}.
 *
 * @param keyCount       number of keys (edges), the modulus of every label
 * @param labels         label per vertex, {@link #UNASSIGNED} for isolated vertices
 * @param ranks          rank per edge, a permutation of {@code [0, keyCount)}
 * @param componentCount number of non-trivial components processed
 */
public record Assignment(int keyCount, int[] labels, int[] ranks, int componentCount) {
    public static final int UNASSIGNED = -1;

    public Assignment {
        if (labels == null || ranks == null) {
            throw new IllegalArgumentException("labels and ranks required");
        }
        if (ranks.length != keyCount) {
            throw new IllegalArgumentException("ranks must have one entry per key");
        }
    }
}
