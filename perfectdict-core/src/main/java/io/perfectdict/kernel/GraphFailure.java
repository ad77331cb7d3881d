package io.perfectdict.kernel;

/**
 * Reasons a seed is rejected while building the key graph.
 */
public enum GraphFailure {
    /**
     * A key hashed both endpoints to the same vertex.
     */
    SELF_LOOP,

    /**
     * Two keys produced the same unordered vertex pair.
     */
    DUPLICATE_EDGE,

    /**
     * A component has as many edges as vertices, so it is not a tree.
     */
    CYCLE
}
