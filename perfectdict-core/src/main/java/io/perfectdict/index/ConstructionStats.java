package io.perfectdict.index;

import io.perfectdict.kernel.GraphFailure;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one successful construction.
 *
 * @param keyCount       number of keys
 * @param vertexCount    number of graph vertices
 * @param attempts       seeds tried, including the accepted one
 * @param seed           accepted seed
 * @param componentCount non-trivial components of the accepted graph
 * @param failures       rejected attempts per failure kind
 * @param elapsedNanos   wall time of the whole construction
 */
public record ConstructionStats(int keyCount,
                                int vertexCount,
                                int attempts,
                                long seed,
                                int componentCount,
                                Map<GraphFailure, Integer> failures,
                                long elapsedNanos) {

    public ConstructionStats {
        failures = failures.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(failures));
    }

    /**
     * Stats for a dictionary restored from a snapshot, where nothing was built.
     */
    public static ConstructionStats restored(int keyCount, int vertexCount, long seed) {
        return new ConstructionStats(keyCount, vertexCount, 0, seed, 0, Map.of(), 0L);
    }
}
