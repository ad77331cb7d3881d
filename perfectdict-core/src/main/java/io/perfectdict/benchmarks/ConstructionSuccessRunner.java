package io.perfectdict.benchmarks;

import io.perfectdict.hash.HashFamilies;
import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.hash.VertexHasher;
import io.perfectdict.kernel.GraphAttempt;
import io.perfectdict.kernel.GraphBuilder;
import io.perfectdict.kernel.GraphFailure;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how often a single seed yields an acyclic key graph for a range of
 * load factors. Random 2-graphs with {@code m = c·n} vertices are acyclic with
 * probability close to {@code sqrt((c - 2) / c)} for large n, so the printed
 * rates should approach that column.
 * <p>
 * Usage: {@code ConstructionSuccessRunner [keys] [seeds] [family]}
 */
public class ConstructionSuccessRunner {
    private static final double[] LOAD_FACTORS = {1.5, 2.0, 2.1, 2.25, 2.5, 3.0, 4.0};

    public static void main(String[] args) {
        int keyCount = args.length > 0 ? Integer.parseInt(args[0]) : 100_000;
        int seeds = args.length > 1 ? Integer.parseInt(args[1]) : 200;
        SeededHashFamily family = args.length > 2 ? HashFamilies.byName(args[2]) : HashFamilies.defaultFamily();

        List<byte[]> keys = new ArrayList<>(keyCount);
        for (int i = 0; i < keyCount; i++) {
            keys.add(("key-" + i).getBytes(StandardCharsets.UTF_8));
        }

        System.out.printf("=== Construction success: %d keys, %d seeds, %s ===%n", keyCount, seeds, family.name());
        System.out.printf("%-6s %-10s %-10s %-10s %-10s %-10s%n",
                "c", "success", "expected", "selfLoop", "duplicate", "cycle");

        for (double loadFactor : LOAD_FACTORS) {
            int vertexCount = (int) Math.ceil(loadFactor * keyCount);
            Map<GraphFailure, Integer> failures = new EnumMap<>(GraphFailure.class);
            int accepted = 0;
            long start = System.nanoTime();
            for (int seed = 0; seed < seeds; seed++) {
                GraphAttempt attempt = GraphBuilder.build(keys, new VertexHasher(family, seed, vertexCount));
                if (attempt instanceof GraphAttempt.Rejected rejected) {
                    failures.merge(rejected.failure(), 1, Integer::sum);
                } else {
                    accepted++;
                }
            }
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            double expected = loadFactor > 2.0 ? Math.sqrt((loadFactor - 2.0) / loadFactor) : 0.0;
            System.out.printf("%-6.2f %-10.3f %-10.3f %-10d %-10d %-10d (%d ms)%n",
                    loadFactor,
                    (double) accepted / seeds,
                    expected,
                    failures.getOrDefault(GraphFailure.SELF_LOOP, 0),
                    failures.getOrDefault(GraphFailure.DUPLICATE_EDGE, 0),
                    failures.getOrDefault(GraphFailure.CYCLE, 0),
                    elapsedMs);
        }
    }
}
