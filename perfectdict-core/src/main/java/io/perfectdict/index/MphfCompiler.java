package io.perfectdict.index;

import io.perfectdict.core.ConstructionExhaustedException;
import io.perfectdict.core.DuplicateKeyException;
import io.perfectdict.core.PerfectDictConfiguration;
import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.hash.VertexHasher;
import io.perfectdict.kernel.Assignment;
import io.perfectdict.kernel.AssignmentSolver;
import io.perfectdict.kernel.GraphAttempt;
import io.perfectdict.kernel.GraphBuilder;
import io.perfectdict.kernel.GraphFailure;
import io.perfectdict.kernel.KeyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a set of distinct keys into a {@link PerfectHashFunction} and its
 * {@link FingerprintTable}.
 * <p>
 * Seeds {@code initialSeed, initialSeed + 1, ...} are tried in order until
 * the key graph is a forest or the retry budget is spent. The accepted graph
 * is labeled by {@link AssignmentSolver}, and when verification is enabled
 * every key is evaluated once more to confirm the slots are a bijection onto
 * {@code [0, n)}.
 */
public final class MphfCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MphfCompiler.class);

    private final PerfectDictConfiguration configuration;

    public MphfCompiler(PerfectDictConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Build the function for {@code keys}.
     *
     * @param keys encoded keys; the list and arrays are not retained
     * @return the function, fingerprints and the slot of every key
     * @throws DuplicateKeyException          if two keys are equal
     * @throws ConstructionExhaustedException if no seed in the budget works
     */
    public CompiledMphf compile(List<byte[]> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys required");
        }
        long start = System.nanoTime();
        checkDistinct(keys);

        int keyCount = keys.size();
        int vertexCount = configuration.vertexCount(keyCount);
        SeededHashFamily family = configuration.hashFamily();
        Map<GraphFailure, Integer> failures = new EnumMap<>(GraphFailure.class);

        for (int attempt = 0; attempt < configuration.maxAttempts(); attempt++) {
            long seed = configuration.initialSeed() + attempt;
            GraphAttempt result = GraphBuilder.build(keys, new VertexHasher(family, seed, vertexCount));
            if (result instanceof GraphAttempt.Rejected rejected) {
                failures.merge(rejected.failure(), 1, Integer::sum);
                LOG.debug("Seed {} rejected for {} keys: {}", seed, keyCount, rejected.failure());
                continue;
            }
            KeyGraph graph = ((GraphAttempt.Accepted) result).graph();
            Assignment assignment = AssignmentSolver.solve(graph);
            PerfectHashFunction function = PerfectHashFunction.fromLabels(family, seed, keyCount, assignment.labels());
            FingerprintTable fingerprints = FingerprintTable.create(
                    family, seed, keyCount, configuration.fingerprintBits());
            int[] slots = assignment.ranks();
            for (int i = 0; i < keyCount; i++) {
                fingerprints.record(slots[i], keys.get(i));
            }
            if (configuration.verifyConstruction()) {
                verify(function, keys, slots);
            }

            ConstructionStats stats = new ConstructionStats(keyCount, vertexCount, attempt + 1, seed,
                    assignment.componentCount(), failures, System.nanoTime() - start);
            LOG.info("Built perfect hash for {} keys in {} attempt(s): seed={}, vertices={}, {} bits/key",
                    keyCount, stats.attempts(), seed, vertexCount, String.format("%.2f", function.bitsPerKey()));
            return new CompiledMphf(function, fingerprints, slots, stats);
        }

        Map<String, Integer> tally = new LinkedHashMap<>();
        failures.forEach((failure, count) -> tally.put(failure.name(), count));
        LOG.warn("Giving up on {} keys after {} attempts (loadFactor={}): {}",
                keyCount, configuration.maxAttempts(), configuration.loadFactor(), tally);
        throw new ConstructionExhaustedException(keyCount, configuration.maxAttempts(),
                configuration.loadFactor(), tally);
    }

    private static void checkDistinct(List<byte[]> keys) {
        Map<ByteBuffer, Integer> seen = new HashMap<>(Math.max(16, keys.size() * 2));
        for (int i = 0; i < keys.size(); i++) {
            byte[] key = keys.get(i);
            if (key == null) {
                throw new IllegalArgumentException("key required at position " + i);
            }
            Integer previous = seen.putIfAbsent(ByteBuffer.wrap(key), i);
            if (previous != null) {
                throw new DuplicateKeyException(previous, i);
            }
        }
    }

    private static void verify(PerfectHashFunction function, List<byte[]> keys, int[] slots) {
        BitSet occupied = new BitSet(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            int slot = function.slot(keys.get(i));
            if (slot != slots[i]) {
                throw new IllegalStateException("key " + i + " evaluates to slot " + slot
                        + " but was assigned " + slots[i]);
            }
            if (occupied.get(slot)) {
                throw new IllegalStateException("slot " + slot + " assigned twice");
            }
            occupied.set(slot);
        }
        if (occupied.cardinality() != keys.size()) {
            throw new IllegalStateException("slots are not minimal: " + occupied.cardinality()
                    + " of " + keys.size() + " occupied");
        }
    }
}
