package io.perfectdict.hash;

/**
 * A family of hash functions indexed by a seed.
 * <p>
 * For a fixed seed, {@link #hash64(byte[], long)} must be deterministic and its
 * 64 output bits uniformly distributed, so that the upper and lower halves can
 * be used as two independent draws. Different seeds must select statistically
 * different functions, not permutations of one another; the perfect-hash
 * construction relies on that to escape a failed attempt.
 */
public interface SeededHashFamily {

    /**
     * Stable identifier, recorded in snapshots to pick the same family on restore.
     */
    String name();

    long hash64(byte[] key, long seed);

    /**
     * Single bounded hash of {@code key} into {@code [0, range)}.
     */
    default int hash(byte[] key, long seed, int range) {
        return HashMixers.reduce(HashMixers.fold(hash64(key, seed)), range);
    }
}
