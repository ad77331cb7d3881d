package io.perfectdict.hash;

/**
 * Bit mixing helpers shared by the hash families.
 */
public final class HashMixers {

    static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private HashMixers() {
    }

    /**
     * murmur3 64-bit finalizer. Every input bit affects every output bit.
     */
    public static long fmix64(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return z;
    }

    /**
     * Spreads a seed so that consecutive seeds start from unrelated states.
     */
    public static long mixSeed(long seed) {
        return fmix64(seed * GOLDEN_GAMMA + GOLDEN_GAMMA);
    }

    public static int fold(long hash) {
        return (int) (hash ^ (hash >>> 32));
    }

    /**
     * Maps 32 uniform bits onto {@code [0, range)} with a multiply-shift.
     */
    public static int reduce(int bits, int range) {
        if (range <= 0) {
            throw new IllegalArgumentException("range must be positive: " + range);
        }
        return (int) (((bits & 0xffffffffL) * range) >>> 32);
    }
}
