package io.perfectdict.hash;

/**
 * Derives the two graph endpoints of a key from a single 64-bit draw.
 * <p>
 * The upper half selects {@code h1} and the lower half selects {@code h2}, both
 * reduced to {@code [0, vertexCount)}. A second, independent stream of the same
 * family (see {@link #fingerprintSeed(long)}) feeds the fingerprint digest.
 */
public final class VertexHasher {

    private static final long FINGERPRINT_STREAM = 0x6a09e667f3bcc909L;

    private final SeededHashFamily family;
    private final long seed;
    private final int vertexCount;

    public VertexHasher(SeededHashFamily family, long seed, int vertexCount) {
        if (family == null) {
            throw new IllegalArgumentException("family required");
        }
        if (vertexCount < 2) {
            throw new IllegalArgumentException("vertexCount must be at least 2: " + vertexCount);
        }
        this.family = family;
        this.seed = seed;
        this.vertexCount = vertexCount;
    }

    public long draw(byte[] key) {
        return family.hash64(key, seed);
    }

    public int first(long draw) {
        return HashMixers.reduce((int) (draw >>> 32), vertexCount);
    }

    public int second(long draw) {
        return HashMixers.reduce((int) draw, vertexCount);
    }

    public SeededHashFamily family() {
        return family;
    }

    public long seed() {
        return seed;
    }

    public int vertexCount() {
        return vertexCount;
    }

    /**
     * Seed of the fingerprint stream that belongs to construction seed {@code seed}.
     */
    public static long fingerprintSeed(long seed) {
        return HashMixers.fmix64(seed ^ FINGERPRINT_STREAM);
    }
}
