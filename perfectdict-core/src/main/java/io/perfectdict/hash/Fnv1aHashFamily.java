package io.perfectdict.hash;

/**
 * 64-bit FNV-1a with the seed folded into the offset basis, finished with the
 * murmur3 finalizer so that the low and high halves are both usable.
 */
public final class Fnv1aHashFamily implements SeededHashFamily {

    public static final String NAME = "fnv1a-64";

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public long hash64(byte[] key, long seed) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        long hash = FNV_OFFSET_BASIS ^ HashMixers.mixSeed(seed);
        for (byte b : key) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return HashMixers.fmix64(hash ^ key.length);
    }

    @Override
    public String toString() {
        return NAME;
    }
}
