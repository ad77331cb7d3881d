package io.perfectdict.hash;

/**
 * MurmurHash3 x64/128 body with a 64-bit seed; returns the first half of the
 * 128-bit result.
 */
public final class Murmur3HashFamily implements SeededHashFamily {

    public static final String NAME = "murmur3-x64";

    private static final long C1 = 0x87c37b91114253d5L;
    private static final long C2 = 0x4cf5ad432745937fL;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public long hash64(byte[] key, long seed) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        long mixed = HashMixers.mixSeed(seed);
        long h1 = mixed;
        long h2 = Long.rotateLeft(mixed, 32) ^ HashMixers.GOLDEN_GAMMA;
        int length = key.length;
        int blocks = length >>> 4;

        for (int i = 0; i < blocks; i++) {
            int offset = i << 4;
            long k1 = readLongLE(key, offset);
            long k2 = readLongLE(key, offset + 8);

            h1 ^= mixK1(k1);
            h1 = Long.rotateLeft(h1, 27);
            h1 += h2;
            h1 = h1 * 5 + 0x52dce729;

            h2 ^= mixK2(k2);
            h2 = Long.rotateLeft(h2, 31);
            h2 += h1;
            h2 = h2 * 5 + 0x38495ab5;
        }

        int tail = blocks << 4;
        long k1 = 0;
        long k2 = 0;
        switch (length & 15) {
            case 15: k2 ^= (long) (key[tail + 14] & 0xff) << 48;
            case 14: k2 ^= (long) (key[tail + 13] & 0xff) << 40;
            case 13: k2 ^= (long) (key[tail + 12] & 0xff) << 32;
            case 12: k2 ^= (long) (key[tail + 11] & 0xff) << 24;
            case 11: k2 ^= (long) (key[tail + 10] & 0xff) << 16;
            case 10: k2 ^= (long) (key[tail + 9] & 0xff) << 8;
            case 9:
                k2 ^= key[tail + 8] & 0xff;
                h2 ^= mixK2(k2);
            case 8: k1 ^= (long) (key[tail + 7] & 0xff) << 56;
            case 7: k1 ^= (long) (key[tail + 6] & 0xff) << 48;
            case 6: k1 ^= (long) (key[tail + 5] & 0xff) << 40;
            case 5: k1 ^= (long) (key[tail + 4] & 0xff) << 32;
            case 4: k1 ^= (long) (key[tail + 3] & 0xff) << 24;
            case 3: k1 ^= (long) (key[tail + 2] & 0xff) << 16;
            case 2: k1 ^= (long) (key[tail + 1] & 0xff) << 8;
            case 1:
                k1 ^= key[tail] & 0xff;
                h1 ^= mixK1(k1);
                break;
            default:
                break;
        }

        h1 ^= length;
        h2 ^= length;
        h1 += h2;
        h2 += h1;
        h1 = HashMixers.fmix64(h1);
        h2 = HashMixers.fmix64(h2);
        h1 += h2;
        return h1;
    }

    private static long mixK1(long k1) {
        k1 *= C1;
        k1 = Long.rotateLeft(k1, 31);
        return k1 * C2;
    }

    private static long mixK2(long k2) {
        k2 *= C2;
        k2 = Long.rotateLeft(k2, 33);
        return k2 * C1;
    }

    private static long readLongLE(byte[] bytes, int offset) {
        return (bytes[offset] & 0xffL)
                | (bytes[offset + 1] & 0xffL) << 8
                | (bytes[offset + 2] & 0xffL) << 16
                | (bytes[offset + 3] & 0xffL) << 24
                | (bytes[offset + 4] & 0xffL) << 32
                | (bytes[offset + 5] & 0xffL) << 40
                | (bytes[offset + 6] & 0xffL) << 48
                | (bytes[offset + 7] & 0xffL) << 56;
    }

    @Override
    public String toString() {
        return NAME;
    }
}
