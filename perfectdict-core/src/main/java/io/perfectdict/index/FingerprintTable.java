package io.perfectdict.index;

import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.hash.VertexHasher;
import io.perfectdict.kernel.PackedIntArray;

/**
 * Per-slot digests used to reject keys that were not part of the build set.
 * <p>
 * The digest is the low {@code bits} bits of the hash family evaluated under
 * {@link VertexHasher#fingerprintSeed(long)}, a stream independent from the
 * one that chose the key's slot. An absent key is reported present only when
 * its digest happens to equal the one stored at its slot, so the per-lookup
 * false-positive rate is about {@code 2^-bits}.
 * <p>
 * With zero bits the table is {@link #disabled() disabled} and every key
 * matches.
 * <p>
 * <b>Thread-safety:</b> filled once during construction, immutable afterwards.
 */
public final class FingerprintTable {

    private static final FingerprintTable DISABLED = new FingerprintTable(null, 0L, 0, null);

    private final SeededHashFamily family;
    private final long fingerprintSeed;
    private final int bits;
    private final PackedIntArray digests;

    private FingerprintTable(SeededHashFamily family, long fingerprintSeed, int bits, PackedIntArray digests) {
        this.family = family;
        this.fingerprintSeed = fingerprintSeed;
        this.bits = bits;
        this.digests = digests;
    }

    public static FingerprintTable disabled() {
        return DISABLED;
    }

    /**
     * Create an empty table; slots are filled with {@link #record(int, byte[])}.
     *
     * @param family hash family of the function this table belongs to
     * @param seed   construction seed of that function
     * @param size   number of slots
     * @param bits   digest width, 0 for a disabled table
     */
    public static FingerprintTable create(SeededHashFamily family, long seed, int size, int bits) {
        if (bits == 0) {
            return DISABLED;
        }
        if (family == null) {
            throw new IllegalArgumentException("family required");
        }
        if (bits < 0 || bits > 32) {
            throw new IllegalArgumentException("bits must be between 0 and 32: " + bits);
        }
        return new FingerprintTable(family, VertexHasher.fingerprintSeed(seed), bits, new PackedIntArray(size, bits));
    }

    /**
     * Recreate a table from previously exported digests.
     */
    public static FingerprintTable restore(SeededHashFamily family, long seed, int bits, int[] digests) {
        if (bits == 0) {
            return DISABLED;
        }
        if (digests == null) {
            throw new IllegalArgumentException("digests required");
        }
        FingerprintTable table = create(family, seed, digests.length, bits);
        for (int slot = 0; slot < digests.length; slot++) {
            table.digests.set(slot, digests[slot]);
        }
        return table;
    }

    void record(int slot, byte[] key) {
        if (bits == 0) {
            return;
        }
        digests.set(slot, digest(key));
    }

    public boolean matches(int slot, byte[] key) {
        return bits == 0 || digests.get(slot) == digest(key);
    }

    public int digest(byte[] key) {
        if (bits == 0) {
            return 0;
        }
        return (int) (family.hash64(key, fingerprintSeed) & ((1L << bits) - 1));
    }

    public int digestAt(int slot) {
        if (bits == 0) {
            throw new IllegalStateException("fingerprinting disabled");
        }
        return digests.get(slot);
    }

    public int[] digests() {
        return bits == 0 ? new int[0] : digests.toIntArray();
    }

    public boolean enabled() {
        return bits > 0;
    }

    public int bits() {
        return bits;
    }

    /**
     * Chance that a key outside the build set passes {@link #matches(int, byte[])}.
     */
    public double falsePositiveRate() {
        return bits == 0 ? 1.0 : 1.0 / (1L << bits);
    }

    public long sizeInBytes() {
        return bits == 0 ? 0L : digests.sizeInBytes();
    }
}
