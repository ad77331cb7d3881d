package io.perfectdict.index;

import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.hash.VertexHasher;
import io.perfectdict.kernel.Assignment;
import io.perfectdict.kernel.PackedIntArray;

/**
 * Evaluates a minimal perfect hash function:
 * {@code slot(key) = (g[h1(key)] + g[h2(key)]) mod n}.
 * <p>
 * The function is total. A key outside the build set still maps to some slot
 * in {@code [0, n)}, which carries no meaning; use a {@link FingerprintTable}
 * to tell members from non-members.
 * <p>
 * Labels are stored shifted by one in a {@link PackedIntArray} so that a zero
 * entry marks a vertex no key touched. Such vertices evaluate as label 0.
 * <p>
 * <b>Thread-safety:</b> immutable, safe for any number of concurrent readers.
 */
public final class PerfectHashFunction {

    private final VertexHasher hasher;
    private final int keyCount;
    private final PackedIntArray labels;

    private PerfectHashFunction(VertexHasher hasher, int keyCount, PackedIntArray labels) {
        this.hasher = hasher;
        this.keyCount = keyCount;
        this.labels = labels;
    }

    /**
     * Create a function from a plain label table.
     *
     * @param family   hash family used at construction
     * @param seed     accepted construction seed
     * @param keyCount number of keys, {@code n}
     * @param labels   label per vertex, {@link Assignment#UNASSIGNED} for untouched vertices
     */
    public static PerfectHashFunction fromLabels(SeededHashFamily family, long seed, int keyCount, int[] labels) {
        if (keyCount < 0) {
            throw new IllegalArgumentException("keyCount must not be negative: " + keyCount);
        }
        if (labels == null) {
            throw new IllegalArgumentException("labels required");
        }
        VertexHasher hasher = new VertexHasher(family, seed, labels.length);
        PackedIntArray packed = new PackedIntArray(labels.length, PackedIntArray.bitsRequired(keyCount));
        for (int vertex = 0; vertex < labels.length; vertex++) {
            int label = labels[vertex];
            if (label == Assignment.UNASSIGNED) {
                continue;
            }
            if (label < 0 || label >= keyCount) {
                throw new IllegalArgumentException("label out of range at vertex " + vertex + ": " + label);
            }
            packed.set(vertex, label + 1);
        }
        return new PerfectHashFunction(hasher, keyCount, packed);
    }

    /**
     * Slot of {@code key} in {@code [0, size())}.
     *
     * @throws IllegalStateException if the function was built from zero keys
     */
    public int slot(byte[] key) {
        if (keyCount == 0) {
            throw new IllegalStateException("no slots: function built from zero keys");
        }
        long draw = hasher.draw(key);
        int a = label(hasher.first(draw));
        int b = label(hasher.second(draw));
        // (a + b) mod n without overflowing when n is close to Integer.MAX_VALUE
        int slot = a - (keyCount - b);
        return slot < 0 ? slot + keyCount : slot;
    }

    private int label(int vertex) {
        int stored = labels.get(vertex);
        return stored == 0 ? 0 : stored - 1;
    }

    /**
     * Label of {@code vertex}, or {@link Assignment#UNASSIGNED}.
     */
    public int labelAt(int vertex) {
        return labels.get(vertex) - 1;
    }

    public int[] labels() {
        int[] out = new int[labels.length()];
        for (int vertex = 0; vertex < out.length; vertex++) {
            out[vertex] = labelAt(vertex);
        }
        return out;
    }

    public int size() {
        return keyCount;
    }

    public int vertexCount() {
        return labels.length();
    }

    public long seed() {
        return hasher.seed();
    }

    public SeededHashFamily family() {
        return hasher.family();
    }

    public int bitsPerLabel() {
        return labels.bitsPerValue();
    }

    /**
     * Label table footprint per key, in bits.
     */
    public double bitsPerKey() {
        return keyCount == 0 ? 0.0 : (labels.sizeInBytes() * 8.0) / keyCount;
    }

    @Override
    public String toString() {
        return "PerfectHashFunction{keys=" + keyCount
                + ", vertices=" + labels.length()
                + ", seed=" + hasher.seed()
                + ", family=" + hasher.family().name() + "}";
    }
}
