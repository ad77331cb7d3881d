package io.perfectdict.kernel;

import java.util.Arrays;

/**
 * Fixed-length array of unsigned integers stored with a fixed number of bits
 * per element (1 to 32), packed into 64-bit words.
 * <p>
 * Entries may straddle a word boundary. 32-bit entries are returned as their
 * raw bits, so values at or above 2^31 read back negative.
 * <p>
 * <b>Thread-safety:</b> writes are not synchronized. Arrays are filled once by
 * a single thread and only read afterwards.
 */
public final class PackedIntArray {
    private static final int BITS_PER_WORD = 64;

    private final int length;
    private final int bitsPerValue;
    private final long mask;
    private final long[] words;

    public PackedIntArray(int length, int bitsPerValue) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (bitsPerValue < 1 || bitsPerValue > 32) {
            throw new IllegalArgumentException("bitsPerValue must be between 1 and 32: " + bitsPerValue);
        }
        this.length = length;
        this.bitsPerValue = bitsPerValue;
        this.mask = (1L << bitsPerValue) - 1;
        this.words = new long[(int) (((long) length * bitsPerValue + BITS_PER_WORD - 1) / BITS_PER_WORD)];
    }

    /**
     * Smallest width able to hold every value in {@code [0, maxValue]}.
     */
    public static int bitsRequired(long maxValue) {
        if (maxValue < 0) {
            throw new IllegalArgumentException("maxValue must not be negative: " + maxValue);
        }
        return Math.max(1, BITS_PER_WORD - Long.numberOfLeadingZeros(maxValue));
    }

    public int length() {
        return length;
    }

    public int bitsPerValue() {
        return bitsPerValue;
    }

    public int get(int index) {
        checkIndex(index);
        long bitIndex = (long) index * bitsPerValue;
        int word = (int) (bitIndex >>> 6);
        int shift = (int) (bitIndex & 63);
        long value = words[word] >>> shift;
        if (shift + bitsPerValue > BITS_PER_WORD) {
            value |= words[word + 1] << (BITS_PER_WORD - shift);
        }
        return (int) (value & mask);
    }

    public void set(int index, int value) {
        checkIndex(index);
        long bits = value & 0xffffffffL;
        if ((bits & ~mask) != 0) {
            throw new IllegalArgumentException("value does not fit in " + bitsPerValue + " bits: " + bits);
        }
        long bitIndex = (long) index * bitsPerValue;
        int word = (int) (bitIndex >>> 6);
        int shift = (int) (bitIndex & 63);
        words[word] = (words[word] & ~(mask << shift)) | (bits << shift);
        int spill = shift + bitsPerValue - BITS_PER_WORD;
        if (spill > 0) {
            long highMask = (1L << spill) - 1;
            words[word + 1] = (words[word + 1] & ~highMask) | (bits >>> (bitsPerValue - spill));
        }
    }

    public int[] toIntArray() {
        int[] out = new int[length];
        for (int i = 0; i < length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    /**
     * Heap footprint of the packed words, excluding object headers.
     */
    public long sizeInBytes() {
        return (long) words.length * Long.BYTES;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index out of range: " + index);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        PackedIntArray other = (PackedIntArray) obj;
        return length == other.length
                && bitsPerValue == other.bitsPerValue
                && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * length + bitsPerValue) + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "PackedIntArray{length=" + length + ", bitsPerValue=" + bitsPerValue + "}";
    }
}
