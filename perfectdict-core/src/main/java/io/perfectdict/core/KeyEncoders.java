package io.perfectdict.core;

import java.nio.charset.StandardCharsets;

/**
 * Built-in {@link KeyEncoder}s.
 */
public final class KeyEncoders {

    private static final KeyEncoder<CharSequence> UTF8 =
            key -> key.toString().getBytes(StandardCharsets.UTF_8);

    private static final KeyEncoder<byte[]> BYTES = key -> key;

    private static final KeyEncoder<Long> LONGS = key -> {
        long value = key;
        byte[] out = new byte[Long.BYTES];
        for (int i = Long.BYTES - 1; i >= 0; i--) {
            out[i] = (byte) value;
            value >>>= 8;
        }
        return out;
    };

    private static final KeyEncoder<Integer> INTS = key -> {
        int value = key;
        return new byte[]{
                (byte) (value >>> 24),
                (byte) (value >>> 16),
                (byte) (value >>> 8),
                (byte) value
        };
    };

    private KeyEncoders() {
    }

    @SuppressWarnings("unchecked")
    public static <K extends CharSequence> KeyEncoder<K> utf8() {
        return (KeyEncoder<K>) UTF8;
    }

    /**
     * Identity encoding. Lookups hash the array as-is; the dictionary builder
     * copies it on {@code put} so later changes by the caller do not affect the build.
     */
    public static KeyEncoder<byte[]> bytes() {
        return BYTES;
    }

    public static KeyEncoder<Long> longs() {
        return LONGS;
    }

    public static KeyEncoder<Integer> ints() {
        return INTS;
    }
}
