package io.perfectdict.storage;

import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Unboxed storage for {@code Integer} values. Does not accept {@code null}.
 */
public final class IntArrayValueStore implements ValueStore<Integer> {

    private final AtomicIntegerArray values;

    public IntArrayValueStore(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        this.values = new AtomicIntegerArray(size);
    }

    @Override
    public int size() {
        return values.length();
    }

    @Override
    public Integer get(int index) {
        return values.get(index);
    }

    public int getInt(int index) {
        return values.get(index);
    }

    @Override
    public void set(int index, Integer value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        values.set(index, value);
    }
}
