package io.perfectdict.storage;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Default value store: one volatile reference per slot.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Writes to distinct slots never interfere</li>
 *   <li>A completed {@link #set(int, Object)} is visible to every later {@link #get(int)}</li>
 *   <li>Read-modify-write on one slot needs external synchronization</li>
 * </ul>
 */
public final class AtomicValueStore<V> implements ValueStore<V> {

    private final AtomicReferenceArray<V> values;

    public AtomicValueStore(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        this.values = new AtomicReferenceArray<>(size);
    }

    @Override
    public int size() {
        return values.length();
    }

    @Override
    public V get(int index) {
        return values.get(index);
    }

    @Override
    public void set(int index, V value) {
        values.set(index, value);
    }

    /**
     * Atomically replace the value at {@code index} if it is still {@code expected}.
     */
    public boolean compareAndSet(int index, V expected, V value) {
        return values.compareAndSet(index, expected, value);
    }
}
