package io.perfectdict.storage;

/**
 * Fixed-length, index-addressed value storage backing a perfect dictionary.
 * <p>
 * Implementations never grow or shrink. Writes to different indexes must not
 * interfere with each other.
 *
 * @param <V> value type
 */
public interface ValueStore<V> {

    int size();

    V get(int index);

    void set(int index, V value);
}
