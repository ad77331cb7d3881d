package io.perfectdict.storage;

/**
 * View of another store that rejects writes.
 */
final class ReadOnlyValueStore<V> implements ValueStore<V> {

    private final ValueStore<V> delegate;

    ReadOnlyValueStore(ValueStore<V> delegate) {
        this.delegate = delegate;
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public V get(int index) {
        return delegate.get(index);
    }

    @Override
    public void set(int index, V value) {
        throw new UnsupportedOperationException("value store is read-only");
    }
}
