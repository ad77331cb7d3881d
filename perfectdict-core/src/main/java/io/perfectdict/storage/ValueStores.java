package io.perfectdict.storage;

import java.util.ArrayList;
import java.util.List;

public final class ValueStores {

    private ValueStores() {
    }

    public static <V> ValueStore<V> atomic(int size) {
        return new AtomicValueStore<>(size);
    }

    public static ValueStore<Integer> ints(int size) {
        return new IntArrayValueStore(size);
    }

    /**
     * Wrap {@code store} so that every write throws {@link UnsupportedOperationException}.
     */
    public static <V> ValueStore<V> readOnly(ValueStore<V> store) {
        if (store == null) {
            throw new IllegalArgumentException("store required");
        }
        if (store instanceof ReadOnlyValueStore) {
            return store;
        }
        return new ReadOnlyValueStore<>(store);
    }

    public static boolean isReadOnly(ValueStore<?> store) {
        return store instanceof ReadOnlyValueStore;
    }

    /**
     * Copy the slots of {@code store}, in order, into a new list.
     * The list may contain {@code null}.
     */
    public static <V> List<V> toList(ValueStore<V> store) {
        ArrayList<V> out = new ArrayList<>(store.size());
        for (int i = 0; i < store.size(); i++) {
            out.add(store.get(i));
        }
        return out;
    }
}
