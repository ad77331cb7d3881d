package io.perfectdict;

import io.perfectdict.core.KeyEncoder;
import io.perfectdict.core.KeyEncoders;
import io.perfectdict.core.MissingKeyException;
import io.perfectdict.core.PerfectDictConfiguration;
import io.perfectdict.hash.HashFamilies;
import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.index.CompiledMphf;
import io.perfectdict.index.ConstructionStats;
import io.perfectdict.index.FingerprintTable;
import io.perfectdict.index.MphfCompiler;
import io.perfectdict.index.PerfectHashFunction;
import io.perfectdict.storage.AtomicValueStore;
import io.perfectdict.storage.ValueStore;
import io.perfectdict.storage.ValueStores;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Fixed-size key/value container whose key set is compiled into a minimal
 * perfect hash function and never stored.
 * <p>
 * Every key of the build set owns exactly one of {@code size()} slots. Lookups
 * hash the key, read two labels and index the value store.
 * <p>
 * <b>Membership:</b> with fingerprinting enabled, {@link #get(Object)} rejects
 * keys that were not part of the build set with a {@link MissingKeyException},
 * up to a false-positive rate of about {@code 2^-fingerprintBits}. With
 * fingerprinting disabled, an absent key silently returns the value of
 * whichever key owns its slot.
 * <p>
 * <b>Updates:</b> {@link #set(Object, Object)} overwrites the slot the key
 * hashes to without any check. Setting a key that was never built replaces the
 * value of another key. {@link #replace(Object, Object)} is the checked variant.
 * <p>
 * <b>Iteration</b> yields values only, in slot order.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Label and fingerprint tables are immutable</li>
 *   <li>Reads and iteration need no coordination</li>
 *   <li>Writes to different slots never interfere (default store)</li>
 *   <li>Concurrent writes to the same slot need external synchronization</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class PerfectDict<K, V> implements Iterable<V> {

    private final KeyEncoder<K> encoder;
    private final PerfectHashFunction function;
    private final FingerprintTable fingerprints;
    private final ValueStore<V> values;
    private final ConstructionStats stats;

    private PerfectDict(KeyEncoder<K> encoder,
                        PerfectHashFunction function,
                        FingerprintTable fingerprints,
                        ValueStore<V> values,
                        ConstructionStats stats) {
        this.encoder = encoder;
        this.function = function;
        this.fingerprints = fingerprints;
        this.values = values;
        this.stats = stats;
    }

    public static <K, V> Builder<K, V> builder(KeyEncoder<K> encoder) {
        return new Builder<>(encoder);
    }

    /**
     * Build a dictionary over string keys (UTF-8) with the default configuration.
     */
    public static <V> PerfectDict<String, V> of(Map<String, ? extends V> entries) {
        return PerfectDict.<String, V>builder(KeyEncoders.utf8())
                .putAll(entries)
                .build();
    }

    /**
     * Recreate a dictionary from a snapshot, resolving the hash family by name
     * among the built-in families.
     */
    public static <K, V> PerfectDict<K, V> restore(PerfectDictSnapshot<V> snapshot, KeyEncoder<K> encoder) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot required");
        }
        return restore(snapshot, encoder, HashFamilies.byName(snapshot.hashFamily()));
    }

    public static <K, V> PerfectDict<K, V> restore(PerfectDictSnapshot<V> snapshot,
                                                   KeyEncoder<K> encoder,
                                                   SeededHashFamily family) {
        return restore(snapshot, encoder, family, AtomicValueStore::new, UnaryOperator.identity());
    }

    /**
     * Recreate a dictionary from a snapshot with the same value store setup it
     * was built with, see {@link Builder#valueStore(IntFunction)} and
     * {@link Builder#finishValues(UnaryOperator)}.
     *
     * @throws IllegalStateException if the store or the finisher has the wrong size
     */
    public static <K, V> PerfectDict<K, V> restore(PerfectDictSnapshot<V> snapshot,
                                                   KeyEncoder<K> encoder,
                                                   SeededHashFamily family,
                                                   IntFunction<? extends ValueStore<V>> valueStoreFactory,
                                                   UnaryOperator<ValueStore<V>> finisher) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot required");
        }
        if (encoder == null) {
            throw new IllegalArgumentException("encoder required");
        }
        if (family == null) {
            throw new IllegalArgumentException("family required");
        }
        if (valueStoreFactory == null) {
            throw new IllegalArgumentException("valueStoreFactory required");
        }
        if (finisher == null) {
            throw new IllegalArgumentException("finisher required");
        }
        if (!family.name().equals(snapshot.hashFamily())) {
            throw new IllegalArgumentException("snapshot was built with " + snapshot.hashFamily()
                    + ", not " + family.name());
        }
        PerfectHashFunction function = PerfectHashFunction.fromLabels(
                family, snapshot.seed(), snapshot.size(), snapshot.labels());
        FingerprintTable fingerprints = FingerprintTable.restore(
                family, snapshot.seed(), snapshot.fingerprintBits(), snapshot.fingerprints());
        int size = snapshot.size();
        ValueStore<V> store = valueStoreFactory.apply(size);
        if (store == null || store.size() != size) {
            throw new IllegalStateException("value store must have exactly " + size + " slots");
        }
        List<V> snapshotValues = snapshot.values();
        for (int slot = 0; slot < size; slot++) {
            store.set(slot, snapshotValues.get(slot));
        }
        ValueStore<V> finished = finisher.apply(store);
        if (finished == null || finished.size() != size) {
            throw new IllegalStateException("finishValues changed the value store size");
        }
        ConstructionStats stats = ConstructionStats.restored(size, function.vertexCount(), snapshot.seed());
        return new PerfectDict<>(encoder, function, fingerprints, finished, stats);
    }

    /**
     * Value stored for {@code key}.
     *
     * @throws MissingKeyException if the fingerprint rejects the key, or the dictionary is empty
     */
    public V get(K key) {
        return values.get(checkedSlot(key));
    }

    /**
     * Like {@link #get(Object)}, but returns {@code defaultValue} instead of
     * throwing when the key is rejected.
     */
    public V getOrDefault(K key, V defaultValue) {
        byte[] bytes = encode(key);
        if (function.size() == 0) {
            return defaultValue;
        }
        int slot = function.slot(bytes);
        return fingerprints.matches(slot, bytes) ? values.get(slot) : defaultValue;
    }

    /**
     * Membership test through the fingerprint table. Always {@code true} for a
     * non-empty dictionary without fingerprints.
     */
    public boolean containsKey(K key) {
        byte[] bytes = encode(key);
        return function.size() > 0 && fingerprints.matches(function.slot(bytes), bytes);
    }

    /**
     * Overwrite the slot {@code key} hashes to. No membership check is made and
     * fingerprints are left untouched: for a key outside the build set this
     * replaces the value of the key that owns the slot.
     *
     * @throws MissingKeyException if the dictionary is empty
     */
    public void set(K key, V value) {
        values.set(slotFor(encode(key)), value);
    }

    /**
     * Overwrite the value of {@code key} only if the fingerprint accepts it.
     *
     * @throws MissingKeyException if the fingerprint rejects the key, or the dictionary is empty
     */
    public void replace(K key, V value) {
        values.set(checkedSlot(key), value);
    }

    /**
     * Slot {@code key} hashes to. Meaningful only for keys of the build set.
     */
    public int slotOf(K key) {
        return slotFor(encode(key));
    }

    public int size() {
        return function.size();
    }

    public boolean isEmpty() {
        return function.size() == 0;
    }

    /**
     * Iterate over the values in slot order. Each call starts a new pass.
     */
    @Override
    public Iterator<V> iterator() {
        return new Iterator<>() {
            private int slot;

            @Override
            public boolean hasNext() {
                return slot < values.size();
            }

            @Override
            public V next() {
                if (slot >= values.size()) {
                    throw new NoSuchElementException();
                }
                return values.get(slot++);
            }
        };
    }

    public Stream<V> stream() {
        return IntStream.range(0, values.size()).mapToObj(values::get);
    }

    /**
     * Read-only live view of the values in slot order.
     */
    public List<V> values() {
        return new AbstractList<>() {
            @Override
            public V get(int index) {
                return values.get(index);
            }

            @Override
            public int size() {
                return values.size();
            }
        };
    }

    public int fingerprintBits() {
        return fingerprints.bits();
    }

    /**
     * Chance that {@link #get(Object)} accepts a key outside the build set.
     */
    public double falsePositiveRate() {
        return fingerprints.falsePositiveRate();
    }

    public ConstructionStats constructionStats() {
        return stats;
    }

    public PerfectHashFunction hashFunction() {
        return function;
    }

    public boolean isReadOnly() {
        return ValueStores.isReadOnly(values);
    }

    /**
     * Export the label table, fingerprints and a copy of the current values.
     */
    public PerfectDictSnapshot<V> snapshot() {
        return new PerfectDictSnapshot<>(
                function.family().name(),
                function.seed(),
                function.size(),
                function.labels(),
                fingerprints.bits(),
                fingerprints.digests(),
                ValueStores.toList(values));
    }

    private int checkedSlot(K key) {
        byte[] bytes = encode(key);
        int slot = slotFor(bytes);
        if (!fingerprints.matches(slot, bytes)) {
            throw new MissingKeyException(slot);
        }
        return slot;
    }

    private int slotFor(byte[] bytes) {
        if (function.size() == 0) {
            throw new MissingKeyException("dictionary is empty");
        }
        return function.slot(bytes);
    }

    private byte[] encode(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        return encoder.encode(key);
    }

    @Override
    public String toString() {
        return "PerfectDict{size=" + function.size()
                + ", fingerprintBits=" + fingerprints.bits()
                + ", seed=" + function.seed() + "}";
    }

    /**
     * Collects entries and compiles them into a {@link PerfectDict}.
     * <p>
     * Keys are encoded when added and discarded by {@link #build()}, which
     * leaves the builder empty.
     */
    public static final class Builder<K, V> {
        private final KeyEncoder<K> encoder;
        private final List<byte[]> keys = new ArrayList<>();
        private final List<V> entryValues = new ArrayList<>();
        private PerfectDictConfiguration configuration = PerfectDictConfiguration.defaults();
        private IntFunction<? extends ValueStore<V>> valueStoreFactory = AtomicValueStore::new;
        private UnaryOperator<ValueStore<V>> finisher = UnaryOperator.identity();

        private Builder(KeyEncoder<K> encoder) {
            if (encoder == null) {
                throw new IllegalArgumentException("encoder required");
            }
            this.encoder = encoder;
        }

        public Builder<K, V> put(K key, V value) {
            if (key == null) {
                throw new IllegalArgumentException("key required");
            }
            byte[] bytes = encoder.encode(key);
            if (bytes == null) {
                throw new IllegalArgumentException("encoder returned null for key at position " + keys.size());
            }
            // identity encoders hand back the caller's array, which is held until build()
            if ((Object) bytes == key) {
                bytes = bytes.clone();
            }
            keys.add(bytes);
            entryValues.add(value);
            return this;
        }

        public Builder<K, V> putAll(Map<? extends K, ? extends V> entries) {
            if (entries == null) {
                throw new IllegalArgumentException("entries required");
            }
            entries.forEach(this::put);
            return this;
        }

        public Builder<K, V> putAll(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
            if (entries == null) {
                throw new IllegalArgumentException("entries required");
            }
            for (Map.Entry<? extends K, ? extends V> entry : entries) {
                put(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder<K, V> configuration(PerfectDictConfiguration configuration) {
            if (configuration == null) {
                throw new IllegalArgumentException("configuration required");
            }
            this.configuration = configuration;
            return this;
        }

        /**
         * Choose the store that holds the values; called once with the key count.
         */
        public Builder<K, V> valueStore(IntFunction<? extends ValueStore<V>> valueStoreFactory) {
            if (valueStoreFactory == null) {
                throw new IllegalArgumentException("valueStoreFactory required");
            }
            this.valueStoreFactory = valueStoreFactory;
            return this;
        }

        /**
         * Post-process the filled value store, for example with
         * {@link ValueStores#readOnly(ValueStore)}. The result must keep the same size.
         */
        public Builder<K, V> finishValues(UnaryOperator<ValueStore<V>> finisher) {
            if (finisher == null) {
                throw new IllegalArgumentException("finisher required");
            }
            this.finisher = finisher;
            return this;
        }

        public int size() {
            return keys.size();
        }

        /**
         * Compile the collected keys.
         *
         * @throws io.perfectdict.core.DuplicateKeyException          if a key was added twice
         * @throws io.perfectdict.core.ConstructionExhaustedException if no seed in the budget works
         */
        public PerfectDict<K, V> build() {
            CompiledMphf compiled = new MphfCompiler(configuration).compile(keys);
            int size = compiled.size();

            ValueStore<V> store = valueStoreFactory.apply(size);
            if (store == null || store.size() != size) {
                throw new IllegalStateException("value store must have exactly " + size + " slots");
            }
            int[] slots = compiled.slots();
            for (int i = 0; i < size; i++) {
                store.set(slots[i], entryValues.get(i));
            }
            ValueStore<V> finished = finisher.apply(store);
            if (finished == null || finished.size() != size) {
                throw new IllegalStateException("finishValues changed the value store size");
            }

            keys.clear();
            entryValues.clear();
            return new PerfectDict<>(encoder, compiled.function(), compiled.fingerprints(), finished,
                    compiled.stats());
        }
    }
}
