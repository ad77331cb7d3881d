package io.perfectdict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The durable state of a {@link PerfectDict} as plain ordered arrays.
 * <p>
 * Serialization is left to the caller; every field is a primitive, a string,
 * an {@code int[]} or a list, so any format that round-trips those will do.
 *
 * @param hashFamily      name of the hash family the function was built with
 * @param seed            accepted construction seed
 * @param size            number of slots, {@code n}
 * @param labels          label per vertex, {@code -1} for vertices no key touched
 * @param fingerprintBits digest width, 0 when fingerprinting is disabled
 * @param fingerprints    digest per slot, empty when fingerprinting is disabled
 * @param values          value per slot, in slot order
 * @param <V>             value type
 */
public record PerfectDictSnapshot<V>(String hashFamily,
                                     long seed,
                                     int size,
                                     int[] labels,
                                     int fingerprintBits,
                                     int[] fingerprints,
                                     List<V> values) {

    public PerfectDictSnapshot {
        if (hashFamily == null) {
            throw new IllegalArgumentException("hashFamily required");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (labels == null || labels.length < 2) {
            throw new IllegalArgumentException("labels must cover at least 2 vertices");
        }
        if (fingerprintBits < 0 || fingerprintBits > 32) {
            throw new IllegalArgumentException("fingerprintBits must be between 0 and 32: " + fingerprintBits);
        }
        if (fingerprints == null) {
            throw new IllegalArgumentException("fingerprints required");
        }
        int expectedFingerprints = fingerprintBits == 0 ? 0 : size;
        if (fingerprints.length != expectedFingerprints) {
            throw new IllegalArgumentException("expected " + expectedFingerprints + " fingerprints, got "
                    + fingerprints.length);
        }
        if (values == null || values.size() != size) {
            throw new IllegalArgumentException("values must have exactly " + size + " entries");
        }
        labels = labels.clone();
        fingerprints = fingerprints.clone();
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public int[] labels() {
        return labels.clone();
    }

    @Override
    public int[] fingerprints() {
        return fingerprints.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PerfectDictSnapshot<?> other)) {
            return false;
        }
        return seed == other.seed
                && size == other.size
                && fingerprintBits == other.fingerprintBits
                && hashFamily.equals(other.hashFamily)
                && Arrays.equals(labels, other.labels)
                && Arrays.equals(fingerprints, other.fingerprints)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(hashFamily, seed, size, fingerprintBits, values);
        result = 31 * result + Arrays.hashCode(labels);
        return 31 * result + Arrays.hashCode(fingerprints);
    }

    @Override
    public String toString() {
        return "PerfectDictSnapshot{hashFamily=" + hashFamily
                + ", seed=" + seed
                + ", size=" + size
                + ", vertices=" + labels.length
                + ", fingerprintBits=" + fingerprintBits + "}";
    }
}
