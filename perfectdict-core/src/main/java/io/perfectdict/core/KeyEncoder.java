package io.perfectdict.core;

/**
 * Turns a caller key into the byte sequence the hash family consumes.
 * <p>
 * Two keys are the same key exactly when their encodings are equal, so an
 * encoder must be deterministic and must not depend on identity.
 *
 * @param <K> caller key type
 */
@FunctionalInterface
public interface KeyEncoder<K> {

    byte[] encode(K key);
}
