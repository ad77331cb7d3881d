package io.perfectdict.core;

/**
 * Thrown when a lookup is rejected: the key's fingerprint does not match the
 * one recorded for its slot, or the dictionary has no slots at all.
 */
public class MissingKeyException extends PerfectDictException {

    private final int slot;

    public MissingKeyException(int slot) {
        super("key not present (fingerprint mismatch at slot " + slot + ")");
        this.slot = slot;
    }

    public MissingKeyException(String message) {
        super(message);
        this.slot = -1;
    }

    /**
     * Slot the rejected key hashed to, or -1 when no slot exists.
     */
    public int slot() {
        return slot;
    }
}
