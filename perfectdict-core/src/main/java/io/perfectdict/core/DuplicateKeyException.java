package io.perfectdict.core;

/**
 * Thrown when the build input contains the same key twice.
 * <p>
 * Raised before any perfect-hash work starts; the positions refer to the
 * order in which entries were added to the builder.
 */
public class DuplicateKeyException extends PerfectDictException {

    private final int firstIndex;
    private final int duplicateIndex;

    public DuplicateKeyException(int firstIndex, int duplicateIndex) {
        super("duplicate key at input position " + duplicateIndex
                + " (first seen at position " + firstIndex + ")");
        this.firstIndex = firstIndex;
        this.duplicateIndex = duplicateIndex;
    }

    public int firstIndex() {
        return firstIndex;
    }

    public int duplicateIndex() {
        return duplicateIndex;
    }
}
