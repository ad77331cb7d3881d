package io.perfectdict.hash;

/**
 * Lookup of the built-in hash families by {@link SeededHashFamily#name()}.
 */
public final class HashFamilies {

    private static final SeededHashFamily FNV1A = new Fnv1aHashFamily();
    private static final SeededHashFamily MURMUR3 = new Murmur3HashFamily();

    private HashFamilies() {
    }

    public static SeededHashFamily defaultFamily() {
        return FNV1A;
    }

    public static SeededHashFamily fnv1a() {
        return FNV1A;
    }

    public static SeededHashFamily murmur3() {
        return MURMUR3;
    }

    public static SeededHashFamily byName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        return switch (name) {
            case Fnv1aHashFamily.NAME -> FNV1A;
            case Murmur3HashFamily.NAME -> MURMUR3;
            default -> throw new IllegalArgumentException("unknown hash family: " + name);
        };
    }
}
