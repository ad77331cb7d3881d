package io.perfectdict.index;

/**
 * Result of {@link MphfCompiler#compile(java.util.List)}.
 *
 * @param function     the perfect hash function
 * @param fingerprints digests of the build keys, indexed by slot
 * @param slots        slot of each input key, in input order
 * @param stats        construction summary
 */
public record CompiledMphf(PerfectHashFunction function,
                           FingerprintTable fingerprints,
                           int[] slots,
                           ConstructionStats stats) {

    public CompiledMphf {
        if (function == null) {
            throw new IllegalArgumentException("function required");
        }
        if (fingerprints == null) {
            throw new IllegalArgumentException("fingerprints required");
        }
        if (slots == null || slots.length != function.size()) {
            throw new IllegalArgumentException("slots must have one entry per key");
        }
    }

    public int size() {
        return function.size();
    }
}
