package io.perfectdict.core;

import io.perfectdict.hash.HashFamilies;
import io.perfectdict.hash.SeededHashFamily;

/**
 * Immutable configuration for building a perfect dictionary.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * PerfectDictConfiguration config = PerfectDictConfiguration.builder()
 *     .loadFactor(3.0)
 *     .fingerprintBits(16)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class PerfectDictConfiguration {

    public static final double DEFAULT_LOAD_FACTOR = 2.5;
    public static final int DEFAULT_FINGERPRINT_BITS = 16;
    public static final int DEFAULT_MAX_ATTEMPTS = 50;
    public static final long DEFAULT_INITIAL_SEED = 0L;
    public static final int MAX_FINGERPRINT_BITS = 32;

    private static final PerfectDictConfiguration DEFAULTS = builder().build();

    // Construction graph sizing
    private final double loadFactor;

    // Seed search
    private final int maxAttempts;
    private final long initialSeed;
    private final SeededHashFamily hashFamily;

    // Membership filtering
    private final int fingerprintBits;

    private final boolean verifyConstruction;

    private PerfectDictConfiguration(Builder builder) {
        this.loadFactor = builder.loadFactor;
        this.maxAttempts = builder.maxAttempts;
        this.initialSeed = builder.initialSeed;
        this.hashFamily = builder.hashFamily;
        this.fingerprintBits = builder.fingerprintBits;
        this.verifyConstruction = builder.verifyConstruction;
    }

    /**
     * Create a new builder for PerfectDictConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static PerfectDictConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Ratio of graph vertices to keys ({@code c}). Larger values raise the
     * per-attempt success probability and the size of the label table.
     *
     * @return load factor, always greater than 1
     */
    public double loadFactor() {
        return loadFactor;
    }

    /**
     * Get the number of seeds tried before construction gives up.
     *
     * @return retry budget
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * First seed tried; attempt {@code i} uses {@code initialSeed + i}.
     */
    public long initialSeed() {
        return initialSeed;
    }

    public SeededHashFamily hashFamily() {
        return hashFamily;
    }

    /**
     * Width of the per-slot fingerprint.
     *
     * @return bits per fingerprint, 0 when fingerprinting is disabled
     */
    public int fingerprintBits() {
        return fingerprintBits;
    }

    public boolean fingerprintingEnabled() {
        return fingerprintBits > 0;
    }

    /**
     * Check whether every key is re-evaluated after construction to confirm the
     * function is a bijection.
     *
     * @return true if verification is enabled (default: true)
     */
    public boolean verifyConstruction() {
        return verifyConstruction;
    }

    /**
     * Number of graph vertices used for {@code keyCount} keys.
     */
    public int vertexCount(int keyCount) {
        double vertices = Math.ceil(loadFactor * keyCount);
        if (vertices > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("too many keys for loadFactor " + loadFactor + ": " + keyCount);
        }
        return Math.max(2, (int) vertices);
    }

    public Builder toBuilder() {
        return new Builder()
                .loadFactor(loadFactor)
                .maxAttempts(maxAttempts)
                .initialSeed(initialSeed)
                .hashFamily(hashFamily)
                .fingerprintBits(fingerprintBits)
                .verifyConstruction(verifyConstruction);
    }

    @Override
    public String toString() {
        return "PerfectDictConfiguration{loadFactor=" + loadFactor
                + ", maxAttempts=" + maxAttempts
                + ", initialSeed=" + initialSeed
                + ", hashFamily=" + hashFamily.name()
                + ", fingerprintBits=" + fingerprintBits
                + ", verifyConstruction=" + verifyConstruction + "}";
    }

    /**
     * Builder for PerfectDictConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private double loadFactor = DEFAULT_LOAD_FACTOR;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long initialSeed = DEFAULT_INITIAL_SEED;
        private SeededHashFamily hashFamily = HashFamilies.defaultFamily();
        private int fingerprintBits = DEFAULT_FINGERPRINT_BITS;
        private boolean verifyConstruction = true;

        private Builder() {
        }

        /**
         * Set the vertex-to-key ratio of the construction graph.
         *
         * @param loadFactor the ratio, must be greater than 1
         * @return this builder for method chaining
         */
        public Builder loadFactor(double loadFactor) {
            this.loadFactor = loadFactor;
            return this;
        }

        /**
         * Set the number of seeds tried before giving up.
         *
         * @param maxAttempts the retry budget, at least 1
         * @return this builder for method chaining
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialSeed(long initialSeed) {
            this.initialSeed = initialSeed;
            return this;
        }

        public Builder hashFamily(SeededHashFamily hashFamily) {
            this.hashFamily = hashFamily;
            return this;
        }

        /**
         * Set the fingerprint width in bits; 0 disables fingerprinting.
         *
         * @param fingerprintBits width between 0 and 32
         * @return this builder for method chaining
         */
        public Builder fingerprintBits(int fingerprintBits) {
            this.fingerprintBits = fingerprintBits;
            return this;
        }

        public Builder disableFingerprints() {
            this.fingerprintBits = 0;
            return this;
        }

        public Builder verifyConstruction(boolean verifyConstruction) {
            this.verifyConstruction = verifyConstruction;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return a new immutable PerfectDictConfiguration
         * @throws IllegalArgumentException if a setting is out of range
         */
        public PerfectDictConfiguration build() {
            if (!(loadFactor > 1.0) || Double.isInfinite(loadFactor)) {
                throw new IllegalArgumentException("loadFactor must be a finite value greater than 1: " + loadFactor);
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
            }
            if (hashFamily == null) {
                throw new IllegalArgumentException("hashFamily required");
            }
            if (fingerprintBits < 0 || fingerprintBits > MAX_FINGERPRINT_BITS) {
                throw new IllegalArgumentException("fingerprintBits must be between 0 and "
                        + MAX_FINGERPRINT_BITS + ": " + fingerprintBits);
            }
            return new PerfectDictConfiguration(this);
        }
    }
}
