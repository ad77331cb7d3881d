package io.perfectdict.core;

import java.util.Collections;
import java.util.Map;

/**
 * Thrown when no seed within the retry budget produced an acyclic key graph.
 * <p>
 * Retrying with a larger load factor lowers the chance of self-loops,
 * duplicate edges and cycles.
 */
public class ConstructionExhaustedException extends PerfectDictException {

    private final int attempts;
    private final double loadFactor;
    private final Map<String, Integer> failures;

    public ConstructionExhaustedException(int keyCount, int attempts, double loadFactor,
                                          Map<String, Integer> failures) {
        super("no perfect hash found for " + keyCount + " keys after " + attempts
                + " attempts (loadFactor=" + loadFactor + ", failures=" + failures
                + "); retry with a larger loadFactor");
        this.attempts = attempts;
        this.loadFactor = loadFactor;
        this.failures = Collections.unmodifiableMap(failures);
    }

    public int attempts() {
        return attempts;
    }

    public double loadFactor() {
        return loadFactor;
    }

    /**
     * Number of rejected attempts per failure kind.
     */
    public Map<String, Integer> failures() {
        return failures;
    }
}
