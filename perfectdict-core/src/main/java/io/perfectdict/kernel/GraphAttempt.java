package io.perfectdict.kernel;

/**
 * Outcome of building the key graph for one seed.
 */
public sealed interface GraphAttempt permits GraphAttempt.Accepted, GraphAttempt.Rejected {

    long seed();

    record Accepted(long seed, KeyGraph graph) implements GraphAttempt {
        public Accepted {
            if (graph == null) {
                throw new IllegalArgumentException("graph required");
            }
        }
    }

    record Rejected(long seed, GraphFailure failure) implements GraphAttempt {
        public Rejected {
            if (failure == null) {
                throw new IllegalArgumentException("failure required");
            }
        }
    }
}
