package io.perfectdict.testutil;

import io.perfectdict.hash.SeededHashFamily;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Hash family whose endpoints are chosen by the test: each key maps to a fixed
 * {@code (h1, h2)} pair for a given vertex count, whatever the seed.
 */
public final class ScriptedHashFamily implements SeededHashFamily {

    private final String name;
    private final int vertexCount;
    private final Map<String, long[]> edges = new HashMap<>();

    public ScriptedHashFamily(String name, int vertexCount) {
        this.name = name;
        this.vertexCount = vertexCount;
    }

    public ScriptedHashFamily edge(String key, int u, int v) {
        edges.put(key, new long[]{u, v});
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long hash64(byte[] key, long seed) {
        long[] edge = edges.get(new String(key, StandardCharsets.UTF_8));
        if (edge == null) {
            return 0L;
        }
        return (bitsFor((int) edge[0]) << 32) | bitsFor((int) edge[1]);
    }

    // Smallest 32-bit value that multiply-shift reduces to the requested vertex.
    private long bitsFor(int vertex) {
        return ((((long) vertex) << 32) + vertexCount - 1) / vertexCount;
    }
}
