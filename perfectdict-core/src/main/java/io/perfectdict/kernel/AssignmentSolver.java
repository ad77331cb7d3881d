package io.perfectdict.kernel;

import java.util.Arrays;

/**
 * Labels the vertices of an acyclic key graph so that, for every edge
 * {@code e = (u, v)}, {@code (g[u] + g[v]) mod n} is the rank of {@code e}.
 * <p>
 * Components are visited in order of their smallest vertex id. Each component
 * owns the contiguous rank range {@code [base, base + edges)}; inside it, ranks
 * are handed out in breadth-first discovery order starting from the root
 * ({@code g[root] = 0}). The result depends only on the graph, so the same
 * seed always yields the same labels.
 */
public final class AssignmentSolver {

    private AssignmentSolver() {
    }

    public static Assignment solve(KeyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph required");
        }
        int vertexCount = graph.vertexCount();
        int keyCount = graph.edgeCount();
        int[] labels = new int[vertexCount];
        int[] ranks = new int[keyCount];
        Arrays.fill(labels, Assignment.UNASSIGNED);
        Arrays.fill(ranks, -1);

        int[] queue = new int[vertexCount];
        int base = 0;
        int components = 0;

        for (int root = 0; root < vertexCount; root++) {
            if (labels[root] != Assignment.UNASSIGNED || graph.firstArc(root) == KeyGraph.NO_ARC) {
                continue;
            }
            labels[root] = 0;
            int local = 0;
            int headIndex = 0;
            int tailIndex = 0;
            queue[tailIndex++] = root;

            while (headIndex < tailIndex) {
                int u = queue[headIndex++];
                for (int arc = graph.firstArc(u); arc != KeyGraph.NO_ARC; arc = graph.nextArc(arc)) {
                    int v = graph.arcTarget(arc);
                    if (labels[v] != Assignment.UNASSIGNED) {
                        continue;
                    }
                    int rank = base + local++;
                    ranks[KeyGraph.arcEdge(arc)] = rank;
                    labels[v] = Math.floorMod(rank - labels[u], keyCount);
                    queue[tailIndex++] = v;
                }
            }

            base += local;
            components++;
        }

        if (base != keyCount) {
            throw new IllegalStateException("key graph is not a forest: ranked " + base + " of " + keyCount + " edges");
        }
        return new Assignment(keyCount, labels, ranks, components);
    }
}
