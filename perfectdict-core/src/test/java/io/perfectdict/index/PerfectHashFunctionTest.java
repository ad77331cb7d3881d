package io.perfectdict.index;

import io.perfectdict.hash.HashFamilies;
import io.perfectdict.kernel.Assignment;
import io.perfectdict.testutil.ScriptedHashFamily;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerfectHashFunctionTest {

    private final ScriptedHashFamily family = new ScriptedHashFamily("scripted", 4)
            .edge("x", 0, 1)
            .edge("y", 1, 2)
            .edge("z", 3, 0);

    @Test
    void slotIsSumOfEndpointLabelsModuloSize() {
        PerfectHashFunction function = PerfectHashFunction.fromLabels(family, 0L, 3, new int[]{-1, 2, 1, -1});

        assertThat(function.slot(bytes("x"))).isEqualTo(2);
        assertThat(function.slot(bytes("y"))).isZero();
    }

    @Test
    void unassignedVerticesEvaluateAsZero() {
        PerfectHashFunction function = PerfectHashFunction.fromLabels(family, 0L, 3, new int[]{-1, 2, 1, -1});

        assertThat(function.slot(bytes("z"))).isZero();
        assertThat(function.labelAt(0)).isEqualTo(Assignment.UNASSIGNED);
        assertThat(function.labelAt(1)).isEqualTo(2);
    }

    @Test
    void labelsRoundTripThroughPackedTable() {
        int[] labels = {-1, 2, 1, -1};
        PerfectHashFunction function = PerfectHashFunction.fromLabels(family, 0L, 3, labels);

        assertThat(function.labels()).containsExactly(labels);
        assertThat(function.bitsPerLabel()).isEqualTo(2);
        assertThat(function.vertexCount()).isEqualTo(4);
    }

    @Test
    void slotDoesNotOverflowNearIntegerLimit() {
        ScriptedHashFamily wide = new ScriptedHashFamily("wide", 2).edge("k", 0, 1);
        int n = Integer.MAX_VALUE;
        PerfectHashFunction function = PerfectHashFunction.fromLabels(wide, 0L, n, new int[]{n - 2, n - 3});

        assertThat(function.slot(bytes("k"))).isEqualTo(n - 5);
    }

    @Test
    void anyKeyMapsIntoRange() {
        PerfectHashFunction function = PerfectHashFunction.fromLabels(
                HashFamilies.fnv1a(), 1L, 5, new int[]{0, 1, 2, 3, 4, -1, 0, 2, 4, 1, 3});

        for (int i = 0; i < 1_000; i++) {
            assertThat(function.slot(bytes("probe-" + i))).isBetween(0, 4);
        }
    }

    @Test
    void emptyFunctionHasNoSlots() {
        PerfectHashFunction function = PerfectHashFunction.fromLabels(HashFamilies.fnv1a(), 0L, 0, new int[]{-1, -1});

        assertThatThrownBy(() -> function.slot(bytes("anything")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(function.bitsPerKey()).isZero();
    }

    @Test
    void rejectsLabelOutsideKeyRange() {
        assertThatThrownBy(() -> PerfectHashFunction.fromLabels(family, 0L, 3, new int[]{0, 3, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vertex 1");
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
