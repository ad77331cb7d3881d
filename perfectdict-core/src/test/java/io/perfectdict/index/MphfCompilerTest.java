package io.perfectdict.index;

import io.perfectdict.core.ConstructionExhaustedException;
import io.perfectdict.core.DuplicateKeyException;
import io.perfectdict.core.PerfectDictConfiguration;
import io.perfectdict.hash.HashFamilies;
import io.perfectdict.hash.SeededHashFamily;
import io.perfectdict.kernel.GraphFailure;
import io.perfectdict.logging.RecordingLoggerFactory;
import io.perfectdict.testutil.ScriptedHashFamily;
import io.perfectdict.testutil.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.event.Level;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MphfCompilerTest {

    @BeforeEach
    void clearLogs() {
        RecordingLoggerFactory.clear();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 10, 1_000, 50_000})
    void slotsAreABijectionOntoKeyRange(int keyCount) {
        List<byte[]> keys = TestKeys.encoded("key-", keyCount);

        CompiledMphf compiled = new MphfCompiler(PerfectDictConfiguration.defaults()).compile(keys);

        BitSet occupied = new BitSet(keyCount);
        for (byte[] key : keys) {
            int slot = compiled.function().slot(key);
            assertThat(slot).isBetween(0, keyCount - 1);
            assertThat(occupied.get(slot)).as("slot %d taken twice", slot).isFalse();
            occupied.set(slot);
        }
        assertThat(occupied.cardinality()).isEqualTo(keyCount);
    }

    @Test
    void slotsMatchEvaluatorForEveryInputPosition() {
        List<byte[]> keys = TestKeys.encoded("user:", 500);
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .verifyConstruction(false)
                .build();

        CompiledMphf compiled = new MphfCompiler(configuration).compile(keys);

        for (int i = 0; i < keys.size(); i++) {
            assertThat(compiled.function().slot(keys.get(i))).isEqualTo(compiled.slots()[i]);
        }
    }

    @Test
    void worksWithMurmurFamily() {
        List<byte[]> keys = TestKeys.encoded("m-", 2_000);
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .hashFamily(HashFamilies.murmur3())
                .build();

        CompiledMphf compiled = new MphfCompiler(configuration).compile(keys);

        assertThat(compiled.function().family().name()).isEqualTo("murmur3-x64");
        assertThat(compiled.size()).isEqualTo(2_000);
    }

    @Test
    void recordsFingerprintAtEverySlot() {
        List<byte[]> keys = TestKeys.encoded("fp-", 300);

        CompiledMphf compiled = new MphfCompiler(PerfectDictConfiguration.defaults()).compile(keys);

        for (int i = 0; i < keys.size(); i++) {
            assertThat(compiled.fingerprints().matches(compiled.slots()[i], keys.get(i))).isTrue();
        }
        assertThat(compiled.fingerprints().bits()).isEqualTo(16);
    }

    @Test
    void compilingTwiceGivesIdenticalTables() {
        List<byte[]> keys = TestKeys.encoded("key-", 5_000);
        MphfCompiler compiler = new MphfCompiler(PerfectDictConfiguration.defaults());

        CompiledMphf first = compiler.compile(keys);
        CompiledMphf second = compiler.compile(keys);

        assertThat(first.function().seed()).isEqualTo(second.function().seed());
        assertThat(first.function().labels()).containsExactly(second.function().labels());
        assertThat(first.fingerprints().digests()).containsExactly(second.fingerprints().digests());
        assertThat(first.slots()).containsExactly(second.slots());
    }

    @Test
    void statsDescribeAcceptedAttempt() {
        List<byte[]> keys = TestKeys.encoded("key-", 10_000);
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .initialSeed(100L)
                .build();

        ConstructionStats stats = new MphfCompiler(configuration).compile(keys).stats();

        assertThat(stats.keyCount()).isEqualTo(10_000);
        assertThat(stats.vertexCount()).isEqualTo(25_000);
        assertThat(stats.seed()).isEqualTo(100L + stats.attempts() - 1);
        int rejected = stats.failures().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(rejected).isEqualTo(stats.attempts() - 1);
        assertThat(stats.componentCount()).isPositive();
    }

    @Test
    void emptyKeySetCompilesToEmptyFunction() {
        CompiledMphf compiled = new MphfCompiler(PerfectDictConfiguration.defaults()).compile(List.of());

        assertThat(compiled.size()).isZero();
        assertThat(compiled.function().vertexCount()).isEqualTo(2);
    }

    @Test
    void duplicateKeyFailsBeforeAnyHashing() {
        AtomicInteger hashCalls = new AtomicInteger();
        SeededHashFamily counting = new SeededHashFamily() {
            @Override
            public String name() {
                return "counting";
            }

            @Override
            public long hash64(byte[] key, long seed) {
                hashCalls.incrementAndGet();
                return HashFamilies.fnv1a().hash64(key, seed);
            }
        };
        List<byte[]> keys = new ArrayList<>(TestKeys.encoded("key-", 10));
        keys.add("key-3".getBytes(StandardCharsets.UTF_8));
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .hashFamily(counting)
                .build();

        assertThatThrownBy(() -> new MphfCompiler(configuration).compile(keys))
                .isInstanceOfSatisfying(DuplicateKeyException.class, e -> {
                    assertThat(e.firstIndex()).isEqualTo(3);
                    assertThat(e.duplicateIndex()).isEqualTo(10);
                });
        assertThat(hashCalls).hasValue(0);
    }

    @Test
    void exhaustedRetryBudgetFailsLoudly() {
        ScriptedHashFamily alwaysLoops = new ScriptedHashFamily("loops", 5)
                .edge("a", 1, 1)
                .edge("b", 2, 3);
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .hashFamily(alwaysLoops)
                .maxAttempts(4)
                .build();
        List<byte[]> keys = List.of(bytes("a"), bytes("b"));

        assertThatThrownBy(() -> new MphfCompiler(configuration).compile(keys))
                .isInstanceOfSatisfying(ConstructionExhaustedException.class, e -> {
                    assertThat(e.attempts()).isEqualTo(4);
                    assertThat(e.loadFactor()).isEqualTo(2.5);
                    assertThat(e.failures()).isEqualTo(Map.of(GraphFailure.SELF_LOOP.name(), 4));
                })
                .hasMessageContaining("retry with a larger loadFactor");

        assertThat(RecordingLoggerFactory.events(MphfCompiler.class, Level.DEBUG)).hasSize(4);
        assertThat(RecordingLoggerFactory.events(MphfCompiler.class, Level.WARN))
                .singleElement()
                .satisfies(event -> assertThat(event.message()).contains("after 4 attempts"));
    }

    @Test
    void loadFactorBelowTwoExhaustsOnLargeKeySets() {
        PerfectDictConfiguration configuration = PerfectDictConfiguration.builder()
                .loadFactor(1.5)
                .maxAttempts(3)
                .build();

        assertThatThrownBy(() -> new MphfCompiler(configuration).compile(TestKeys.encoded("key-", 5_000)))
                .isInstanceOf(ConstructionExhaustedException.class);
    }

    @Test
    void successIsLoggedAtInfo() {
        new MphfCompiler(PerfectDictConfiguration.defaults()).compile(TestKeys.encoded("key-", 100));

        assertThat(RecordingLoggerFactory.events(MphfCompiler.class, Level.INFO))
                .singleElement()
                .satisfies(event -> assertThat(event.message()).startsWith("Built perfect hash for 100 keys"));
    }

    @Test
    void rejectsNullKey() {
        List<byte[]> keys = new ArrayList<>();
        keys.add(null);

        assertThatThrownBy(() -> new MphfCompiler(PerfectDictConfiguration.defaults()).compile(keys))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
