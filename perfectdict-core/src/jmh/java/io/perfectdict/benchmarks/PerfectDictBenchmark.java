package io.perfectdict.benchmarks;

import io.perfectdict.PerfectDict;
import io.perfectdict.core.KeyEncoders;
import io.perfectdict.core.PerfectDictConfiguration;
import io.perfectdict.hash.HashFamilies;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class PerfectDictBenchmark {

    @Param({"100000"})
    public int keyCount;

    @Param({"fnv1a-64", "murmur3-x64"})
    public String family;

    private Map<String, Integer> entries;
    private String[] keys;
    private PerfectDict<String, Integer> dict;
    private final AtomicInteger cursor = new AtomicInteger();

    @Setup(Level.Trial)
    public void setup() {
        entries = new LinkedHashMap<>();
        keys = new String[keyCount];
        for (int i = 0; i < keyCount; i++) {
            keys[i] = "key-" + i;
            entries.put(keys[i], i);
        }
        dict = build();
    }

    private PerfectDict<String, Integer> build() {
        return PerfectDict.<String, Integer>builder(KeyEncoders.utf8())
                .configuration(PerfectDictConfiguration.builder()
                        .hashFamily(HashFamilies.byName(family))
                        .build())
                .putAll(entries)
                .build();
    }

    @Benchmark
    public void get(Blackhole blackhole) {
        blackhole.consume(dict.get(nextKey()));
    }

    @Benchmark
    public void getOrDefaultAbsent(Blackhole blackhole) {
        blackhole.consume(dict.getOrDefault("absent-" + (cursor.getAndIncrement() & 0xFFFF), -1));
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void construct(Blackhole blackhole) {
        blackhole.consume(build());
    }

    // Group: 1 Writer + 4 Readers
    @Group("write1_read4")
    @GroupThreads(1)
    @Benchmark
    public void writer(Blackhole blackhole) {
        String key = nextKey();
        dict.set(key, key.length());
        blackhole.consume(key);
    }

    @Group("write1_read4")
    @GroupThreads(4)
    @Benchmark
    public void reader(Blackhole blackhole) {
        blackhole.consume(dict.get(nextKey()));
    }

    private String nextKey() {
        return keys[Math.floorMod(cursor.getAndIncrement(), keyCount)];
    }
}
