package io.perfectdict;

import io.perfectdict.testutil.TestKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PerfectDictConcurrencyTest {

    private static final int KEYS = 10_000;

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void writersOnDisjointKeysNeverInterfere() throws Exception {
        PerfectDict<String, Integer> dict = PerfectDict.of(TestKeys.indexed("key-", KEYS));
        int writerCount = 8;
        ExecutorService writers = Executors.newFixedThreadPool(writerCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int w = 0; w < writerCount; w++) {
                int writer = w;
                futures.add(writers.submit(() -> {
                    startLatch.await();
                    for (int i = writer; i < KEYS; i += writerCount) {
                        dict.set("key-" + i, i + 1_000_000);
                    }
                    return null;
                }));
            }
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            writers.shutdownNow();
        }

        for (int i = 0; i < KEYS; i++) {
            assertThat(dict.get("key-" + i)).isEqualTo(i + 1_000_000);
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void readersSeeEitherOldOrNewValue() throws Exception {
        PerfectDict<String, Integer> dict = PerfectDict.of(TestKeys.indexed("key-", KEYS));
        int readerCount = 4;
        ExecutorService pool = Executors.newFixedThreadPool(readerCount + 1);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger torn = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            futures.add(pool.submit(() -> {
                startLatch.await();
                for (int i = 0; i < KEYS; i++) {
                    dict.set("key-" + i, -i);
                }
                return null;
            }));
            for (int r = 0; r < readerCount; r++) {
                futures.add(pool.submit(() -> {
                    startLatch.await();
                    for (int pass = 0; pass < 5; pass++) {
                        for (int i = 0; i < KEYS; i++) {
                            int value = dict.get("key-" + i);
                            if (value != i && value != -i) {
                                torn.incrementAndGet();
                            }
                        }
                        int count = 0;
                        for (Integer ignored : dict) {
                            count++;
                        }
                        if (count != KEYS) {
                            torn.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(torn).hasValue(0);
    }
}
