package com.phillippitts.callbridge.service.registry;

import com.phillippitts.callbridge.domain.Call;
import com.phillippitts.callbridge.domain.LifecycleStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CallRegistryTest {

    private CallRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CallRegistry();
    }

    private static Call call(String id) {
        return Call.incoming(id, "15551234567", Instant.now());
    }

    @Test
    void insertIfAbsentKeepsFirstRecord() {
        assertThat(registry.insertIfAbsent(call("c1"))).isTrue();
        assertThat(registry.insertIfAbsent(Call.incoming("c1", "other", Instant.now()))).isFalse();

        assertThat(registry.get("c1").orElseThrow().callerIdentifier()).isEqualTo("15551234567");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void updateIgnoresUntrackedCall() {
        assertThat(registry.update("nobody", c -> c.withStage(LifecycleStage.ACTIVE))).isEmpty();
        assertThat(registry.contains("nobody")).isFalse();
    }

    @Test
    void removeIsIdempotent() {
        registry.insertIfAbsent(call("c1"));

        assertThat(registry.remove("c1")).isPresent();
        assertThat(registry.remove("c1")).isEmpty();
        assertThat(registry.remove(null)).isEmpty();
    }

    @Test
    void compareAndSetGreetedRequiresExpectedValue() {
        registry.insertIfAbsent(call("c1"));

        assertThat(registry.compareAndSetGreeted("c1", true, false)).isFalse();
        assertThat(registry.compareAndSetGreeted("c1", false, true)).isTrue();
        assertThat(registry.compareAndSetGreeted("c1", false, true)).isFalse();
        assertThat(registry.compareAndSetGreeted("missing", false, true)).isFalse();
        assertThat(registry.greetedCount()).isEqualTo(1);
    }

    @Test
    void concurrentCompareAndSetHasExactlyOneWinner() throws Exception {
        registry.insertIfAbsent(call("c1"));
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.compareAndSetGreeted("c1", false, true);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> r : results) {
                if (r.get(2, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        registry.insertIfAbsent(call("c1"));
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch done = new CountDownLatch(threads);
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    for (int j = 0; j < perThread; j++) {
                        registry.update("c1", c -> c.withStats(c.stats().recordMessage(Instant.now())));
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.get("c1").orElseThrow().stats().messageCount()).isEqualTo((long) threads * perThread);
    }

    @Test
    void snapshotIsDetachedCopy() {
        registry.insertIfAbsent(call("c1"));
        var snapshot = registry.snapshot();

        registry.remove("c1");

        assertThat(snapshot).hasSize(1);
    }
}
