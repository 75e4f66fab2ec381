package com.fintech.marketdata.cache;

import com.fintech.marketdata.domain.SeriesKey;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeyLockRegistry Tests")
class KeyLockRegistryTest {

    private static final SeriesKey AAPL = SeriesKey.of("AAPL");
    private static final SeriesKey MSFT = SeriesKey.of("MSFT");

    private KeyLockRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new KeyLockRegistry(new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Lock should be held until the handle is closed")
    void testAcquireAndRelease() throws Exception {
        try (KeyLock lock = registry.acquire(AAPL)) {
            assertThat(lock.key()).isEqualTo(AAPL);
            assertThat(registry.isLocked(AAPL)).isTrue();
        }
        assertThat(registry.isLocked(AAPL)).isFalse();
    }

    @Test
    @DisplayName("Closing a handle twice should be harmless")
    void testDoubleClose() throws Exception {
        KeyLock lock = registry.acquire(AAPL);
        lock.close();
        lock.close();

        assertThat(registry.isLocked(AAPL)).isFalse();
    }

    @Test
    @DisplayName("Registry should grow once per key and never shrink")
    void testRegistryGrowth() throws Exception {
        registry.acquire(AAPL).close();
        registry.acquire(AAPL).close();
        assertThat(registry.size()).isEqualTo(1);

        registry.acquire(MSFT).close();
        assertThat(registry.size()).isEqualTo(2);
    }

    /**
     * Test Scenario: many threads repeatedly lock the same key and record their hold intervals.
     *
     * Given: 8 threads, 200 acquisitions each, all on AAPL
     * When: each holder records entry and exit on a shared counter
     * Then: the counter never exceeds 1 and the recorded intervals never overlap
     */
    @Test
    @DisplayName("At most one holder per key at any time")
    void testMutualExclusion() throws Exception {
        int threads = 8;
        int iterations = 200;
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        List<long[]> intervals = Collections.synchronizedList(new ArrayList<>());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < iterations; i++) {
                    try (KeyLock ignored = registry.acquire(AAPL)) {
                        long entered = System.nanoTime();
                        maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                        Thread.onSpinWait();
                        holders.decrementAndGet();
                        intervals.add(new long[] {entered, System.nanoTime()});
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(maxHolders.get()).isEqualTo(1);
        assertThat(intervals).hasSize(threads * iterations);

        List<long[]> sorted = new ArrayList<>(intervals);
        sorted.sort((a, b) -> Long.compare(a[0], b[0]));
        for (int i = 1; i < sorted.size(); i++) {
            assertThat(sorted.get(i)[0]).isGreaterThanOrEqualTo(sorted.get(i - 1)[1]);
        }
    }

    @Test
    @DisplayName("Holding one key should not block another key")
    void testKeyIndependence() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (KeyLock ignored = registry.acquire(AAPL)) {
            Future<Boolean> other = executor.submit(() -> {
                try (KeyLock lock = registry.acquire(MSFT)) {
                    return registry.isLocked(MSFT);
                }
            });

            assertThat(other.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(registry.isLocked(AAPL)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Interrupted waiter should give up without holding the lock")
    void testInterruptedWaiter() throws Exception {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        KeyLock held = registry.acquire(AAPL);
        Thread waiter = new Thread(() -> {
            try (KeyLock ignored = registry.acquire(AAPL)) {
                failure.set(new AssertionError("Waiter should not have obtained the lock"));
            } catch (InterruptedException e) {
                failure.set(e);
            } finally {
                done.countDown();
            }
        });
        waiter.start();

        // Wait until the waiter is parked on the lock
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (waiter.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        waiter.interrupt();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(InterruptedException.class);

        held.close();
        assertThat(registry.isLocked(AAPL)).isFalse();
    }
}
