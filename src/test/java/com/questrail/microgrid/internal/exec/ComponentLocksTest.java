package com.questrail.microgrid.internal.exec;

import com.questrail.microgrid.api.ComponentId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ComponentLocksTest {

    private final ComponentLocks locks = new ComponentLocks();

    @Test
    void sectionsForOneComponentNeverOverlap() throws Exception {
        ComponentId id = ComponentId.of(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int[] counter = {0};

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        locks.run(id, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            counter[0]++;
                            inside.decrementAndGet();
                        });
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(8_000, counter[0]);
    }

    @Test
    void differentComponentsProceedInParallel() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> a = pool.submit(() -> locks.call(ComponentId.of(1), () -> awaitQuietly(bothInside)));
            Future<Boolean> b = pool.submit(() -> locks.call(ComponentId.of(2), () -> awaitQuietly(bothInside)));

            assertTrue(a.get(5, TimeUnit.SECONDS), "component 1 section never saw component 2 enter");
            assertTrue(b.get(5, TimeUnit.SECONDS), "component 2 section never saw component 1 enter");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void locksAreReentrant() {
        ComponentId id = ComponentId.of(3);

        int result = locks.call(id, () -> locks.call(id, () -> {
            assertTrue(locks.isHeldByCurrentThread(id));
            return 42;
        }));

        assertEquals(42, result);
        assertFalse(locks.isHeldByCurrentThread(id));
    }

    @Test
    void lockIsReleasedWhenTheSectionThrows() {
        ComponentId id = ComponentId.of(4);

        assertThrows(IllegalStateException.class, () -> locks.run(id, () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(locks.isHeldByCurrentThread(id));
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
