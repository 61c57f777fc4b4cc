package com.questrail.lantern.internal.concurrent;

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

class KeyedLocksTest {

    @Test
    void sameKeyIsMutuallyExclusive() throws Exception {
        KeyedLocks<Integer> locks = new KeyedLocks<>();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int[] counter = {0};

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int n = 0; n < 500; n++) {
                        locks.withLock(1, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            counter[0]++;
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(4000, counter[0]);
        assertEquals(1, maxInside.get());
    }

    @Test
    void differentKeysDoNotBlockEachOther() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> locks.withLock("a", () -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        assertEquals("done", locks.withLock("b", () -> "done"));

        release.countDown();
        holder.join(5000);
        assertEquals(2, locks.size());
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        KeyedLocks<Integer> locks = new KeyedLocks<>();

        assertThrows(IllegalStateException.class, () -> locks.withLock(1, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(7, locks.withLock(1, () -> 7));
    }
}
