package com.example.trackscribe.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TrackLocksTest {

    @Test
    void entryIsReleasedAfterWork() {
        TrackLocks locks = new TrackLocks();

        String result = locks.withLock(UUID.randomUUID(), () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(locks.size()).isZero();
    }

    @Test
    void entryIsReleasedWhenWorkThrows() {
        TrackLocks locks = new TrackLocks();

        try {
            locks.withLock(UUID.randomUUID(), () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }

        assertThat(locks.size()).isZero();
    }

    @Test
    void sameIdIsSerialisedAndMapDrainsAfterwards() throws Exception {
        TrackLocks locks = new TrackLocks();
        UUID id = UUID.randomUUID();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return locks.withLock(id, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        return inside.decrementAndGet();
                    });
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }
}
