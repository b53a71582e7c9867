package com.roll.adapter.executor;

import com.roll.exception.PoolShutdownException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FixedWorkerPool.
 */
class FixedWorkerPoolTest {

    private FixedWorkerPool pool;

    @AfterEach
    void tearDown() throws Exception {
        if (pool != null && !pool.isTerminated()) {
            pool.stop();
        }
    }

    @Test
    @DisplayName("Should execute submitted callable and return its result")
    void shouldExecuteCallable() throws Exception {
        pool = new FixedWorkerPool(2, "test-worker-");

        Future<Integer> future = pool.submit(() -> 42);

        assertEquals(42, future.get(5, TimeUnit.SECONDS));
        assertEquals(2, pool.getWorkerCount());
    }

    @Test
    @DisplayName("Should run every submitted task before stopAndWait returns")
    void shouldDrainOnStopAndWait() throws Exception {
        pool = new FixedWorkerPool(3, "test-worker-");
        AtomicInteger counter = new AtomicInteger(0);

        for (int i = 0; i < 30; i++) {
            pool.submit(() -> {
                sleep(10);
                counter.incrementAndGet();
            });
        }
        pool.stopAndWait();

        assertEquals(30, counter.get());
        assertTrue(pool.isStopped());
        assertTrue(pool.isTerminated());
        assertEquals(0, pool.getQueueSize());
        assertEquals(0, pool.getActiveCount());

        FixedWorkerPool.PoolStats stats = pool.getStats();
        assertEquals(30, stats.submittedCount());
        assertEquals(30, stats.completedCount());
        assertEquals(0, stats.discardedCount());
    }

    @Test
    @DisplayName("Should not block the submitter when all workers are busy")
    void shouldSubmitWithoutBlocking() throws Exception {
        pool = new FixedWorkerPool(1, "test-worker-");
        CountDownLatch release = new CountDownLatch(1);

        pool.submit(() -> await(release));
        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            pool.submit(() -> { });
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 1000, "Submission took " + elapsedMs + "ms");
        assertTrue(pool.getQueueSize() >= 99);
        release.countDown();
        pool.stopAndWait();
    }

    @Test
    @DisplayName("Should never run more tasks at once than workers")
    void shouldBoundConcurrency() throws Exception {
        pool = new FixedWorkerPool(4, "test-worker-");
        AtomicInteger inFlight = new AtomicInteger(0);
        AtomicInteger maxInFlight = new AtomicInteger(0);

        for (int i = 0; i < 40; i++) {
            pool.submit(() -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                sleep(5);
                inFlight.decrementAndGet();
            });
        }
        pool.stopAndWait();

        assertTrue(maxInFlight.get() <= 4, "Max in flight: " + maxInFlight.get());
        assertTrue(maxInFlight.get() >= 1);
    }

    @Test
    @DisplayName("Should reject submissions after stop")
    void shouldRejectAfterStop() throws Exception {
        pool = new FixedWorkerPool(2, "test-worker-");
        pool.stopAndWait();

        assertThrows(PoolShutdownException.class, () -> pool.submit(() -> { }));
        assertThrows(PoolShutdownException.class, () -> pool.submit(() -> 1));
    }

    @Test
    @DisplayName("Stop should discard queued tasks and cancel their futures")
    void shouldDiscardQueuedOnStop() throws Exception {
        pool = new FixedWorkerPool(1, "test-worker-");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger(0);

        pool.submit(() -> {
            started.countDown();
            await(release);
            ran.incrementAndGet();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Future<Integer> queued = pool.submit(() -> {
            ran.incrementAndGet();
            return 1;
        });
        pool.submit(ran::incrementAndGet);

        Thread releaser = new Thread(() -> {
            sleep(100);
            release.countDown();
        });
        releaser.start();
        List<Runnable> discarded = pool.stop();

        assertEquals(2, discarded.size());
        assertTrue(queued.isCancelled());
        assertEquals(1, ran.get());
        assertTrue(pool.isTerminated());
        assertEquals(2, pool.getStats().discardedCount());
    }

    @Test
    @DisplayName("Should keep working after a task throws")
    void shouldSurviveFailingTask() throws Exception {
        pool = new FixedWorkerPool(1, "test-worker-");
        AtomicInteger counter = new AtomicInteger(0);

        pool.submit((Runnable) () -> {
            throw new IllegalStateException("expected failure");
        });
        pool.submit(counter::incrementAndGet);
        pool.stopAndWait();

        assertEquals(1, counter.get());
        assertEquals(1, pool.getStats().failedCount());
    }

    @Test
    @DisplayName("Should report termination after stop")
    void shouldAwaitTermination() throws Exception {
        pool = new FixedWorkerPool(2, "test-worker-");
        assertFalse(pool.isTerminated());
        assertFalse(pool.awaitTermination(50, TimeUnit.MILLISECONDS));

        pool.stopAndWait();
        assertTrue(pool.awaitTermination(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should reject invalid pool size and null tasks")
    void shouldValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> new FixedWorkerPool(0, "test-worker-"));

        pool = new FixedWorkerPool(1, "test-worker-");
        assertThrows(NullPointerException.class, () -> pool.submit((Runnable) null));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
