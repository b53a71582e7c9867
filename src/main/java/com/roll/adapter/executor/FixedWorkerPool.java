package com.roll.adapter.executor;

import com.roll.exception.PoolShutdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool with a fixed number of persistent workers and an unbounded FIFO task queue.
 * <p>
 * Stop requests queue one stop marker per worker behind all accepted work, so every
 * worker drains the queue before it exits.
 */
public class FixedWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(FixedWorkerPool.class);

    private final int maxWorkers;
    private final LinkedBlockingQueue<PoolTask> taskQueue = new LinkedBlockingQueue<>();
    private final List<WorkerThread> workers;

    // Guards the stopped flag against concurrent submissions
    private final Object submitLock = new Object();
    private volatile boolean stopped;

    private final AtomicInteger submittedCount = new AtomicInteger(0);
    private final AtomicInteger activeCount = new AtomicInteger(0);
    private final AtomicInteger completedCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);
    private final AtomicInteger discardedCount = new AtomicInteger(0);

    public FixedWorkerPool(int maxWorkers, String threadNamePrefix) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("Worker pool needs at least one worker: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.workers = new ArrayList<>(maxWorkers);

        for (int i = 0; i < maxWorkers; i++) {
            WorkerThread worker = new WorkerThread(
                    i + 1,
                    threadNamePrefix,
                    taskQueue,
                    activeCount,
                    completedCount,
                    failedCount,
                    log
            );
            workers.add(worker);
            worker.start();
        }

        log.debug("FixedWorkerPool started with {} workers (prefix '{}')", maxWorkers, threadNamePrefix);
    }

    @Override
    public void submit(Runnable task) {
        Objects.requireNonNull(task, "Task cannot be null");
        enqueue(task);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "Task cannot be null");
        FutureTask<T> futureTask = new FutureTask<>(task);
        enqueue(futureTask);
        return futureTask;
    }

    private void enqueue(Runnable task) {
        synchronized (submitLock) {
            if (stopped) {
                throw new PoolShutdownException("Worker pool is stopped");
            }
            String taskId = "task-" + submittedCount.incrementAndGet();
            taskQueue.add(new PoolTask(task, taskId));
            log.debug("Task {} submitted (queue size: {})", taskId, taskQueue.size());
        }
    }

    @Override
    public void stopAndWait() throws InterruptedException {
        requestStop();
        joinWorkers();
    }

    @Override
    public List<Runnable> stop() throws InterruptedException {
        List<Runnable> discarded = new ArrayList<>();
        synchronized (submitLock) {
            if (!stopped) {
                List<PoolTask> pending = new ArrayList<>();
                taskQueue.drainTo(pending);
                for (PoolTask task : pending) {
                    task.discard();
                    discarded.add(task.getTask());
                }
                discardedCount.addAndGet(discarded.size());
                log.debug("Discarded {} queued tasks", discarded.size());
            }
        }
        requestStop();
        joinWorkers();
        return discarded;
    }

    private void requestStop() {
        synchronized (submitLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            for (int i = 0; i < maxWorkers; i++) {
                taskQueue.add(PoolTask.STOP);
            }
        }
        log.debug("FixedWorkerPool stop requested ({} tasks queued)", getQueueSize());
    }

    private void joinWorkers() throws InterruptedException {
        for (WorkerThread worker : workers) {
            worker.join();
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);

        for (WorkerThread worker : workers) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedJoin(worker, remaining);
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isStopped() {
        return stopped;
    }

    @Override
    public boolean isTerminated() {
        if (!stopped) {
            return false;
        }
        for (WorkerThread worker : workers) {
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int getQueueSize() {
        // Stop markers are not tasks
        return (int) taskQueue.stream().filter(task -> !task.isStop()).count();
    }

    @Override
    public int getActiveCount() {
        return activeCount.get();
    }

    @Override
    public int getWorkerCount() {
        return maxWorkers;
    }

    /**
     * Get statistics about the pool.
     */
    public PoolStats getStats() {
        return new PoolStats(
                submittedCount.get(),
                completedCount.get(),
                failedCount.get(),
                discardedCount.get(),
                getQueueSize(),
                activeCount.get(),
                maxWorkers
        );
    }

    /**
     * Worker pool statistics.
     */
    public record PoolStats(
            int submittedCount,
            int completedCount,
            int failedCount,
            int discardedCount,
            int queueSize,
            int activeWorkers,
            int poolSize
    ) {}
}
