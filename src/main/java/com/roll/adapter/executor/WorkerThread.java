package com.roll.adapter.executor;

import org.slf4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent worker that pulls tasks from the pool queue until it takes a stop marker.
 */
final class WorkerThread extends Thread {

    private final int workerId;
    private final BlockingQueue<PoolTask> taskQueue;
    private final AtomicInteger activeCount;
    private final AtomicInteger completedCount;
    private final AtomicInteger failedCount;
    private final Logger log;

    WorkerThread(
            int workerId,
            String threadNamePrefix,
            BlockingQueue<PoolTask> taskQueue,
            AtomicInteger activeCount,
            AtomicInteger completedCount,
            AtomicInteger failedCount,
            Logger log
    ) {
        super(threadNamePrefix + workerId);
        this.workerId = workerId;
        this.taskQueue = taskQueue;
        this.activeCount = activeCount;
        this.completedCount = completedCount;
        this.failedCount = failedCount;
        this.log = log;
        setDaemon(true);
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);

        while (true) {
            PoolTask task;
            try {
                task = taskQueue.take();
            } catch (InterruptedException e) {
                log.warn("Worker {} interrupted while idle, exiting", workerId);
                Thread.currentThread().interrupt();
                break;
            }
            if (task.isStop()) {
                break;
            }

            activeCount.incrementAndGet();
            try {
                long startTime = System.nanoTime();
                log.debug("Worker {} executing task {}", workerId, task.getTaskId());

                task.run();

                completedCount.incrementAndGet();
                log.debug("Worker {} completed task {} in {}us",
                        workerId, task.getTaskId(), (System.nanoTime() - startTime) / 1_000);

            } catch (RuntimeException e) {
                failedCount.incrementAndGet();
                log.error("Worker {} task {} failed: {}",
                        workerId, task.getTaskId(), e.getMessage(), e);
            } finally {
                activeCount.decrementAndGet();
            }
        }

        log.debug("Worker {} stopped", workerId);
    }
}
