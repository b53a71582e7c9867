package com.roll.adapter.executor;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of persistent workers consuming submitted tasks from an internal queue.
 * Bounds the number of tasks running at once regardless of how many are submitted.
 */
public interface WorkerPool {

    /**
     * Submit a runnable task. Never blocks waiting for a free worker.
     *
     * @param task The runnable task to execute
     * @throws com.roll.exception.PoolShutdownException if the pool has been stopped
     */
    void submit(Runnable task);

    /**
     * Submit a callable task. Never blocks waiting for a free worker.
     *
     * @param task The callable task to execute
     * @param <T>  Return type of the task
     * @return Future representing the pending result
     * @throws com.roll.exception.PoolShutdownException if the pool has been stopped
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Stop accepting tasks, run everything already queued, then wait for all workers to exit.
     * Returns only after every accepted task has completed.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void stopAndWait() throws InterruptedException;

    /**
     * Stop accepting tasks, discard queued tasks not yet started and wait for running ones.
     *
     * @return the discarded tasks
     * @throws InterruptedException if interrupted while waiting
     */
    List<Runnable> stop() throws InterruptedException;

    /**
     * Wait for all workers to exit after a stop request.
     *
     * @param timeout Maximum time to wait
     * @param unit    Time unit
     * @return true if terminated, false if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Check if the pool has stopped accepting tasks.
     */
    boolean isStopped();

    /**
     * Check if every worker has exited after a stop request.
     */
    boolean isTerminated();

    /**
     * Get number of submitted tasks waiting for a worker.
     */
    int getQueueSize();

    /**
     * Get number of workers currently running a task.
     */
    int getActiveCount();

    /**
     * Get number of persistent workers.
     */
    int getWorkerCount();
}
