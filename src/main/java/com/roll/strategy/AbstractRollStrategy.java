package com.roll.strategy;

import com.roll.core.TaskSource;
import com.roll.exception.ResultQueueClosedException;
import com.roll.exception.TaskInvocationException;
import com.roll.queue.ResultQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared task invocation, failure plumbing and thread creation for strategies.
 */
abstract class AbstractRollStrategy implements RollStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractRollStrategy.class);

    protected final String threadNamePrefix;

    protected AbstractRollStrategy(String threadNamePrefix) {
        this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "Thread name prefix cannot be null");
    }

    protected static void checkTaskCount(TaskSource source, int taskCount) {
        Objects.requireNonNull(source, "Task source cannot be null");
        if (taskCount < 0) {
            throw new IllegalArgumentException("Task count must be zero or positive: " + taskCount);
        }
    }

    /**
     * Invoke the source once, attributing any failure to the task index.
     */
    protected static int invoke(TaskSource source, int taskIndex) {
        try {
            return source.roll();
        } catch (TaskInvocationException e) {
            throw e.getTaskIndex() >= 0
                    ? e
                    : new TaskInvocationException("Task " + taskIndex + " failed: " + e.getMessage(),
                            taskIndex, e.getCause());
        } catch (RuntimeException e) {
            throw new TaskInvocationException("Task " + taskIndex + " failed: " + e.getMessage(), taskIndex, e);
        }
    }

    /**
     * Invoke the source and hand the result to the queue. Failures fail the queue so the
     * consumer and every other producer are released.
     */
    protected static void deposit(ResultQueue<Integer> results, TaskSource source, int taskIndex) {
        if (results.isClosed()) {
            log.debug("Skipping task {}: result queue already closed", taskIndex);
            return;
        }
        try {
            results.put(invoke(source, taskIndex));
        } catch (TaskInvocationException | Error e) {
            results.fail(e);
        } catch (ResultQueueClosedException e) {
            log.debug("Dropping result of task {}: {}", taskIndex, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            results.fail(e);
        }
    }

    /**
     * Translate a failed queue into the failure that caused it. An {@link Error} raised by a
     * task is rethrown as is.
     */
    protected static RuntimeException failureOf(ResultQueueClosedException e) {
        if (e.getCause() instanceof Error error) {
            throw error;
        }
        if (e.getCause() instanceof TaskInvocationException failure) {
            return failure;
        }
        return e;
    }

    /**
     * Rethrow a failure recorded by a concurrent unit.
     */
    protected static void rethrow(Throwable failure) {
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (failure != null) {
            throw new TaskInvocationException("Task failed: " + failure.getMessage(), failure);
        }
    }

    /**
     * Release producers still blocked on a queue the consumer stopped reading.
     */
    protected static void abandon(ResultQueue<Integer> results) {
        if (!results.isClosed()) {
            results.fail(new ResultQueueClosedException("Aggregation abandoned before completion"));
        }
    }

    /**
     * Unbounded pool of daemon threads: one live thread per concurrently running task.
     */
    protected ExecutorService newUnboundedUnits() {
        AtomicInteger threadId = new AtomicInteger(0);
        String prefix = threadNamePrefix + getType().name().toLowerCase().replace('_', '-') + "-";
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(prefix + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Shut the units down and wait until every one of them has exited. An aborted run
     * interrupts the units first. Interrupts received while waiting are restored afterwards.
     */
    protected static void release(ExecutorService units, boolean abort) {
        if (abort) {
            units.shutdownNow();
        } else {
            units.shutdown();
        }
        boolean interrupted = false;
        while (!units.isTerminated()) {
            try {
                units.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
                units.shutdownNow();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Join a helper thread, restoring any interrupt received while waiting.
     */
    protected static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    protected static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
