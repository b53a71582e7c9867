package com.roll.strategy;

import com.roll.core.ExecutionReport;
import com.roll.core.TaskSource;

/**
 * Runs N invocations of a task source under one concurrency strategy.
 * <p>
 * Every implementation invokes the source exactly {@code taskCount} times and counts
 * each result exactly once. The first failing invocation aborts the run with a
 * {@link com.roll.exception.TaskInvocationException}; no thread started for the run
 * outlives it.
 */
public interface RollStrategy {

    /**
     * Get the strategy type.
     */
    StrategyType getType();

    /**
     * Run the task source {@code taskCount} times.
     *
     * @param source    Task source, invoked concurrently by most strategies
     * @param taskCount Number of invocations, zero or positive
     * @return report with elapsed time and, unless results are discarded, their sum
     * @throws com.roll.exception.TaskInvocationException if any invocation fails
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ExecutionReport run(TaskSource source, int taskCount) throws InterruptedException;
}
