package com.roll.core;

/**
 * Producer of one integer result per invocation.
 * <p>
 * Implementations must be safe for unsynchronized concurrent invocation:
 * strategies call {@link #roll()} from up to N threads at once without
 * any external locking.
 */
@FunctionalInterface
public interface TaskSource {

    /**
     * Perform one roll.
     *
     * @return the result of this invocation
     * @throws com.roll.exception.TaskInvocationException if the invocation fails
     */
    int roll();
}
