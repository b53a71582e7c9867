package com.roll.exception;

/**
 * Exception thrown when a single task source invocation fails.
 * The first one raised during a run aborts the whole aggregation.
 */
public class TaskInvocationException extends RollException {

    private final int taskIndex;

    public TaskInvocationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TaskInvocationException(String message, int taskIndex, Throwable cause) {
        super(message, cause);
        this.taskIndex = taskIndex;
    }

    /**
     * Zero-based index of the failed task within its run, or -1 when unknown.
     */
    public int getTaskIndex() {
        return taskIndex;
    }
}
