package com.roll.exception;

/**
 * Exception thrown when work is submitted to a worker pool that has been stopped.
 */
public class PoolShutdownException extends RollException {

    public PoolShutdownException(String message) {
        super(message);
    }
}
