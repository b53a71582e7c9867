package com.roll.exception;

/**
 * Exception thrown when depositing into a closed result queue, or when
 * reading from a queue that was failed. The failure, if any, is the cause.
 */
public class ResultQueueClosedException extends RollException {

    public ResultQueueClosedException(String message) {
        super(message);
    }

    public ResultQueueClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
