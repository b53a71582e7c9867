package com.roll.exception;

/**
 * Base exception for the roll aggregation core.
 */
public class RollException extends RuntimeException {

    public RollException(String message) {
        super(message);
    }

    public RollException(String message, Throwable cause) {
        super(message, cause);
    }
}
