package com.trendrank.exception;

/**
 * Exception thrown when a submitted item fails validation.
 */
public class InvalidItemException extends RuntimeException {
    public InvalidItemException(String message) {
        super(message);
    }

    public InvalidItemException(String message, Throwable cause) {
        super(message, cause);
    }
}
