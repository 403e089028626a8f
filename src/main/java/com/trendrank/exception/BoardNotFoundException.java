package com.trendrank.exception;

/**
 * Exception thrown when an operation is attempted on a ranking board that does not exist.
 */
public class BoardNotFoundException extends RuntimeException {
    public BoardNotFoundException(String message) {
        super(message);
    }

    public BoardNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
