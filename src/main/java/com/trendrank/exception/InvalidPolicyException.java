package com.trendrank.exception;

/**
 * Exception thrown when a ranking policy combines options that cannot be honored.
 */
public class InvalidPolicyException extends RuntimeException {
    public InvalidPolicyException(String message) {
        super(message);
    }

    public InvalidPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
