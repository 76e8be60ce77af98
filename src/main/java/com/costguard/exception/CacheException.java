package com.costguard.exception;

/**
 * Base class for query cache conditions.
 *
 * Every subclass is recoverable: callers treat it as a miss and go to the source of truth.
 */
public class CacheException extends Exception {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
