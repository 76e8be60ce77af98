package com.costguard.exception;

/**
 * Thrown when query parameters cannot be serialized into a canonical key.
 */
public class CacheKeyException extends RuntimeException {
    public CacheKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
