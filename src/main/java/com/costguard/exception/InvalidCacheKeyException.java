package com.costguard.exception;

public class InvalidCacheKeyException extends CacheException {
    public InvalidCacheKeyException() {
        super("Cache key cannot be empty");
    }
}
