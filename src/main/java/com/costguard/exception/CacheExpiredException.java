package com.costguard.exception;

public class CacheExpiredException extends CacheException {
    public CacheExpiredException(String key) {
        super("Cache entry expired: " + key);
    }
}
