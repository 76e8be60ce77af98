package com.costguard.exception;

public class CacheNotFoundException extends CacheException {
    public CacheNotFoundException(String key) {
        super("Cache entry not found: " + key);
    }
}
