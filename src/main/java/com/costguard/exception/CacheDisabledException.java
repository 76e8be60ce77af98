package com.costguard.exception;

public class CacheDisabledException extends CacheException {
    public CacheDisabledException() {
        super("Cache is disabled");
    }
}
