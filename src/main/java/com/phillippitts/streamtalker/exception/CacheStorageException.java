package com.phillippitts.streamtalker.exception;

/**
 * Thrown when a cache blob cannot be written or read.
 * Callers treat this as a cache miss; it never stops the pipeline.
 */
public class CacheStorageException extends StreamTalkerException {

    private final String cacheKey;

    public CacheStorageException(String message, String cacheKey, Throwable cause) {
        super(message + " (key: " + cacheKey + ")", cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
