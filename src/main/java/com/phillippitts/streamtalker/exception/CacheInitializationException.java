package com.phillippitts.streamtalker.exception;

/**
 * Thrown at startup when the cache directory or its index file cannot be created.
 * The pipeline cannot run without a cache, so this aborts application startup.
 */
public class CacheInitializationException extends StreamTalkerException {

    private final String cacheDirectory;

    public CacheInitializationException(String cacheDirectory, Throwable cause) {
        super("Cache directory is not usable: " + cacheDirectory, cause);
        this.cacheDirectory = cacheDirectory;
    }

    public String getCacheDirectory() {
        return cacheDirectory;
    }
}
