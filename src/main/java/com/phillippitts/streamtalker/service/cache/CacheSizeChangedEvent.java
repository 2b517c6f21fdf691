package com.phillippitts.streamtalker.service.cache;

/**
 * Published after every change of the cache's total size.
 */
public record CacheSizeChangedEvent(long totalBytes, long limitBytes, int entryCount) {
}
