package com.phillippitts.streamtalker.service.cache;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One blob in the audio cache.
 *
 * @param key content-addressed cache key
 * @param path location of the blob file
 * @param sizeBytes blob size on disk
 * @param createdTime when the blob was first stored
 * @param lastAccessTime last read or write
 * @param hitCount number of reads served from this entry
 * @param accessOrder runtime-only recency tick; higher means more recently used
 */
public record CacheEntry(
        String key,
        Path path,
        long sizeBytes,
        Instant createdTime,
        Instant lastAccessTime,
        int hitCount,
        long accessOrder
) {

    CacheEntry touched(Instant now, long order) {
        return new CacheEntry(key, path, sizeBytes, createdTime, now, hitCount + 1, order);
    }

    CacheEntry rewritten(long newSize, Instant now, long order) {
        return new CacheEntry(key, path, newSize, createdTime, now, hitCount, order);
    }

    CacheEntry resized(long newSize) {
        return new CacheEntry(key, path, newSize, createdTime, lastAccessTime, hitCount, accessOrder);
    }

    CacheEntry withAccessOrder(long order) {
        return new CacheEntry(key, path, sizeBytes, createdTime, lastAccessTime, hitCount, order);
    }
}
