package com.phillippitts.streamtalker.service.cache;

import java.util.List;
import java.util.Optional;

/**
 * Content-addressed store of synthesized audio blobs.
 *
 * <p>Pins are reference counts held by playback; a pinned key is never evicted. Pins do not
 * require the key to be present.
 */
public interface AudioCache {

    boolean contains(String key);

    /**
     * Reads a blob and records the access. Any inconsistency between index and disk is healed
     * and reported as a miss.
     */
    Optional<byte[]> get(String key);

    /**
     * Stores a blob and runs eviction.
     *
     * @throws com.phillippitts.streamtalker.exception.CacheStorageException if the blob cannot be
     *         written
     */
    CacheEntry put(String key, byte[] blob);

    void pin(String key);

    void unpin(String key);

    boolean isPinned(String key);

    /**
     * Removes least-recently-used unpinned entries while the cache is over its eviction threshold.
     *
     * @return number of entries removed
     */
    int evict();

    /** Deletes every blob and empties the index. Pins are kept. */
    int clear();

    /** Deletes unpinned entries that were never served from the cache. */
    int removeUnused();

    CompressionResult compress();

    long totalBytes();

    long limitBytes();

    void setLimitBytes(long limitBytes);

    CacheStats stats();

    List<CacheEntry> entries();

    /** Forces a synchronous index save. */
    void flush();
}
