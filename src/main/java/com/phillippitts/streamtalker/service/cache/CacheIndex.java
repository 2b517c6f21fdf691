package com.phillippitts.streamtalker.service.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory view of {@code index.json} with a running size total.
 *
 * <p>Not thread-safe; {@link DiskAudioCache} guards every access with its read/write lock.
 */
final class CacheIndex {

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long totalBytes;

    Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    boolean contains(String key) {
        return entries.containsKey(key);
    }

    void put(CacheEntry entry) {
        CacheEntry previous = entries.put(entry.key(), entry);
        if (previous != null) {
            totalBytes -= previous.sizeBytes();
        }
        totalBytes += entry.sizeBytes();
    }

    Optional<CacheEntry> remove(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            totalBytes -= removed.sizeBytes();
        }
        return Optional.ofNullable(removed);
    }

    void clear() {
        entries.clear();
        totalBytes = 0;
    }

    int size() {
        return entries.size();
    }

    long totalBytes() {
        return totalBytes;
    }

    Collection<CacheEntry> entries() {
        return List.copyOf(entries.values());
    }

    /** Entries ordered from least to most recently used. */
    List<CacheEntry> leastRecentlyUsedFirst() {
        List<CacheEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(Comparator.comparingLong(CacheEntry::accessOrder));
        return ordered;
    }
}
