package com.phillippitts.streamtalker.service.cache;

/**
 * Point-in-time summary of the cache.
 *
 * @param entryCount number of blobs
 * @param totalBytes summed blob size
 * @param limitBytes configured limit
 * @param usagePercent totalBytes as a percentage of the limit
 * @param unusedEntries entries never served from the cache
 * @param unusedBytes size of those entries
 * @param pinnedKeys keys currently pinned by playback
 */
public record CacheStats(
        int entryCount,
        long totalBytes,
        long limitBytes,
        double usagePercent,
        int unusedEntries,
        long unusedBytes,
        int pinnedKeys
) {
}
