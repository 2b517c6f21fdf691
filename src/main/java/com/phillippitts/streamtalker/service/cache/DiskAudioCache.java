package com.phillippitts.streamtalker.service.cache;

import com.phillippitts.streamtalker.domain.CacheKeys;
import com.phillippitts.streamtalker.exception.CacheInitializationException;
import com.phillippitts.streamtalker.exception.CacheStorageException;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link AudioCache} backed by one file per key plus a JSON index in a single directory.
 *
 * <p>The index is the source of truth for what the cache holds. On startup it is reconciled with
 * the directory: entries whose blob is gone are dropped, blobs the index does not know are
 * deleted, and a missing or unreadable index is rebuilt from the blob file names.
 *
 * <p>Eviction keeps the total size at or below {@code limit × threshold}: once the total goes
 * over it, unpinned entries are removed oldest access first until it is back under.
 *
 * <p><b>Thread Safety:</b> the index is guarded by one read/write lock; blob reads happen outside
 * the lock and a read that races with eviction is treated as a miss.
 */
public class DiskAudioCache implements AudioCache, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DiskAudioCache.class);

    static final String BLOB_EXTENSION = ".wav";
    private static final String TMP_EXTENSION = ".tmp";

    private final Path directory;
    private final double evictionThreshold;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final WavCompressor compressor;
    private final CacheIndexStore store;
    private final DebouncedIndexWriter writer;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CacheIndex index = new CacheIndex();
    private final ConcurrentHashMap<String, Integer> pins = new ConcurrentHashMap<>();
    private final AtomicLong accessTick = new AtomicLong();
    private volatile long limitBytes;

    public DiskAudioCache(Path directory,
                          long limitBytes,
                          double evictionThreshold,
                          long indexSaveDebounceMs,
                          Clock clock,
                          ApplicationEventPublisher publisher,
                          PipelineMetrics metrics,
                          WavCompressor compressor) {
        if (limitBytes <= 0) {
            throw new IllegalArgumentException("limitBytes must be positive: " + limitBytes);
        }
        if (evictionThreshold <= 0 || evictionThreshold > 1) {
            throw new IllegalArgumentException("evictionThreshold must be in (0, 1]: " + evictionThreshold);
        }
        this.directory = Objects.requireNonNull(directory, "directory");
        this.limitBytes = limitBytes;
        this.evictionThreshold = evictionThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.compressor = Objects.requireNonNull(compressor, "compressor");
        this.store = new CacheIndexStore(directory, BLOB_EXTENSION);
        this.writer = new DebouncedIndexWriter(this::saveIndex, indexSaveDebounceMs);
        initialize();
    }

    private void initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheInitializationException(directory.toString(), e);
        }
        if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
            throw new CacheInitializationException(directory.toString(),
                    new IOException("directory is not writable"));
        }

        List<CacheEntry> loaded;
        boolean dirty;
        try {
            Optional<List<CacheEntry>> persisted = store.load();
            if (persisted.isPresent()) {
                loaded = persisted.get();
                dirty = false;
            } else {
                loaded = rebuildFromBlobs();
                dirty = !loaded.isEmpty();
            }
        } catch (IOException e) {
            LOG.warn("Cache index unreadable, rebuilding from blob files: {}", e.getMessage());
            loaded = rebuildFromBlobs();
            dirty = true;
        }

        loaded.sort(Comparator.comparing(CacheEntry::lastAccessTime));
        for (CacheEntry entry : loaded) {
            if (!Files.isRegularFile(entry.path())) {
                LOG.debug("Dropping index entry without blob: {}", LogSanitizer.shortKey(entry.key()));
                dirty = true;
                continue;
            }
            long actualSize = sizeOf(entry.path());
            if (actualSize != entry.sizeBytes()) {
                dirty = true;
            }
            index.put(entry.resized(actualSize).withAccessOrder(accessTick.incrementAndGet()));
        }

        dirty |= deleteOrphanedFiles() > 0;
        dirty |= evictLocked() > 0;
        if (dirty) {
            writer.flush();
        }
        LOG.info("Audio cache ready at {}: {} entries, {} bytes (limit {} bytes)",
                directory, index.size(), index.totalBytes(), limitBytes);
    }

    private List<CacheEntry> rebuildFromBlobs() {
        List<CacheEntry> rebuilt = new ArrayList<>();
        try (DirectoryStream<Path> blobs = Files.newDirectoryStream(directory, "*" + BLOB_EXTENSION)) {
            for (Path blob : blobs) {
                String name = blob.getFileName().toString();
                String key = name.substring(0, name.length() - BLOB_EXTENSION.length());
                if (!CacheKeys.isValidKey(key)) {
                    deleteQuietly(blob);
                    continue;
                }
                Instant modified = Files.getLastModifiedTime(blob).toInstant();
                rebuilt.add(new CacheEntry(key, blob, Files.size(blob), modified, modified, 0, 0L));
            }
        } catch (IOException e) {
            throw new CacheInitializationException(directory.toString(), e);
        }
        LOG.info("Rebuilt cache index from {} blob files", rebuilt.size());
        return rebuilt;
    }

    private int deleteOrphanedFiles() {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                boolean orphanBlob = name.endsWith(BLOB_EXTENSION)
                        && !index.contains(name.substring(0, name.length() - BLOB_EXTENSION.length()));
                if (orphanBlob || name.endsWith(TMP_EXTENSION)) {
                    deleteQuietly(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new CacheInitializationException(directory.toString(), e);
        }
        if (removed > 0) {
            LOG.info("Removed {} orphaned files from cache directory", removed);
        }
        return removed;
    }

    @Override
    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return index.contains(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Optional<CacheEntry> entry;
        lock.readLock().lock();
        try {
            entry = index.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry.isEmpty()) {
            metrics.incrementCacheMiss();
            return Optional.empty();
        }

        byte[] blob;
        try {
            blob = Files.readAllBytes(entry.get().path());
        } catch (IOException e) {
            LOG.warn("Cache blob {} unreadable, dropping entry: {}", LogSanitizer.shortKey(key), e.toString());
            dropEntry(key);
            metrics.incrementCacheMiss();
            return Optional.empty();
        }

        lock.writeLock().lock();
        try {
            index.get(key).ifPresent(current ->
                    index.put(current.touched(clock.instant(), accessTick.incrementAndGet())));
        } finally {
            lock.writeLock().unlock();
        }
        writer.requestSave();
        metrics.incrementCacheHit();
        return Optional.of(blob);
    }

    @Override
    public CacheEntry put(String key, byte[] blob) {
        if (!CacheKeys.isValidKey(key)) {
            throw new IllegalArgumentException("Not a cache key: " + key);
        }
        Objects.requireNonNull(blob, "blob");
        Path target = store.blobPath(key);
        writeAtomically(key, target, blob);

        CacheEntry stored;
        int evicted;
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            long order = accessTick.incrementAndGet();
            stored = index.get(key)
                    .map(existing -> existing.rewritten(blob.length, now, order))
                    .orElseGet(() -> new CacheEntry(key, target, blob.length, now, now, 0, order));
            index.put(stored);
            evicted = evictLocked();
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Cached {} ({} bytes, evicted {})", LogSanitizer.shortKey(key), blob.length, evicted);
        writer.requestSave();
        publishSize();
        return stored;
    }

    @Override
    public void pin(String key) {
        pins.merge(key, 1, Integer::sum);
    }

    @Override
    public void unpin(String key) {
        pins.computeIfPresent(key, (k, count) -> count <= 1 ? null : count - 1);
    }

    @Override
    public boolean isPinned(String key) {
        return pins.containsKey(key);
    }

    int pinCount(String key) {
        return pins.getOrDefault(key, 0);
    }

    @Override
    public int evict() {
        int evicted;
        lock.writeLock().lock();
        try {
            evicted = evictLocked();
        } finally {
            lock.writeLock().unlock();
        }
        if (evicted > 0) {
            writer.requestSave();
            publishSize();
        }
        return evicted;
    }

    private int evictLocked() {
        long target = (long) (limitBytes * evictionThreshold);
        if (index.totalBytes() <= target) {
            return 0;
        }
        int evicted = 0;
        for (CacheEntry candidate : index.leastRecentlyUsedFirst()) {
            if (index.totalBytes() <= target) {
                break;
            }
            if (isPinned(candidate.key())) {
                continue;
            }
            deleteQuietly(candidate.path());
            index.remove(candidate.key());
            evicted++;
        }
        if (evicted > 0) {
            metrics.incrementEvictions(evicted);
            LOG.info("Evicted {} cache entries, {} bytes remain (target {})",
                    evicted, index.totalBytes(), target);
        }
        return evicted;
    }

    @Override
    public int clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = index.size();
            for (CacheEntry entry : index.entries()) {
                deleteQuietly(entry.path());
            }
            index.clear();
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Cleared audio cache ({} entries)", removed);
        writer.flush();
        publishSize();
        return removed;
    }

    @Override
    public int removeUnused() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            for (CacheEntry entry : index.entries()) {
                if (entry.hitCount() == 0 && !isPinned(entry.key())) {
                    deleteQuietly(entry.path());
                    index.remove(entry.key());
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            LOG.info("Removed {} never-used cache entries", removed);
            writer.requestSave();
            publishSize();
        }
        return removed;
    }

    @Override
    public CompressionResult compress() {
        int files = 0;
        long saved = 0;
        for (CacheEntry entry : entries()) {
            byte[] original;
            try {
                original = Files.readAllBytes(entry.path());
            } catch (IOException e) {
                LOG.debug("Skipping unreadable blob {} during compression", LogSanitizer.shortKey(entry.key()));
                continue;
            }
            Optional<byte[]> smaller = compressor.compress(original);
            if (smaller.isEmpty()) {
                continue;
            }
            byte[] mono = smaller.get();
            try {
                writeAtomically(entry.key(), entry.path(), mono);
            } catch (CacheStorageException e) {
                LOG.warn("Could not rewrite compressed blob {}: {}", LogSanitizer.shortKey(entry.key()),
                        e.getMessage());
                continue;
            }
            lock.writeLock().lock();
            try {
                Optional<CacheEntry> current = index.get(entry.key());
                if (current.isEmpty()) {
                    // evicted or cleared while compressing; the rewrite recreated its file
                    deleteQuietly(entry.path());
                    continue;
                }
                index.put(current.get().resized(mono.length));
            } finally {
                lock.writeLock().unlock();
            }
            files++;
            saved += original.length - mono.length;
        }
        if (files > 0) {
            LOG.info("Compressed {} cache blobs, saved {} bytes", files, saved);
            writer.requestSave();
            publishSize();
        }
        return new CompressionResult(files, saved);
    }

    @Override
    public long totalBytes() {
        lock.readLock().lock();
        try {
            return index.totalBytes();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long limitBytes() {
        return limitBytes;
    }

    @Override
    public void setLimitBytes(long newLimit) {
        if (newLimit <= 0) {
            throw new IllegalArgumentException("limitBytes must be positive: " + newLimit);
        }
        this.limitBytes = newLimit;
        LOG.info("Cache limit set to {} bytes", newLimit);
        evict();
        publishSize();
    }

    @Override
    public CacheStats stats() {
        lock.readLock().lock();
        try {
            int unused = 0;
            long unusedBytes = 0;
            for (CacheEntry entry : index.entries()) {
                if (entry.hitCount() == 0) {
                    unused++;
                    unusedBytes += entry.sizeBytes();
                }
            }
            long total = index.totalBytes();
            double usage = total * 100.0 / limitBytes;
            return new CacheStats(index.size(), total, limitBytes, usage, unused, unusedBytes, pins.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            return index.leastRecentlyUsedFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void flush() {
        writer.flush();
    }

    @Override
    public void close() {
        writer.close();
    }

    Path directory() {
        return directory;
    }

    private void saveIndex() throws IOException {
        List<CacheEntry> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(index.entries());
        } finally {
            lock.readLock().unlock();
        }
        store.save(snapshot);
    }

    private void dropEntry(String key) {
        lock.writeLock().lock();
        try {
            index.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
        writer.requestSave();
        publishSize();
    }

    private void writeAtomically(String key, Path target, byte[] blob) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, key, TMP_EXTENSION);
            Files.write(tmp, blob);
            CacheIndexStore.moveReplacing(tmp, target);
        } catch (IOException e) {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
            throw new CacheStorageException("Failed to write cache blob", key, e);
        }
    }

    private void publishSize() {
        CacheSizeChangedEvent event;
        lock.readLock().lock();
        try {
            event = new CacheSizeChangedEvent(index.totalBytes(), limitBytes, index.size());
        } finally {
            lock.readLock().unlock();
        }
        publisher.publishEvent(event);
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.toString());
        }
    }

    /** Keys currently known to the index; test and diagnostics helper. */
    Set<String> keys() {
        lock.readLock().lock();
        try {
            Set<String> keys = new HashSet<>();
            index.entries().forEach(e -> keys.add(e.key()));
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }
}
