package com.phillippitts.streamtalker.service.cache;

import com.phillippitts.streamtalker.domain.CacheKeys;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes {@code index.json}.
 *
 * <p>Format: one JSON object keyed by cache key, each value holding {@code sizeBytes},
 * {@code createdTime}, {@code lastAccessTime} (ISO-8601) and {@code hitCount}. Writes go to a
 * temporary file that is then moved over the index.
 */
final class CacheIndexStore {

    static final String INDEX_FILE = "index.json";

    private final Path directory;
    private final Path indexFile;
    private final String blobExtension;

    CacheIndexStore(Path directory, String blobExtension) {
        this.directory = directory;
        this.indexFile = directory.resolve(INDEX_FILE);
        this.blobExtension = blobExtension;
    }

    Path indexFile() {
        return indexFile;
    }

    /**
     * Loads the persisted entries. Access order is left at zero for the caller to assign.
     *
     * @return empty when no index file exists yet
     * @throws IOException when the file cannot be read or is not a valid index
     */
    Optional<List<CacheEntry>> load() throws IOException {
        if (!Files.exists(indexFile)) {
            return Optional.empty();
        }
        String content = Files.readString(indexFile, StandardCharsets.UTF_8);
        try {
            JSONObject root = new JSONObject(content);
            List<CacheEntry> loaded = new ArrayList<>(root.length());
            for (String key : root.keySet()) {
                if (!CacheKeys.isValidKey(key)) {
                    continue;
                }
                JSONObject item = root.getJSONObject(key);
                loaded.add(new CacheEntry(
                        key,
                        blobPath(key),
                        item.getLong("sizeBytes"),
                        Instant.parse(item.getString("createdTime")),
                        Instant.parse(item.getString("lastAccessTime")),
                        item.optInt("hitCount", 0),
                        0L));
            }
            return Optional.of(loaded);
        } catch (JSONException | DateTimeParseException e) {
            throw new IOException("Corrupt cache index " + indexFile + ": " + e.getMessage(), e);
        }
    }

    void save(Collection<CacheEntry> entries) throws IOException {
        JSONObject root = new JSONObject();
        for (CacheEntry entry : entries) {
            root.put(entry.key(), new JSONObject()
                    .put("sizeBytes", entry.sizeBytes())
                    .put("createdTime", entry.createdTime().toString())
                    .put("lastAccessTime", entry.lastAccessTime().toString())
                    .put("hitCount", entry.hitCount()));
        }
        Path tmp = directory.resolve(INDEX_FILE + ".tmp");
        Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
        moveReplacing(tmp, indexFile);
    }

    Path blobPath(String key) {
        return directory.resolve(key + blobExtension);
    }

    static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
