package com.phillippitts.streamtalker.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the on-disk audio cache.
 */
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    /** Directory holding the blobs and {@code index.json}. */
    @NotBlank
    private final String directory;

    @Min(1)
    @Max(10_000)
    private final int limitMb;

    /** Fraction of the limit at which LRU eviction starts, and the size it evicts down to. */
    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private final double evictionThreshold;

    @Min(0)
    @Max(60_000)
    private final long indexSaveDebounceMs;

    @ConstructorBinding
    public CacheProperties(String directory,
                           Integer limitMb,
                           Double evictionThreshold,
                           Long indexSaveDebounceMs) {
        this.directory = (directory == null || directory.isBlank()) ? "data/cache" : directory;
        this.limitMb = limitMb == null ? 150 : limitMb;
        this.evictionThreshold = evictionThreshold == null ? 0.85 : evictionThreshold;
        this.indexSaveDebounceMs = indexSaveDebounceMs == null ? 2000L : indexSaveDebounceMs;
    }

    public String getDirectory() {
        return directory;
    }

    public int getLimitMb() {
        return limitMb;
    }

    public long getLimitBytes() {
        return limitMb * BYTES_PER_MB;
    }

    public double getEvictionThreshold() {
        return evictionThreshold;
    }

    public long getIndexSaveDebounceMs() {
        return indexSaveDebounceMs;
    }
}
