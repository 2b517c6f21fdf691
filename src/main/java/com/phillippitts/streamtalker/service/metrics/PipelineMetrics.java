package com.phillippitts.streamtalker.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the chat-to-speech pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Enqueue outcomes</li>
 *   <li>Synthesis batch latency and success/failure</li>
 *   <li>Cache hits, misses and evictions</li>
 *   <li>Playback completions and errors</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "streamtalker";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one enqueue attempt by outcome.
     *
     * @param status enqueue outcome (queued, duplicate, skipped, filtered)
     */
    public void incrementEnqueued(String status) {
        Counter.builder(METRIC_PREFIX + ".queue.enqueued")
                .description("Messages offered to the voice queues")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records the wall time of one synthesis batch request.
     *
     * @param batchSize number of texts in the request
     * @param durationNanos request duration in nanoseconds
     */
    public void recordSynthesisLatency(int batchSize, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time taken by the TTS server to synthesize one batch")
                .tag("batchSize", String.valueOf(batchSize))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementBatchSuccess() {
        Counter.builder(METRIC_PREFIX + ".synthesis.success")
                .description("Number of successful synthesis batches")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (timeout, error, count_mismatch)
     */
    public void incrementBatchFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".synthesis.failure")
                .description("Number of failed synthesis batches")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Cache lookups served from disk")
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss() {
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Cache lookups that found no usable blob")
                .register(registry)
                .increment();
    }

    public void incrementEvictions(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".cache.evictions")
                .description("Cache entries removed by LRU eviction")
                .register(registry)
                .increment(count);
    }

    public void incrementPlaybackCompleted() {
        Counter.builder(METRIC_PREFIX + ".playback.completed")
                .description("Messages played to completion")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (missing_audio, sink_error)
     */
    public void incrementPlaybackError(String reason) {
        Counter.builder(METRIC_PREFIX + ".playback.error")
                .description("Messages whose playback failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
