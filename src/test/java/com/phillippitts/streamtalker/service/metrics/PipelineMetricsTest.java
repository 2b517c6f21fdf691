package com.phillippitts.streamtalker.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void countsEnqueueOutcomesByStatus() {
        metrics.incrementEnqueued("queued");
        metrics.incrementEnqueued("queued");
        metrics.incrementEnqueued("filtered");

        assertThat(registry.get("streamtalker.queue.enqueued").tag("status", "queued").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("streamtalker.queue.enqueued").tag("status", "filtered").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void recordsSynthesisLatencyPerBatchSize() {
        metrics.recordSynthesisLatency(2, 5_000_000L);

        assertThat(registry.get("streamtalker.synthesis.latency").tag("batchSize", "2").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void countsBatchOutcomes() {
        metrics.incrementBatchSuccess();
        metrics.incrementBatchFailure("timeout");

        assertThat(registry.get("streamtalker.synthesis.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("streamtalker.synthesis.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void ignoresZeroEvictions() {
        metrics.incrementEvictions(0);
        assertThat(registry.find("streamtalker.cache.evictions").counter()).isNull();

        metrics.incrementEvictions(3);
        assertThat(registry.get("streamtalker.cache.evictions").counter().count()).isEqualTo(3.0);
    }

    @Test
    void countsCacheAndPlayback() {
        metrics.incrementCacheHit();
        metrics.incrementCacheMiss();
        metrics.incrementPlaybackCompleted();
        metrics.incrementPlaybackError("missing_audio");

        assertThat(registry.get("streamtalker.cache.hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("streamtalker.cache.miss").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("streamtalker.playback.completed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("streamtalker.playback.error").tag("reason", "missing_audio").counter().count())
                .isEqualTo(1.0);
    }
}
