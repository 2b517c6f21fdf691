package com.phillippitts.streamtalker.service.health;

import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.cache.CacheStats;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.service.synthesis.SynthesisServerMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineHealthIndicatorTest {

    private SynthesisServerMonitor monitor;
    private PipelineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        monitor = mock(SynthesisServerMonitor.class);
        AudioCache cache = mock(AudioCache.class);
        VoiceQueueManager queue = mock(VoiceQueueManager.class);
        when(cache.stats()).thenReturn(new CacheStats(4, 512, 1024, 50.04, 1, 100, 0));
        when(queue.totalDepth()).thenReturn(2);
        indicator = new PipelineHealthIndicator(monitor, cache, queue);
    }

    @Test
    void upWhenServerAvailable() {
        when(monitor.isAvailable()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("ttsServer", "available")
                .containsEntry("cacheEntries", 4)
                .containsEntry("cacheUsagePercent", 50.0)
                .containsEntry("queuedMessages", 2);
    }

    @Test
    void degradedWhenServerUnavailable() {
        when(monitor.isAvailable()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("ttsServer", "unavailable");
    }
}
