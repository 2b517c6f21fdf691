package com.phillippitts.streamtalker.service.health;

import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.cache.CacheStats;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.service.synthesis.SynthesisServerMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech pipeline.
 *
 * <ul>
 *   <li>UP: TTS server reachable</li>
 *   <li>DEGRADED: TTS server unreachable; cached audio still plays</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health with cache usage and queue depth as details.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SynthesisServerMonitor monitor;
    private final AudioCache cache;
    private final VoiceQueueManager queue;

    public PipelineHealthIndicator(SynthesisServerMonitor monitor, AudioCache cache, VoiceQueueManager queue) {
        this.monitor = monitor;
        this.cache = cache;
        this.queue = queue;
    }

    @Override
    public Health health() {
        CacheStats stats = cache.stats();
        Health.Builder builder = monitor.isAvailable()
                ? Health.up().withDetail("ttsServer", "available")
                : Health.status(DEGRADED).withDetail("ttsServer", "unavailable");
        return builder
                .withDetail("cacheEntries", stats.entryCount())
                .withDetail("cacheUsagePercent", Math.round(stats.usagePercent() * 10) / 10.0)
                .withDetail("queuedMessages", queue.totalDepth())
                .build();
    }
}
