package com.phillippitts.streamtalker.service.pipeline;

import com.phillippitts.streamtalker.domain.QueuedMessage;
import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.cache.CacheStats;
import com.phillippitts.streamtalker.service.cache.CompressionResult;
import com.phillippitts.streamtalker.service.playback.PlaybackController;
import com.phillippitts.streamtalker.service.queue.EnqueueResult;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.service.synthesis.SynthesisClient;
import com.phillippitts.streamtalker.service.synthesis.SynthesisScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point for operator commands, shared by the REST API and any other front end.
 */
public class PipelineCommands {

    private static final Logger LOG = LogManager.getLogger(PipelineCommands.class);
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final VoiceQueueManager queue;
    private final SynthesisScheduler scheduler;
    private final PlaybackController playback;
    private final AudioCache cache;
    private final SynthesisClient client;

    public PipelineCommands(VoiceQueueManager queue,
                            SynthesisScheduler scheduler,
                            PlaybackController playback,
                            AudioCache cache,
                            SynthesisClient client) {
        this.queue = queue;
        this.scheduler = scheduler;
        this.playback = playback;
        this.cache = cache;
        this.client = client;
    }

    public EnqueueResult enqueue(String text, String username, String platform) {
        return queue.enqueue(text, username, platform);
    }

    /**
     * Enqueues text with an explicit voice. Parameters not given fall back to the current
     * defaults.
     */
    public EnqueueResult enqueueManual(String text, String voice, ParameterOverrides overrides) {
        SynthesisParameters params = overrides.applyTo(queue.defaultParameters());
        return queue.enqueueManual(text, voice, params, "manual");
    }

    public EnqueueResult requeue(long failedMessageId) {
        return queue.requeue(failedMessageId);
    }

    public int requeueAllFailed() {
        return queue.requeueAllFailed();
    }

    public boolean skipCurrent() {
        return playback.skipCurrent();
    }

    /**
     * Drops every queued, synthesizing, waiting, ready and playing message.
     */
    public int skipAll() {
        scheduler.skipAll();
        int skipped = queue.skipAll();
        playback.skipCurrent();
        return skipped;
    }

    public boolean skipCurrentInference() {
        return client.skipInference();
    }

    public int clearCache() {
        return cache.clear();
    }

    public CompressionResult compressCache() {
        return cache.compress();
    }

    public int removeUnusedCacheEntries() {
        return cache.removeUnused();
    }

    public void setCacheLimitMb(int megabytes) {
        if (megabytes <= 0) {
            throw new IllegalArgumentException("cache limit must be positive: " + megabytes);
        }
        cache.setLimitBytes(megabytes * BYTES_PER_MB);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void setGlobalVolume(int percent) {
        playback.mixer().setGlobalPercent(percent);
    }

    public void setVoiceVolume(String voice, int percent) {
        playback.mixer().setVoicePercent(voice, percent);
    }

    public void setBatchSize(int size) {
        scheduler.setBatchSize(size);
    }

    public void setPlaybackDelay(int seconds) {
        playback.setDelaySeconds(seconds);
    }

    public void updateKnownVoices(Collection<String> voices) {
        queue.setKnownVoices(voices);
    }

    /**
     * Replaces the known voices with the server's list.
     *
     * @return the new voice list
     */
    public List<String> refreshKnownVoices() {
        List<String> voices = client.listVoices();
        queue.setKnownVoices(voices);
        LOG.info("Loaded {} voices from TTS server", voices.size());
        return voices;
    }

    public List<QueuedMessage> activeMessages() {
        return queue.activeMessages();
    }

    public List<QueuedMessage> recentFailures() {
        return queue.recentFailures();
    }

    public Optional<QueuedMessage> nowPlaying() {
        return playback.currentMessage();
    }

    public PipelineStatus status() {
        return new PipelineStatus(
                queue.totalDepth(),
                queue.activeMessages().size(),
                scheduler.inFlightRequests(),
                scheduler.waitingMessages(),
                scheduler.batchSize(),
                scheduler.isServerAvailable(),
                playback.isPlaying(),
                playback.delaySeconds(),
                playback.mixer().globalPercent());
    }

    /**
     * Optional per-message parameter values; null fields keep the defaults.
     */
    public record ParameterOverrides(String model, String language, Double speed, Double temperature,
                                     Integer maxNewTokens, Double repetitionPenalty) {

        public static ParameterOverrides none() {
            return new ParameterOverrides(null, null, null, null, null, null);
        }

        SynthesisParameters applyTo(SynthesisParameters defaults) {
            return new SynthesisParameters(
                    model != null ? model : defaults.model(),
                    language != null ? language : defaults.language(),
                    speed != null ? speed : defaults.speed(),
                    temperature != null ? temperature : defaults.temperature(),
                    maxNewTokens != null ? maxNewTokens : defaults.maxNewTokens(),
                    repetitionPenalty != null ? repetitionPenalty : defaults.repetitionPenalty());
        }
    }

    /**
     * Snapshot of pipeline counters for the status endpoint.
     */
    public record PipelineStatus(int queuedMessages, int activeMessages, int inFlightRequests,
                                 int waitingMessages, int batchSize, boolean serverAvailable,
                                 boolean playing, int playbackDelaySeconds, int globalVolumePercent) {
    }
}
