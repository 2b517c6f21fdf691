package com.phillippitts.streamtalker.config;

import com.phillippitts.streamtalker.config.properties.CacheProperties;
import com.phillippitts.streamtalker.config.properties.ChatProperties;
import com.phillippitts.streamtalker.config.properties.PlaybackProperties;
import com.phillippitts.streamtalker.config.properties.SynthesisProperties;
import com.phillippitts.streamtalker.config.properties.TtsClientProperties;
import com.phillippitts.streamtalker.config.properties.VoiceProperties;
import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.cache.DiskAudioCache;
import com.phillippitts.streamtalker.service.cache.WavCompressor;
import com.phillippitts.streamtalker.service.chat.ChatMessageRouter;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.pipeline.FixedDelayCycle;
import com.phillippitts.streamtalker.service.pipeline.PipelineCommands;
import com.phillippitts.streamtalker.service.pipeline.PipelineLifecycle;
import com.phillippitts.streamtalker.service.playback.AudioSink;
import com.phillippitts.streamtalker.service.playback.JavaSoundAudioSink;
import com.phillippitts.streamtalker.service.playback.PlaybackController;
import com.phillippitts.streamtalker.service.playback.VolumeMixer;
import com.phillippitts.streamtalker.service.queue.VoiceExtractor;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.service.synthesis.ConcurrencyGuard;
import com.phillippitts.streamtalker.service.synthesis.HttpSynthesisClient;
import com.phillippitts.streamtalker.service.synthesis.SynthesisClient;
import com.phillippitts.streamtalker.service.synthesis.SynthesisScheduler;
import com.phillippitts.streamtalker.service.synthesis.SynthesisServerMonitor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the pipeline: cache, queues, scheduler, playback and the two cycles driving them.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DiskAudioCache audioCache(CacheProperties props,
                                     Clock clock,
                                     ApplicationEventPublisher publisher,
                                     PipelineMetrics metrics) {
        return new DiskAudioCache(Path.of(props.getDirectory()), props.getLimitBytes(),
                props.getEvictionThreshold(), props.getIndexSaveDebounceMs(), clock, publisher, metrics,
                new WavCompressor());
    }

    @Bean
    public VoiceQueueManager voiceQueueManager(VoiceProperties props,
                                               Clock clock,
                                               ApplicationEventPublisher publisher,
                                               PipelineMetrics metrics) {
        return new VoiceQueueManager(new VoiceExtractor(), props.getDefaultVoice(), props.getExtractionMode(),
                props.getKnownVoices(), props.toParameters(), clock, publisher, metrics);
    }

    @Bean
    public SynthesisClient synthesisClient(@Qualifier("ttsRestTemplate") RestTemplate restTemplate,
                                           @Qualifier("ttsProbeRestTemplate") RestTemplate probeTemplate,
                                           TtsClientProperties props) {
        return new HttpSynthesisClient(restTemplate, probeTemplate, props.getBaseUrl());
    }

    @Bean
    public SynthesisScheduler synthesisScheduler(VoiceQueueManager queue,
                                                 AudioCache cache,
                                                 SynthesisClient client,
                                                 @Qualifier("synthesisExecutor") ThreadPoolTaskExecutor executor,
                                                 PipelineMetrics metrics,
                                                 Clock clock,
                                                 SynthesisProperties props) {
        return new SynthesisScheduler(queue, cache, client, executor, new ConcurrencyGuard(props.getMaxConcurrency()),
                metrics, clock, props.getBatchSize(), props.getMaxBatchTextLength(),
                Duration.ofMillis(props.getRequestTimeoutMs()), Duration.ofSeconds(props.getWaitingTimeoutSeconds()));
    }

    @Bean
    public SynthesisServerMonitor synthesisServerMonitor(SynthesisClient client,
                                                         SynthesisScheduler scheduler,
                                                         ApplicationEventPublisher publisher,
                                                         Clock clock) {
        return new SynthesisServerMonitor(client, scheduler, publisher, clock);
    }

    @Bean
    public AudioSink audioSink() {
        return new JavaSoundAudioSink();
    }

    @Bean
    public PlaybackController playbackController(VoiceQueueManager queue,
                                                 AudioCache cache,
                                                 AudioSink sink,
                                                 PipelineMetrics metrics,
                                                 Clock clock,
                                                 PlaybackProperties props) {
        VolumeMixer mixer = new VolumeMixer(props.getVolumePercent(), props.getVoiceVolumes());
        return new PlaybackController(queue, cache, sink, mixer, metrics, clock, props.getDelaySeconds());
    }

    @Bean
    public FixedDelayCycle synthesisCycle(SynthesisScheduler scheduler, SynthesisProperties props) {
        return new FixedDelayCycle("synthesis-cycle", Duration.ofMillis(props.getPollIntervalMs()),
                scheduler::runCycle);
    }

    @Bean
    public FixedDelayCycle playbackCycle(PlaybackController playback, PlaybackProperties props) {
        return new FixedDelayCycle("playback-cycle", Duration.ofMillis(props.getPollIntervalMs()),
                playback::tryPlayNext);
    }

    @Bean
    public PipelineLifecycle pipelineLifecycle(@Qualifier("synthesisCycle") FixedDelayCycle synthesisCycle,
                                               @Qualifier("playbackCycle") FixedDelayCycle playbackCycle,
                                               SynthesisScheduler scheduler,
                                               AudioSink sink,
                                               AudioCache cache) {
        scheduler.setAudioReadyListener(playbackCycle::wakeUp);
        return new PipelineLifecycle(synthesisCycle, playbackCycle, scheduler, sink, cache);
    }

    @Bean
    public ChatMessageRouter chatMessageRouter(ChatProperties props, VoiceQueueManager queue, PipelineMetrics metrics) {
        return new ChatMessageRouter(props, queue, metrics);
    }

    @Bean
    public PipelineCommands pipelineCommands(VoiceQueueManager queue,
                                             SynthesisScheduler scheduler,
                                             PlaybackController playback,
                                             AudioCache cache,
                                             SynthesisClient client) {
        return new PipelineCommands(queue, scheduler, playback, cache, client);
    }
}
