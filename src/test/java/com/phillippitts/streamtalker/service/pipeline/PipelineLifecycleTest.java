package com.phillippitts.streamtalker.service.pipeline;

import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.playback.AudioSink;
import com.phillippitts.streamtalker.service.queue.event.QueueChangedEvent;
import com.phillippitts.streamtalker.service.synthesis.SynthesisScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class PipelineLifecycleTest {

    private final CountDownLatch synthesisRuns = new CountDownLatch(2);
    private FixedDelayCycle synthesisCycle;
    private FixedDelayCycle playbackCycle;
    private SynthesisScheduler scheduler;
    private AudioSink sink;
    private AudioCache cache;
    private PipelineLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        synthesisCycle = new FixedDelayCycle("synthesis", Duration.ofHours(1), synthesisRuns::countDown);
        playbackCycle = new FixedDelayCycle("playback", Duration.ofHours(1), () -> { });
        scheduler = mock(SynthesisScheduler.class);
        sink = mock(AudioSink.class);
        cache = mock(AudioCache.class);
        lifecycle = new PipelineLifecycle(synthesisCycle, playbackCycle, scheduler, sink, cache);
    }

    @AfterEach
    void tearDown() {
        lifecycle.stop();
    }

    @Test
    void startRunsBothCycles() {
        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(synthesisCycle.isRunning()).isTrue();
        assertThat(playbackCycle.isRunning()).isTrue();
    }

    @Test
    void stopCancelsSynthesisAndFlushesCache() {
        lifecycle.start();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(synthesisCycle.isRunning()).isFalse();
        verify(scheduler).stop();
        verify(sink).stop();
        verify(cache).flush();
    }

    @Test
    void stopBeforeStartDoesNothing() {
        lifecycle.stop();

        verifyNoInteractions(scheduler, sink, cache);
    }

    @Test
    void enqueueWakesSynthesisCycle() throws InterruptedException {
        lifecycle.start();

        lifecycle.onQueueChanged(new QueueChangedEvent("bob", 1, QueueChangedEvent.Reason.ENQUEUED));

        assertThat(synthesisRuns.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
