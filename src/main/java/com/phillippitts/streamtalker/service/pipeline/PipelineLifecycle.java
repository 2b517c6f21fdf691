package com.phillippitts.streamtalker.service.pipeline;

import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.playback.AudioSink;
import com.phillippitts.streamtalker.service.queue.event.QueueChangedEvent;
import com.phillippitts.streamtalker.service.synthesis.SynthesisScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;

/**
 * Starts the synthesis and playback cycles with the application context and stops them on
 * shutdown, cancelling in-flight synthesis and flushing the cache index.
 */
public class PipelineLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(PipelineLifecycle.class);

    private final FixedDelayCycle synthesisCycle;
    private final FixedDelayCycle playbackCycle;
    private final SynthesisScheduler scheduler;
    private final AudioSink sink;
    private final AudioCache cache;

    private volatile boolean running;

    public PipelineLifecycle(FixedDelayCycle synthesisCycle,
                             FixedDelayCycle playbackCycle,
                             SynthesisScheduler scheduler,
                             AudioSink sink,
                             AudioCache cache) {
        this.synthesisCycle = synthesisCycle;
        this.playbackCycle = playbackCycle;
        this.scheduler = scheduler;
        this.sink = sink;
        this.cache = cache;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        synthesisCycle.start();
        playbackCycle.start();
        running = true;
        LOG.info("Pipeline started");
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        synthesisCycle.stop();
        playbackCycle.stop();
        scheduler.stop();
        sink.stop();
        cache.flush();
        LOG.info("Pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * New work wakes the scheduler instead of waiting for its next poll.
     */
    @EventListener
    public void onQueueChanged(QueueChangedEvent event) {
        if (event.reason() == QueueChangedEvent.Reason.ENQUEUED && running) {
            synthesisCycle.wakeUp();
        }
    }
}
