package com.phillippitts.streamtalker.service.playback;

import com.phillippitts.streamtalker.config.properties.PlaybackProperties;
import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.QueuedMessage;
import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;
import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.util.LogSanitizer;
import com.phillippitts.streamtalker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Plays ready messages one at a time in arrival order.
 *
 * <p>While a message plays its cache key stays pinned. Every playback ends through exactly one
 * completion path, whichever comes first of the sink finishing, the sink failing, or a skip; that
 * path unpins the key, finishes the message and starts the inter-message delay.
 *
 * @since 1.0
 */
public class PlaybackController {

    private static final Logger LOG = LogManager.getLogger(PlaybackController.class);

    private final VoiceQueueManager queue;
    private final AudioCache cache;
    private final AudioSink sink;
    private final VolumeMixer mixer;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final AtomicReference<Session> current = new AtomicReference<>();
    private volatile Duration delay;
    private volatile Instant lastPlaybackEnd;

    /** One message on the sink. */
    private static final class Session {
        private final QueuedMessage message;
        private final AtomicBoolean finished = new AtomicBoolean();

        private Session(QueuedMessage message) {
            this.message = message;
        }
    }

    public PlaybackController(VoiceQueueManager queue,
                              AudioCache cache,
                              AudioSink sink,
                              VolumeMixer mixer,
                              PipelineMetrics metrics,
                              Clock clock,
                              int delaySeconds) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.mixer = Objects.requireNonNull(mixer, "mixer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.delay = Duration.ofSeconds(checkDelay(delaySeconds));
    }

    /**
     * Starts the next message if nothing is playing, the delay since the last playback has
     * passed, and the earliest unfinished message is ready.
     *
     * @return true if a playback was started
     */
    public boolean tryPlayNext() {
        if (current.get() != null) {
            return false;
        }
        if (!TimeUtils.hasElapsed(lastPlaybackEnd, clock.instant(), delay)) {
            return false;
        }
        Optional<QueuedMessage> next = queue.nextReadyMessage();
        if (next.isEmpty()) {
            return false;
        }
        QueuedMessage message = next.get();
        Session session = new Session(message);
        if (!current.compareAndSet(null, session)) {
            return false;
        }

        cache.pin(message.cacheKey());
        try {
            queue.transition(message, MessageEvent.START_PLAYBACK);
        } catch (IllegalStateTransitionException e) {
            LOG.debug("Message #{} could not start playback: {}", message.id(), e.getMessage());
            cache.unpin(message.cacheKey());
            current.compareAndSet(session, null);
            return false;
        }

        Optional<byte[]> audio = message.detachedAudio().or(() -> cache.get(message.cacheKey()));
        if (audio.isEmpty()) {
            LOG.warn("No audio for message #{} (key {})", message.id(), LogSanitizer.shortKey(message.cacheKey()));
            metrics.incrementPlaybackError("missing_audio");
            finish(session, "Audio not available", false);
            return true;
        }

        if (session.finished.get()) {
            LOG.debug("Message #{} was skipped before reaching the sink", message.id());
            return true;
        }

        float volume = mixer.volumeFor(message.voice());
        LOG.info("Playing #{} voice={} volume={} text=\"{}\"", message.id(), message.voice(), volume,
                LogSanitizer.preview(message.text()));
        CompletableFuture<Void> playback;
        try {
            playback = sink.play(audio.get(), volume);
        } catch (RuntimeException e) {
            LOG.warn("Audio sink rejected message #{}: {}", message.id(), e.toString());
            metrics.incrementPlaybackError("sink_error");
            finish(session, "Playback failed: " + e.getMessage(), false);
            return true;
        }
        if (session.finished.get()) {
            // skipped while the sink was starting; its stop() may have come too early
            sink.stop();
            return true;
        }
        playback.whenComplete((ignored, error) -> {
            if (session.finished.get()) {
                return;
            }
            if (error == null) {
                metrics.incrementPlaybackCompleted();
                finish(session, null, false);
            } else {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                LOG.warn("Playback of message #{} failed: {}", message.id(), cause.toString());
                metrics.incrementPlaybackError("sink_error");
                finish(session, "Playback failed: " + cause.getMessage(), false);
            }
        });
        return true;
    }

    /**
     * Interrupts the current message. It is finished as played and the next message may start
     * without waiting for the delay.
     *
     * @return true if something was playing
     */
    public boolean skipCurrent() {
        Session session = current.get();
        if (session == null || !session.finished.compareAndSet(false, true)) {
            return false;
        }
        LOG.info("Skipping playback of message #{}", session.message.id());
        sink.stop();
        complete(session, null, true);
        return true;
    }

    private void finish(Session session, String error, boolean resetDelay) {
        if (!session.finished.compareAndSet(false, true)) {
            return;
        }
        complete(session, error, resetDelay);
    }

    private void complete(Session session, String error, boolean resetDelay) {
        QueuedMessage message = session.message;
        cache.unpin(message.cacheKey());
        if (!message.isTerminal()) {
            try {
                queue.transition(message, MessageEvent.FINISH_PLAYBACK, error);
            } catch (IllegalStateTransitionException e) {
                LOG.debug("Message #{} finished concurrently: {}", message.id(), e.getMessage());
            }
        }
        lastPlaybackEnd = resetDelay ? null : clock.instant();
        current.compareAndSet(session, null);
    }

    public boolean isPlaying() {
        return current.get() != null;
    }

    public Optional<QueuedMessage> currentMessage() {
        Session session = current.get();
        return session == null ? Optional.empty() : Optional.of(session.message);
    }

    public void setDelaySeconds(int seconds) {
        this.delay = Duration.ofSeconds(checkDelay(seconds));
        LOG.info("Playback delay set to {} s", seconds);
    }

    public int delaySeconds() {
        return (int) delay.toSeconds();
    }

    public VolumeMixer mixer() {
        return mixer;
    }

    private static int checkDelay(int seconds) {
        if (seconds < 0 || seconds > PlaybackProperties.MAX_DELAY_SECONDS) {
            throw new IllegalArgumentException("delay must be between 0 and "
                    + PlaybackProperties.MAX_DELAY_SECONDS + " seconds: " + seconds);
        }
        return seconds;
    }
}
