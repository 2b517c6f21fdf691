package com.phillippitts.streamtalker.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One chat message in flight through the pipeline.
 *
 * <p>Identity, text, voice and synthesis parameters are fixed at enqueue time. The mutable part
 * (state, transition timestamps, error detail, cache-hit flag) only changes through
 * {@link #apply(MessageEvent, Instant, String)}, which serializes transitions per message with an
 * explicit lock and delegates the legality check to {@link MessageStateMachine}.
 *
 * <p>The id is a global sequence number: lower ids arrived earlier, which is the order playback
 * follows.
 *
 * @since 1.0
 */
public final class QueuedMessage {

    private final long id;
    private final String username;
    private final String platform;
    private final String originalText;
    private final String text;
    private final String voice;
    private final SynthesisParameters parameters;
    private final String cacheKey;

    private final Lock lock = new ReentrantLock();
    private final Map<MessageState, Instant> enteredAt = new EnumMap<>(MessageState.class);
    private MessageState state;
    private String errorDetail;
    private boolean cacheHit;
    private byte[] detachedAudio;

    public QueuedMessage(long id,
                         String username,
                         String platform,
                         String originalText,
                         String text,
                         String voice,
                         SynthesisParameters parameters,
                         Instant arrivedAt) {
        this.id = id;
        this.username = Objects.requireNonNull(username, "username");
        this.platform = platform == null ? "" : platform;
        this.originalText = Objects.requireNonNull(originalText, "originalText");
        this.text = Objects.requireNonNull(text, "text");
        this.voice = Objects.requireNonNull(voice, "voice");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.cacheKey = CacheKeys.of(text, voice, parameters);
        this.state = MessageState.QUEUED;
        this.enteredAt.put(MessageState.QUEUED, Objects.requireNonNull(arrivedAt, "arrivedAt"));
    }

    /**
     * Applies an event without error detail.
     *
     * @see #apply(MessageEvent, Instant, String)
     */
    public MessageState apply(MessageEvent event, Instant at) {
        return apply(event, at, null);
    }

    /**
     * Applies {@code event} and records when the new state was entered.
     *
     * @param event lifecycle event
     * @param at transition time
     * @param error optional error detail kept with the message
     * @return the new state
     * @throws com.phillippitts.streamtalker.exception.IllegalStateTransitionException if the event
     *         is not valid in the current state; the message is left unchanged
     */
    public MessageState apply(MessageEvent event, Instant at, String error) {
        return change(event, at, error).to();
    }

    /**
     * Same as {@link #apply(MessageEvent, Instant, String)} but also reports the state that was
     * left, read under the same lock as the transition.
     */
    public StateChange change(MessageEvent event, Instant at, String error) {
        lock.lock();
        try {
            MessageState previous = state;
            MessageState next = MessageStateMachine.next(previous, event);
            state = next;
            enteredAt.put(next, at);
            if (event == MessageEvent.CACHE_HIT) {
                cacheHit = true;
            }
            if (error != null) {
                errorDetail = error;
            }
            return new StateChange(previous, next);
        } finally {
            lock.unlock();
        }
    }

    public long id() {
        return id;
    }

    public String username() {
        return username;
    }

    public String platform() {
        return platform;
    }

    public String originalText() {
        return originalText;
    }

    /** Text after voice extraction; this is what gets synthesized. */
    public String text() {
        return text;
    }

    public String voice() {
        return voice;
    }

    public SynthesisParameters parameters() {
        return parameters;
    }

    public String cacheKey() {
        return cacheKey;
    }

    public Instant arrivedAt() {
        return stateEnteredAt(MessageState.QUEUED).orElseThrow();
    }

    public MessageState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return state().isTerminal();
    }

    public Optional<Instant> stateEnteredAt(MessageState s) {
        lock.lock();
        try {
            return Optional.ofNullable(enteredAt.get(s));
        } finally {
            lock.unlock();
        }
    }

    public Map<MessageState, Instant> timestamps() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new EnumMap<>(enteredAt));
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> errorDetail() {
        lock.lock();
        try {
            return Optional.ofNullable(errorDetail);
        } finally {
            lock.unlock();
        }
    }

    /** True when the audio came from the cache instead of a network call for this message. */
    public boolean wasCacheHit() {
        lock.lock();
        try {
            return cacheHit;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Audio kept on the message when it could not be written to the cache.
     */
    public Optional<byte[]> detachedAudio() {
        lock.lock();
        try {
            return Optional.ofNullable(detachedAudio);
        } finally {
            lock.unlock();
        }
    }

    public void attachAudio(byte[] audio) {
        lock.lock();
        try {
            this.detachedAudio = audio;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Short single-line preview of the text for logs and listings.
     */
    public String displayText(int maxLength) {
        String preview = text.length() > maxLength && maxLength > 3
                ? text.substring(0, maxLength - 3) + "..."
                : text;
        return preview.replace('\n', ' ').replace('\r', ' ');
    }

    @Override
    public String toString() {
        return "QueuedMessage{id=" + id + ", voice=" + voice + ", state=" + state() + ", key="
                + cacheKey.substring(0, 12) + '}';
    }

    /**
     * One applied transition.
     *
     * @param from state before the event
     * @param to state after the event
     */
    public record StateChange(MessageState from, MessageState to) {
    }
}
