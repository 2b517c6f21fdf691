package com.phillippitts.streamtalker.domain;

/**
 * Lifecycle states of a {@link QueuedMessage}.
 *
 * <p>{@code DONE}, {@code FAILED} and {@code SKIPPED} are terminal.
 */
public enum MessageState {
    QUEUED,
    SYNTHESIZING,
    /** An identical cache key is being synthesized for another message. */
    WAITING_FOR_CACHE,
    READY,
    PLAYING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    /**
     * Whether a message in this state still has to be synthesized before it can play.
     */
    public boolean isAwaitingAudio() {
        return this == QUEUED || this == SYNTHESIZING || this == WAITING_FOR_CACHE;
    }
}
