package com.phillippitts.streamtalker.domain;

/**
 * Inputs accepted by {@link MessageStateMachine}.
 */
public enum MessageEvent {
    /** Scheduler took the message off its voice queue. */
    DEQUEUE,
    /** Audio found in the cache. */
    CACHE_HIT,
    /** Same cache key already in flight; wait for it instead of submitting again. */
    AWAIT_DUPLICATE,
    /** Remote synthesis returned audio for this message. */
    SYNTHESIZED,
    START_PLAYBACK,
    FINISH_PLAYBACK,
    FAIL,
    SKIP
}
