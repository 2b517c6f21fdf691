package com.phillippitts.streamtalker.domain;

import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;

import java.util.Objects;

/**
 * Pure transition function for the message lifecycle.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * QUEUED            --DEQUEUE---------&gt; SYNTHESIZING
 * SYNTHESIZING      --CACHE_HIT-------&gt; READY
 * SYNTHESIZING      --SYNTHESIZED-----&gt; READY
 * SYNTHESIZING      --AWAIT_DUPLICATE-&gt; WAITING_FOR_CACHE
 * WAITING_FOR_CACHE --CACHE_HIT-------&gt; READY
 * READY             --START_PLAYBACK--&gt; PLAYING
 * PLAYING           --FINISH_PLAYBACK-&gt; DONE
 * (non-terminal)    --FAIL------------&gt; FAILED
 * (non-terminal)    --SKIP------------&gt; SKIPPED
 * </pre>
 *
 * <p>Every other pair is rejected with {@link IllegalStateTransitionException}. States are never
 * revisited, so a message cannot loop back into the queue; re-queueing creates a new message.
 *
 * @since 1.0
 */
public final class MessageStateMachine {

    private MessageStateMachine() {
    }

    /**
     * Computes the state reached by applying {@code event} in {@code current}.
     *
     * @param current current state
     * @param event event to apply
     * @return the next state
     * @throws IllegalStateTransitionException if the pair is not a valid transition
     */
    public static MessageState next(MessageState current, MessageEvent event) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(event, "event");

        if (current.isTerminal()) {
            throw new IllegalStateTransitionException(current, event);
        }
        if (event == MessageEvent.FAIL) {
            return MessageState.FAILED;
        }
        if (event == MessageEvent.SKIP) {
            return MessageState.SKIPPED;
        }

        MessageState next = switch (current) {
            case QUEUED -> event == MessageEvent.DEQUEUE ? MessageState.SYNTHESIZING : null;
            case SYNTHESIZING -> switch (event) {
                case CACHE_HIT, SYNTHESIZED -> MessageState.READY;
                case AWAIT_DUPLICATE -> MessageState.WAITING_FOR_CACHE;
                default -> null;
            };
            case WAITING_FOR_CACHE -> event == MessageEvent.CACHE_HIT ? MessageState.READY : null;
            case READY -> event == MessageEvent.START_PLAYBACK ? MessageState.PLAYING : null;
            case PLAYING -> event == MessageEvent.FINISH_PLAYBACK ? MessageState.DONE : null;
            default -> null;
        };

        if (next == null) {
            throw new IllegalStateTransitionException(current, event);
        }
        return next;
    }

    /**
     * Returns whether {@code event} is accepted in {@code current}.
     */
    public static boolean accepts(MessageState current, MessageEvent event) {
        try {
            next(current, event);
            return true;
        } catch (IllegalStateTransitionException e) {
            return false;
        }
    }
}
