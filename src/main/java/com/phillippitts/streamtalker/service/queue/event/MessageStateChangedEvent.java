package com.phillippitts.streamtalker.service.queue.event;

import com.phillippitts.streamtalker.domain.MessageState;

import java.time.Instant;

/**
 * Published after every lifecycle transition of a queued message.
 *
 * @param messageId message sequence number
 * @param voice message voice
 * @param from state before the transition
 * @param to state after the transition
 * @param at transition time
 * @param error error detail for FAILED transitions and failed playback, otherwise null
 */
public record MessageStateChangedEvent(
        long messageId,
        String voice,
        MessageState from,
        MessageState to,
        Instant at,
        String error
) {
}
