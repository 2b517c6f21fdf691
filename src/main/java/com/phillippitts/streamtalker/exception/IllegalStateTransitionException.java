package com.phillippitts.streamtalker.exception;

import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.MessageState;

/**
 * Thrown when an event is not valid for a message's current lifecycle state.
 */
public class IllegalStateTransitionException extends StreamTalkerException {

    private final MessageState from;
    private final MessageEvent event;

    public IllegalStateTransitionException(MessageState from, MessageEvent event) {
        super("Illegal transition: " + event + " in state " + from);
        this.from = from;
        this.event = event;
    }

    public MessageState getFrom() {
        return from;
    }

    public MessageEvent getEvent() {
        return event;
    }
}
