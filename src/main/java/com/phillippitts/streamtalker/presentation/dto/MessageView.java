package com.phillippitts.streamtalker.presentation.dto;

import com.phillippitts.streamtalker.domain.QueuedMessage;

import java.time.Instant;

/**
 * Read-only view of a message for queue listings.
 */
public record MessageView(
        long id,
        String username,
        String voice,
        String text,
        String state,
        boolean cacheHit,
        Instant arrivedAt,
        String error
) {

    private static final int PREVIEW_LENGTH = 80;

    public static MessageView from(QueuedMessage m) {
        return new MessageView(m.id(), m.username(), m.voice(), m.displayText(PREVIEW_LENGTH),
                m.state().name(), m.wasCacheHit(), m.arrivedAt(), m.errorDetail().orElse(null));
    }
}
