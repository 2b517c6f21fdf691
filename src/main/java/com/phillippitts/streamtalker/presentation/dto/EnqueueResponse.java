package com.phillippitts.streamtalker.presentation.dto;

import com.phillippitts.streamtalker.service.queue.EnqueueResult;

public record EnqueueResponse(String status, Long messageId, String voice, String reason) {

    public static EnqueueResponse from(EnqueueResult result) {
        return result.queuedMessage()
                .map(m -> new EnqueueResponse(result.status().name(), m.id(), m.voice(), null))
                .orElseGet(() -> new EnqueueResponse(result.status().name(), null, null, result.reason()));
    }
}
