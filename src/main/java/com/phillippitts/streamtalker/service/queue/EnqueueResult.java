package com.phillippitts.streamtalker.service.queue;

import com.phillippitts.streamtalker.domain.QueuedMessage;

import java.util.Optional;

/**
 * Outcome of offering a message to the pipeline.
 *
 * @param status what happened
 * @param message the queued message for {@code QUEUED} and {@code DUPLICATE}, otherwise null
 * @param reason short explanation for {@code SKIPPED} and {@code FILTERED}
 */
public record EnqueueResult(Status status, QueuedMessage message, String reason) {

    public enum Status {
        /** Queued; no other active message has the same cache key. */
        QUEUED,
        /** Queued, but a message with the same cache key is already queued or synthesizing. */
        DUPLICATE,
        /** Nothing left to say after voice extraction. */
        SKIPPED,
        /** Rejected by chat filtering rules before reaching the queues. */
        FILTERED
    }

    public static EnqueueResult queued(QueuedMessage message, boolean duplicate) {
        return new EnqueueResult(duplicate ? Status.DUPLICATE : Status.QUEUED, message, null);
    }

    public static EnqueueResult skipped(String reason) {
        return new EnqueueResult(Status.SKIPPED, null, reason);
    }

    public static EnqueueResult filtered(String reason) {
        return new EnqueueResult(Status.FILTERED, null, reason);
    }

    public boolean isQueued() {
        return status == Status.QUEUED || status == Status.DUPLICATE;
    }

    public Optional<QueuedMessage> queuedMessage() {
        return Optional.ofNullable(message);
    }
}
