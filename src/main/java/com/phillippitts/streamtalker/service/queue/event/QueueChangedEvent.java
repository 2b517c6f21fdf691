package com.phillippitts.streamtalker.service.queue.event;

/**
 * Published whenever messages are added to or removed from the voice queues.
 *
 * @param voice affected voice, or null when every queue changed
 * @param totalDepth messages waiting across all voices after the change
 * @param reason what changed the queues
 */
public record QueueChangedEvent(String voice, int totalDepth, Reason reason) {

    public enum Reason {
        ENQUEUED,
        DRAINED,
        CLEARED
    }
}
