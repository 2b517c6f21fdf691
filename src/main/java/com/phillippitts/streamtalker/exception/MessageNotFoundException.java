package com.phillippitts.streamtalker.exception;

/**
 * Thrown when a command refers to a message id the pipeline no longer knows about.
 */
public class MessageNotFoundException extends StreamTalkerException {

    private final long messageId;

    public MessageNotFoundException(long messageId) {
        super("Message not found: " + messageId);
        this.messageId = messageId;
    }

    public long getMessageId() {
        return messageId;
    }
}
