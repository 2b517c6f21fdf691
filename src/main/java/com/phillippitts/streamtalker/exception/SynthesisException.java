package com.phillippitts.streamtalker.exception;

/**
 * Thrown when a remote synthesis batch fails.
 * The remote call has no per-item failure granularity, so the whole batch is affected.
 */
public class SynthesisException extends StreamTalkerException {

    private final String voice;
    private final int batchSize;

    public SynthesisException(String message) {
        super(message);
        this.voice = "unknown";
        this.batchSize = 0;
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
        this.voice = "unknown";
        this.batchSize = 0;
    }

    public SynthesisException(String message, String voice, int batchSize) {
        super(message + " (voice: " + voice + ", batch: " + batchSize + ")");
        this.voice = voice;
        this.batchSize = batchSize;
    }

    public SynthesisException(String message, String voice, int batchSize, Throwable cause) {
        super(message + " (voice: " + voice + ", batch: " + batchSize + ")", cause);
        this.voice = voice;
        this.batchSize = batchSize;
    }

    public String getVoice() {
        return voice;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
