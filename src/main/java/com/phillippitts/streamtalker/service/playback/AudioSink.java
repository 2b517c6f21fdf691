package com.phillippitts.streamtalker.service.playback;

import java.util.concurrent.CompletableFuture;

/**
 * Plays one audio blob at a time.
 */
public interface AudioSink {

    /**
     * Starts playing {@code wav}, replacing anything still playing.
     *
     * @param wav WAV file bytes
     * @param volume linear volume between 0 and 1
     * @return completes when playback ends, normally or because of {@link #stop()}; completes
     *         exceptionally when the audio cannot be played
     */
    CompletableFuture<Void> play(byte[] wav, float volume);

    /** Interrupts the current playback, if any. */
    void stop();
}
