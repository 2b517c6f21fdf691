package com.phillippitts.streamtalker.service.playback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * {@link AudioSink} that plays WAV data through a Java Sound {@link Clip} on the default mixer.
 */
public class JavaSoundAudioSink implements AudioSink {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSink.class);

    private final Object clipLock = new Object();
    private Clip currentClip;
    private CompletableFuture<Void> currentDone;

    @Override
    public CompletableFuture<Void> play(byte[] wav, float volume) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        synchronized (clipLock) {
            stopLocked();
            try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
                Clip clip = AudioSystem.getClip();
                clip.open(in);
                applyGain(clip, volume);
                clip.addLineListener(event -> {
                    if (event.getType() == LineEvent.Type.STOP) {
                        clip.close();
                        done.complete(null);
                    }
                });
                currentClip = clip;
                currentDone = done;
                clip.start();
            } catch (LineUnavailableException | UnsupportedAudioFileException | IOException e) {
                LOG.warn("Audio playback failed: {}", e.toString());
                done.completeExceptionally(e);
            }
        }
        return done;
    }

    @Override
    public void stop() {
        synchronized (clipLock) {
            stopLocked();
        }
    }

    private void stopLocked() {
        if (currentClip != null) {
            currentClip.stop();
            currentClip.close();
            currentClip = null;
        }
        if (currentDone != null) {
            currentDone.complete(null);
            currentDone = null;
        }
    }

    /**
     * Maps a linear volume to the clip's master gain in decibels, clamped to what the line supports.
     */
    static void applyGain(Clip clip, float volume) {
        if (!clip.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
            return;
        }
        FloatControl gain = (FloatControl) clip.getControl(FloatControl.Type.MASTER_GAIN);
        gain.setValue(toDecibels(volume, gain.getMinimum(), gain.getMaximum()));
    }

    static float toDecibels(float volume, float min, float max) {
        if (volume <= 0f) {
            return min;
        }
        float db = (float) (20.0 * Math.log10(volume));
        return Math.max(min, Math.min(max, db));
    }
}
