package com.phillippitts.streamtalker.service.cache;

import com.phillippitts.streamtalker.domain.CacheKeys;
import com.phillippitts.streamtalker.domain.SynthesisParameters;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Shared fixtures for cache tests.
 */
final class CacheTestSupport {

    private CacheTestSupport() {
    }

    static String key(int n) {
        return CacheKeys.of("message " + n, "voice", SynthesisParameters.defaults());
    }

    /**
     * 16-bit little-endian PCM WAV where every channel of frame {@code i} holds sample value {@code i * 10}.
     */
    static byte[] wav(int channels, int frames) {
        byte[] pcm = new byte[frames * channels * 2];
        for (int i = 0; i < frames; i++) {
            short value = (short) (i * 10);
            for (int ch = 0; ch < channels; ch++) {
                int offset = (i * channels + ch) * 2;
                pcm[offset] = (byte) (value & 0xFF);
                pcm[offset + 1] = (byte) ((value >> 8) & 0xFF);
            }
        }
        AudioFormat format = new AudioFormat(22050f, 16, channels, true, false);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
