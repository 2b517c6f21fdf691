package com.phillippitts.streamtalker.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Downmixes multi-channel 16-bit PCM WAV audio to mono.
 */
public class WavCompressor {

    private static final Logger LOG = LogManager.getLogger(WavCompressor.class);
    private static final int BYTES_PER_SAMPLE = 2;

    /**
     * Returns a mono re-encoding of {@code wav} when it is multi-channel 16-bit PCM and the result
     * is smaller; otherwise empty.
     */
    public Optional<byte[]> compress(byte[] wav) {
        try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
            AudioFormat format = in.getFormat();
            if (format.getChannels() <= 1
                    || format.getEncoding() != AudioFormat.Encoding.PCM_SIGNED
                    || format.getSampleSizeInBits() != 16) {
                return Optional.empty();
            }
            byte[] mono = downmix(in.readAllBytes(), format.getChannels(), format.isBigEndian());
            AudioFormat monoFormat = new AudioFormat(format.getSampleRate(), 16, 1, true, false);
            long frames = mono.length / BYTES_PER_SAMPLE;
            ByteArrayOutputStream out = new ByteArrayOutputStream(mono.length + 64);
            try (AudioInputStream monoStream =
                         new AudioInputStream(new ByteArrayInputStream(mono), monoFormat, frames)) {
                AudioSystem.write(monoStream, AudioFileFormat.Type.WAVE, out);
            }
            byte[] result = out.toByteArray();
            return result.length < wav.length ? Optional.of(result) : Optional.empty();
        } catch (UnsupportedAudioFileException e) {
            LOG.debug("Skipping non-WAV blob during compression: {}", e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("Could not re-encode blob: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static byte[] downmix(byte[] pcm, int channels, boolean bigEndian) {
        int frameSize = channels * BYTES_PER_SAMPLE;
        int frames = pcm.length / frameSize;
        byte[] mono = new byte[frames * BYTES_PER_SAMPLE];
        for (int frame = 0; frame < frames; frame++) {
            int sum = 0;
            int base = frame * frameSize;
            for (int ch = 0; ch < channels; ch++) {
                int offset = base + ch * BYTES_PER_SAMPLE;
                sum += bigEndian
                        ? (short) ((pcm[offset] << 8) | (pcm[offset + 1] & 0xFF))
                        : (short) ((pcm[offset + 1] << 8) | (pcm[offset] & 0xFF));
            }
            short avg = (short) (sum / channels);
            mono[frame * BYTES_PER_SAMPLE] = (byte) (avg & 0xFF);
            mono[frame * BYTES_PER_SAMPLE + 1] = (byte) ((avg >> 8) & 0xFF);
        }
        return mono;
    }
}
