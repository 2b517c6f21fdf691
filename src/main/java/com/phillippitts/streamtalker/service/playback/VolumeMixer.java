package com.phillippitts.streamtalker.service.playback;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global and per-voice volume in percent. A voice without its own setting plays at 100%.
 */
public class VolumeMixer {

    private final Map<String, Integer> voicePercent = new ConcurrentHashMap<>();
    private volatile int globalPercent;

    public VolumeMixer(int globalPercent, Map<String, Integer> voicePercent) {
        this.globalPercent = checkPercent(globalPercent);
        voicePercent.forEach(this::setVoicePercent);
    }

    /**
     * Linear volume for {@code voice}: global × per-voice, between 0 and 1.
     */
    public float volumeFor(String voice) {
        int perVoice = voicePercent.getOrDefault(voice.toLowerCase(Locale.ROOT), 100);
        return globalPercent * perVoice / 10_000f;
    }

    public void setGlobalPercent(int percent) {
        this.globalPercent = checkPercent(percent);
    }

    public int globalPercent() {
        return globalPercent;
    }

    public void setVoicePercent(String voice, int percent) {
        voicePercent.put(voice.toLowerCase(Locale.ROOT), checkPercent(percent));
    }

    public int voicePercent(String voice) {
        return voicePercent.getOrDefault(voice.toLowerCase(Locale.ROOT), 100);
    }

    public Map<String, Integer> voicePercents() {
        return Map.copyOf(voicePercent);
    }

    private static int checkPercent(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("volume must be between 0 and 100: " + percent);
        }
        return percent;
    }
}
