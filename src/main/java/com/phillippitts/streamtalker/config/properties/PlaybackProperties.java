package com.phillippitts.streamtalker.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * Typed properties for sequential playback. Startup values only; volumes and delay are mutable at
 * runtime through the pipeline commands.
 */
@Validated
@ConfigurationProperties(prefix = "playback")
public class PlaybackProperties {

    public static final int MAX_DELAY_SECONDS = 300;

    /** Pause between the end of one message and the start of the next. */
    @Min(0)
    @Max(MAX_DELAY_SECONDS)
    private final int delaySeconds;

    @Positive
    private final long pollIntervalMs;

    @Min(0)
    @Max(100)
    private final int volumePercent;

    /** Per-voice volume overrides in percent; voices not listed play at 100%. */
    private final Map<String, Integer> voiceVolumes;

    @ConstructorBinding
    public PlaybackProperties(Integer delaySeconds,
                              Long pollIntervalMs,
                              Integer volumePercent,
                              Map<String, Integer> voiceVolumes) {
        this.delaySeconds = delaySeconds == null ? 5 : delaySeconds;
        this.pollIntervalMs = pollIntervalMs == null ? 100L : pollIntervalMs;
        this.volumePercent = volumePercent == null ? 100 : volumePercent;
        this.voiceVolumes = voiceVolumes == null ? Map.of() : Map.copyOf(voiceVolumes);
    }

    public int getDelaySeconds() {
        return delaySeconds;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public int getVolumePercent() {
        return volumePercent;
    }

    public Map<String, Integer> getVoiceVolumes() {
        return voiceVolumes;
    }
}
