package com.phillippitts.streamtalker.config.properties;

import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.domain.VoiceExtractionMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Voice selection and default synthesis parameters applied to new messages.
 */
@Validated
@ConfigurationProperties(prefix = "voice")
public class VoiceProperties {

    @NotBlank
    private final String defaultVoice;

    @NotNull
    private final VoiceExtractionMode extractionMode;

    /** Voices known to the server; empty accepts any voice until the list is refreshed. */
    private final List<String> knownVoices;

    @NotBlank
    private final String model;

    @NotBlank
    private final String language;

    @DecimalMin("0.25")
    @DecimalMax("4.0")
    private final double speed;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @Min(1)
    @Max(8192)
    private final int maxNewTokens;

    @DecimalMin("0.5")
    @DecimalMax("2.0")
    private final double repetitionPenalty;

    @ConstructorBinding
    public VoiceProperties(String defaultVoice,
                           VoiceExtractionMode extractionMode,
                           List<String> knownVoices,
                           String model,
                           String language,
                           Double speed,
                           Double temperature,
                           Integer maxNewTokens,
                           Double repetitionPenalty) {
        this.defaultVoice = (defaultVoice == null || defaultVoice.isBlank()) ? "default" : defaultVoice;
        this.extractionMode = extractionMode == null ? VoiceExtractionMode.BRACKET : extractionMode;
        this.knownVoices = knownVoices == null ? List.of() : List.copyOf(knownVoices);
        this.model = (model == null || model.isBlank()) ? SynthesisParameters.DEFAULT_MODEL : model;
        this.language = (language == null || language.isBlank()) ? SynthesisParameters.DEFAULT_LANGUAGE : language;
        this.speed = speed == null ? SynthesisParameters.DEFAULT_SPEED : speed;
        this.temperature = temperature == null ? SynthesisParameters.DEFAULT_TEMPERATURE : temperature;
        this.maxNewTokens = maxNewTokens == null ? SynthesisParameters.DEFAULT_MAX_NEW_TOKENS : maxNewTokens;
        this.repetitionPenalty = repetitionPenalty == null
                ? SynthesisParameters.DEFAULT_REPETITION_PENALTY : repetitionPenalty;
    }

    public String getDefaultVoice() {
        return defaultVoice;
    }

    public VoiceExtractionMode getExtractionMode() {
        return extractionMode;
    }

    public List<String> getKnownVoices() {
        return knownVoices;
    }

    /**
     * Synthesis parameters applied to messages that do not specify their own.
     */
    public SynthesisParameters toParameters() {
        return new SynthesisParameters(model, language, speed, temperature, maxNewTokens, repetitionPenalty);
    }
}
