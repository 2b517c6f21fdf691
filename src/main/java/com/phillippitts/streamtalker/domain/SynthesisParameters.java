package com.phillippitts.streamtalker.domain;

import java.util.Objects;

/**
 * Inference parameters captured when a message is enqueued.
 *
 * <p>Every field contributes to the cache key, so two messages share audio only when all of
 * them match.
 *
 * @param model remote model name (e.g. "1.7B")
 * @param language synthesis language, "Auto" lets the server detect it
 * @param speed playback speed multiplier
 * @param temperature sampling temperature
 * @param maxNewTokens upper bound on generated tokens
 * @param repetitionPenalty repetition penalty
 */
public record SynthesisParameters(
        String model,
        String language,
        double speed,
        double temperature,
        int maxNewTokens,
        double repetitionPenalty
) {

    public static final String DEFAULT_MODEL = "1.7B";
    public static final String DEFAULT_LANGUAGE = "Auto";
    public static final double DEFAULT_SPEED = 1.0;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_NEW_TOKENS = 2000;
    public static final double DEFAULT_REPETITION_PENALTY = 1.05;

    public SynthesisParameters {
        model = (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
        language = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language;
        if (speed <= 0) {
            throw new IllegalArgumentException("speed must be positive: " + speed);
        }
        if (temperature < 0) {
            throw new IllegalArgumentException("temperature must not be negative: " + temperature);
        }
        if (maxNewTokens <= 0) {
            throw new IllegalArgumentException("maxNewTokens must be positive: " + maxNewTokens);
        }
        if (repetitionPenalty <= 0) {
            throw new IllegalArgumentException("repetitionPenalty must be positive: " + repetitionPenalty);
        }
    }

    public static SynthesisParameters defaults() {
        return new SynthesisParameters(DEFAULT_MODEL, DEFAULT_LANGUAGE, DEFAULT_SPEED,
                DEFAULT_TEMPERATURE, DEFAULT_MAX_NEW_TOKENS, DEFAULT_REPETITION_PENALTY);
    }

    public SynthesisParameters withSpeed(double newSpeed) {
        return new SynthesisParameters(model, language, newSpeed, temperature, maxNewTokens, repetitionPenalty);
    }

    public SynthesisParameters withTemperature(double newTemperature) {
        return new SynthesisParameters(model, language, speed, newTemperature, maxNewTokens, repetitionPenalty);
    }

    public SynthesisParameters withMaxNewTokens(int newMaxNewTokens) {
        return new SynthesisParameters(model, language, speed, temperature, newMaxNewTokens, repetitionPenalty);
    }

    public SynthesisParameters withRepetitionPenalty(double newPenalty) {
        return new SynthesisParameters(model, language, speed, temperature, maxNewTokens, newPenalty);
    }

    public SynthesisParameters withLanguage(String newLanguage) {
        return new SynthesisParameters(model, newLanguage, speed, temperature, maxNewTokens, repetitionPenalty);
    }

    public SynthesisParameters withModel(String newModel) {
        return new SynthesisParameters(Objects.requireNonNull(newModel), language, speed, temperature,
                maxNewTokens, repetitionPenalty);
    }
}
