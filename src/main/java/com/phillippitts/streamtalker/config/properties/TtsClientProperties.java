package com.phillippitts.streamtalker.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the remote TTS server.
 */
@Validated
@ConfigurationProperties(prefix = "tts.client")
public class TtsClientProperties {

    @NotBlank
    private final String baseUrl;

    @Positive
    private final int connectTimeoutMs;

    /** Socket read timeout; batches of long messages can take minutes on slow GPUs. */
    @Positive
    private final int readTimeoutMs;

    @ConstructorBinding
    public TtsClientProperties(String baseUrl, Integer connectTimeoutMs, Integer readTimeoutMs) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? "http://localhost:7860" : baseUrl.strip();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 120_000 : readTimeoutMs;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }
}
