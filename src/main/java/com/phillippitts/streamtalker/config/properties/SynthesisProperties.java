package com.phillippitts.streamtalker.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the synthesis scheduler.
 *
 * <p>{@code batchSize} is only the startup value; it can be changed at runtime through the
 * pipeline commands.
 */
@Validated
@ConfigurationProperties(prefix = "synthesis")
public class SynthesisProperties {

    public static final int MIN_BATCH_SIZE = 1;
    public static final int MAX_BATCH_SIZE = 6;

    @Min(MIN_BATCH_SIZE)
    @Max(MAX_BATCH_SIZE)
    private final int batchSize;

    /** Maximum number of voices synthesizing at the same time. */
    @Min(1)
    @Max(16)
    private final int maxConcurrency;

    @Positive
    private final long pollIntervalMs;

    @Positive
    private final long requestTimeoutMs;

    /** Upper bound on the summed speech length of one batch; digits count five. */
    @Positive
    private final int maxBatchTextLength;

    @Positive
    private final long waitingTimeoutSeconds;

    @Positive
    private final long healthCheckIntervalMs;

    @ConstructorBinding
    public SynthesisProperties(Integer batchSize,
                               Integer maxConcurrency,
                               Long pollIntervalMs,
                               Long requestTimeoutMs,
                               Integer maxBatchTextLength,
                               Long waitingTimeoutSeconds,
                               Long healthCheckIntervalMs) {
        this.batchSize = batchSize == null ? 2 : batchSize;
        this.maxConcurrency = maxConcurrency == null ? 2 : maxConcurrency;
        this.pollIntervalMs = pollIntervalMs == null ? 100L : pollIntervalMs;
        this.requestTimeoutMs = requestTimeoutMs == null ? 120_000L : requestTimeoutMs;
        this.maxBatchTextLength = maxBatchTextLength == null ? 200 : maxBatchTextLength;
        this.waitingTimeoutSeconds = waitingTimeoutSeconds == null ? 120L : waitingTimeoutSeconds;
        this.healthCheckIntervalMs = healthCheckIntervalMs == null ? 5000L : healthCheckIntervalMs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public int getMaxBatchTextLength() {
        return maxBatchTextLength;
    }

    public long getWaitingTimeoutSeconds() {
        return waitingTimeoutSeconds;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }
}
