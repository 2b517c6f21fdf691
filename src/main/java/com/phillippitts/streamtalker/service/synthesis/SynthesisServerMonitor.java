package com.phillippitts.streamtalker.service.synthesis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Probes the TTS server and pauses the scheduler while it is unreachable.
 *
 * <p>{@link #probe()} is driven by a fixed-rate schedule; a change of availability is pushed to
 * the scheduler and published as {@link ServerAvailabilityChangedEvent}.
 */
public class SynthesisServerMonitor {

    private static final Logger LOG = LogManager.getLogger(SynthesisServerMonitor.class);

    private final SynthesisClient client;
    private final SynthesisScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile Boolean lastAvailable;
    private volatile Instant lastProbe;

    public SynthesisServerMonitor(SynthesisClient client,
                                  SynthesisScheduler scheduler,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs one health probe.
     *
     * @return whether the server answered healthy
     */
    public boolean probe() {
        boolean available = client.isHealthy();
        lastProbe = clock.instant();
        Boolean previous = lastAvailable;
        lastAvailable = available;
        scheduler.setServerAvailable(available);
        if (previous == null || previous != available) {
            if (available) {
                LOG.info("TTS server is available");
            } else {
                LOG.warn("TTS server is unavailable; synthesis paused");
            }
            publisher.publishEvent(new ServerAvailabilityChangedEvent(available, lastProbe));
        }
        return available;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${synthesis.health-check-interval-ms:5000}")
    public void scheduledProbe() {
        probe();
    }

    /** True until a probe has reported the server down. */
    public boolean isAvailable() {
        Boolean available = lastAvailable;
        return available == null || available;
    }

    public Instant lastProbe() {
        return lastProbe;
    }

    /**
     * Published when the TTS server's reachability changes.
     */
    public record ServerAvailabilityChangedEvent(boolean available, Instant at) {
    }
}
