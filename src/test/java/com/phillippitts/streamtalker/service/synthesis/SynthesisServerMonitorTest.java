package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.testutil.EventCapturingPublisher;
import com.phillippitts.streamtalker.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SynthesisServerMonitorTest {

    private FakeSynthesisClient client;
    private SynthesisScheduler scheduler;
    private EventCapturingPublisher events;
    private SynthesisServerMonitor monitor;

    @BeforeEach
    void setUp() {
        client = new FakeSynthesisClient();
        scheduler = mock(SynthesisScheduler.class);
        events = new EventCapturingPublisher();
        monitor = new SynthesisServerMonitor(client, scheduler, events, new MutableClock());
    }

    @Test
    void assumesAvailableBeforeFirstProbe() {
        assertThat(monitor.isAvailable()).isTrue();
        assertThat(monitor.lastProbe()).isNull();
    }

    @Test
    void pausesSchedulerWhenServerGoesDown() {
        client.healthy = false;

        assertThat(monitor.probe()).isFalse();

        verify(scheduler).setServerAvailable(false);
        assertThat(monitor.isAvailable()).isFalse();
        assertThat(monitor.lastProbe()).isNotNull();
    }

    @Test
    void publishesOnlyOnChange() {
        monitor.probe();
        monitor.probe();
        client.healthy = false;
        monitor.probe();
        monitor.probe();
        client.healthy = true;
        monitor.scheduledProbe();

        assertThat(events.eventsOfType(SynthesisServerMonitor.ServerAvailabilityChangedEvent.class))
                .extracting(SynthesisServerMonitor.ServerAvailabilityChangedEvent::available)
                .containsExactly(true, false, true);
    }
}
