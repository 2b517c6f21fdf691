package com.phillippitts.streamtalker.service.cache;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DebouncedIndexWriterTest {

    @Test
    void zeroDebounceSavesOnEveryRequest() {
        AtomicInteger saves = new AtomicInteger();
        try (DebouncedIndexWriter writer = new DebouncedIndexWriter(saves::incrementAndGet, 0)) {
            writer.requestSave();
            writer.requestSave();

            assertThat(saves.get()).isEqualTo(2);
            assertThat(writer.hasPendingSave()).isFalse();
        }
    }

    @Test
    void coalescesRequestsInsideTheWindow() throws InterruptedException {
        AtomicInteger saves = new AtomicInteger();
        CountDownLatch saved = new CountDownLatch(1);
        DebouncedIndexWriter writer = new DebouncedIndexWriter(() -> {
            saves.incrementAndGet();
            saved.countDown();
        }, 200);

        for (int i = 0; i < 10; i++) {
            writer.requestSave();
        }
        assertThat(writer.hasPendingSave()).isTrue();

        assertThat(saved.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(300);
        assertThat(saves.get()).isEqualTo(1);
        writer.close();
    }

    @Test
    void requestDuringRunningSaveIsPersistedByAnotherSave() throws InterruptedException {
        AtomicInteger version = new AtomicInteger(1);
        AtomicInteger persisted = new AtomicInteger();
        AtomicInteger saves = new AtomicInteger();
        CountDownLatch snapshotTaken = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch secondSave = new CountDownLatch(2);
        DebouncedIndexWriter writer = new DebouncedIndexWriter(() -> {
            int snapshot = version.get();
            if (saves.incrementAndGet() == 1) {
                snapshotTaken.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            persisted.set(snapshot);
            secondSave.countDown();
        }, 20);

        writer.requestSave();
        assertThat(snapshotTaken.await(5, TimeUnit.SECONDS)).isTrue();
        version.set(2);
        writer.requestSave();
        release.countDown();

        assertThat(secondSave.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(persisted.get()).isEqualTo(2);
        writer.close();
    }

    @Test
    void flushNeverOverlapsScheduledSave() throws InterruptedException {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch scheduledStarted = new CountDownLatch(1);
        DebouncedIndexWriter writer = new DebouncedIndexWriter(() -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            scheduledStarted.countDown();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
        }, 10);

        writer.requestSave();
        assertThat(scheduledStarted.await(5, TimeUnit.SECONDS)).isTrue();
        writer.flush();

        assertThat(maxRunning.get()).isEqualTo(1);
        writer.close();
    }

    @Test
    void flushSavesImmediatelyAndCancelsPending() {
        AtomicInteger saves = new AtomicInteger();
        DebouncedIndexWriter writer = new DebouncedIndexWriter(saves::incrementAndGet, 60_000);
        writer.requestSave();

        writer.flush();

        assertThat(saves.get()).isEqualTo(1);
        assertThat(writer.hasPendingSave()).isFalse();
        writer.close();
    }

    @Test
    void saveFailureIsNotPropagated() {
        DebouncedIndexWriter writer = new DebouncedIndexWriter(() -> {
            throw new IOException("disk full");
        }, 0);

        assertThatCode(writer::requestSave).doesNotThrowAnyException();
        assertThatCode(writer::close).doesNotThrowAnyException();
    }
}
