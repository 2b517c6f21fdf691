package com.phillippitts.streamtalker.service.synthesis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void limitsPermitsWithoutBlocking() {
        ConcurrencyGuard guard = new ConcurrencyGuard(2);

        assertThat(guard.tryAcquire()).isTrue();
        assertThat(guard.tryAcquire()).isTrue();
        assertThat(guard.tryAcquire()).isFalse();
        assertThat(guard.inUse()).isEqualTo(2);

        guard.release();

        assertThat(guard.availablePermits()).isEqualTo(1);
        assertThat(guard.tryAcquire()).isTrue();
    }

    @Test
    void releaseFromAnotherThreadFreesPermit() throws InterruptedException {
        ConcurrencyGuard guard = new ConcurrencyGuard(1);
        guard.tryAcquire();

        Thread t = new Thread(guard::release);
        t.start();
        t.join();

        assertThat(guard.availablePermits()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new ConcurrencyGuard(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ConcurrencyGuard(3).maxPermits()).isEqualTo(3);
    }
}
