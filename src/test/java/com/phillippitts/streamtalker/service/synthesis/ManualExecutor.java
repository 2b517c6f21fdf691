package com.phillippitts.streamtalker.service.synthesis;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Holds submitted tasks until the test runs them, so requests can be kept in flight.
 */
class ManualExecutor implements Executor {

    private final List<Runnable> tasks = new ArrayList<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.add(command);
    }

    synchronized int pending() {
        return tasks.size();
    }

    void runAll() {
        List<Runnable> batch;
        synchronized (this) {
            batch = new ArrayList<>(tasks);
            tasks.clear();
        }
        batch.forEach(Runnable::run);
    }
}
