package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.domain.QueuedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Cache keys with a synthesis request in flight, and the messages waiting for each of them.
 *
 * <p>Every in-flight key belongs to the scheduler generation that started it. Completing a key
 * with another generation is a no-op, so a stale result cannot release a key that a newer request
 * owns.
 */
final class PendingKeyRegistry {

    /** A message parked in WAITING_FOR_CACHE. */
    record Waiter(QueuedMessage message, Instant since) {
    }

    private static final class Pending {
        private final long generation;
        private final List<Waiter> waiters = new ArrayList<>();

        private Pending(long generation) {
            this.generation = generation;
        }
    }

    private final Map<String, Pending> pending = new HashMap<>();

    synchronized void markInFlight(String key, long generation) {
        pending.put(key, new Pending(generation));
    }

    synchronized boolean isInFlight(String key) {
        return pending.containsKey(key);
    }

    /**
     * Registers {@code message} as waiting for {@code key}.
     *
     * @return false when the key is no longer in flight; the caller must resolve the message
     */
    synchronized boolean addWaiterIfInFlight(String key, QueuedMessage message, Instant now) {
        Pending p = pending.get(key);
        if (p == null) {
            return false;
        }
        p.waiters.add(new Waiter(message, now));
        return true;
    }

    /**
     * Releases {@code key} if the request of {@code generation} still owns it.
     *
     * @return the messages that were waiting for the key
     */
    synchronized List<QueuedMessage> complete(String key, long generation) {
        Pending p = pending.get(key);
        if (p == null || p.generation != generation) {
            return List.of();
        }
        pending.remove(key);
        List<QueuedMessage> waiting = new ArrayList<>(p.waiters.size());
        p.waiters.forEach(w -> waiting.add(w.message()));
        return waiting;
    }

    /**
     * Removes and returns waiters registered more than {@code timeout} before {@code now}.
     */
    synchronized List<QueuedMessage> removeExpired(Instant now, Duration timeout) {
        List<QueuedMessage> expired = new ArrayList<>();
        Instant cutoff = now.minus(timeout);
        for (Pending p : pending.values()) {
            Iterator<Waiter> it = p.waiters.iterator();
            while (it.hasNext()) {
                Waiter w = it.next();
                if (w.since().isBefore(cutoff)) {
                    expired.add(w.message());
                    it.remove();
                }
            }
        }
        return expired;
    }

    /** Forgets every key and waiter. */
    synchronized void clear() {
        pending.clear();
    }

    synchronized int inFlightCount() {
        return pending.size();
    }

    synchronized int waiterCount() {
        return pending.values().stream().mapToInt(p -> p.waiters.size()).sum();
    }
}
