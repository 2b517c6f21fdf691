package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.config.properties.SynthesisProperties;
import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.QueuedMessage;
import com.phillippitts.streamtalker.exception.CacheStorageException;
import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;
import com.phillippitts.streamtalker.exception.SynthesisException;
import com.phillippitts.streamtalker.service.cache.AudioCache;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.util.LogSanitizer;
import com.phillippitts.streamtalker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Turns queued messages into cached audio.
 *
 * <p>Each {@link #runCycle()} walks the voices with queued work in head-arrival order. A voice
 * with a request already in flight is skipped, and no new request starts once the
 * {@link ConcurrencyGuard} is exhausted. Each drained message is resolved in one of three ways:
 * <ul>
 *   <li>its key is cached: {@code CACHE_HIT}, ready for playback</li>
 *   <li>its key is being synthesized already: {@code AWAIT_DUPLICATE}, parked until that request
 *       finishes</li>
 *   <li>otherwise it joins the batch sent to the {@link SynthesisClient}</li>
 * </ul>
 *
 * <p>Requests run on the synthesis executor with a timeout and never block the cycle. A failed
 * batch fails its own messages and their waiters only. {@link #skipAll()} starts a new
 * generation; results of older generations are dropped without touching the cache.
 *
 * @since 1.0
 */
public class SynthesisScheduler {

    private static final Logger LOG = LogManager.getLogger(SynthesisScheduler.class);

    private final VoiceQueueManager queue;
    private final AudioCache cache;
    private final SynthesisClient client;
    private final Executor executor;
    private final ConcurrencyGuard guard;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration requestTimeout;
    private final Duration waitingTimeout;
    private final int maxBatchTextLength;

    private final PendingKeyRegistry registry = new PendingKeyRegistry();
    private final Set<String> busyVoices = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<List<byte[]>>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger batchSize;
    private final AtomicLong generation = new AtomicLong();
    private volatile boolean serverAvailable = true;
    private volatile Runnable audioReadyListener = () -> { };

    public SynthesisScheduler(VoiceQueueManager queue,
                              AudioCache cache,
                              SynthesisClient client,
                              Executor executor,
                              ConcurrencyGuard guard,
                              PipelineMetrics metrics,
                              Clock clock,
                              int batchSize,
                              int maxBatchTextLength,
                              Duration requestTimeout,
                              Duration waitingTimeout) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.batchSize = new AtomicInteger(validBatchSize(batchSize));
        this.maxBatchTextLength = maxBatchTextLength;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.waitingTimeout = Objects.requireNonNull(waitingTimeout, "waitingTimeout");
    }

    /**
     * Called whenever a message may have become ready for playback.
     */
    public void setAudioReadyListener(Runnable listener) {
        this.audioReadyListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * One scheduling pass. Never throws for per-message or per-batch problems.
     */
    public void runCycle() {
        expireWaiters();
        if (!serverAvailable) {
            return;
        }
        for (String voice : queue.pendingVoices()) {
            String voiceKey = voice.toLowerCase(Locale.ROOT);
            if (busyVoices.contains(voiceKey)) {
                continue;
            }
            if (!guard.tryAcquire()) {
                break;
            }
            busyVoices.add(voiceKey);
            boolean dispatched = false;
            try {
                List<QueuedMessage> batch = queue.drainBatch(voice, batchSize.get(), maxBatchTextLength);
                dispatched = resolveBatch(voice, batch);
            } finally {
                if (!dispatched) {
                    busyVoices.remove(voiceKey);
                    guard.release();
                }
            }
        }
    }

    /**
     * Resolves cache hits and duplicates, and sends the remaining misses.
     *
     * @return true if a network request was started; it then owns the voice slot and the permit
     */
    private boolean resolveBatch(String voice, List<QueuedMessage> batch) {
        long gen = generation.get();
        List<QueuedMessage> misses = new ArrayList<>(batch.size());
        boolean anyReady = false;
        for (QueuedMessage message : batch) {
            if (!advance(message, MessageEvent.DEQUEUE, null)) {
                continue;
            }
            String key = message.cacheKey();
            if (cache.contains(key)) {
                anyReady |= advance(message, MessageEvent.CACHE_HIT, null);
            } else if (registry.isInFlight(key)) {
                anyReady |= awaitDuplicate(message);
            } else {
                registry.markInFlight(key, gen);
                misses.add(message);
            }
        }
        if (anyReady) {
            audioReadyListener.run();
        }
        if (misses.isEmpty()) {
            return false;
        }
        dispatch(voice, misses, gen);
        return true;
    }

    private boolean awaitDuplicate(QueuedMessage message) {
        if (!advance(message, MessageEvent.AWAIT_DUPLICATE, null)) {
            return false;
        }
        if (registry.addWaiterIfInFlight(message.cacheKey(), message, clock.instant())) {
            LOG.debug("Message #{} waits for in-flight key {}", message.id(),
                    LogSanitizer.shortKey(message.cacheKey()));
            return false;
        }
        // the other request finished between the check and the registration
        if (cache.contains(message.cacheKey())) {
            return advance(message, MessageEvent.CACHE_HIT, null);
        }
        advance(message, MessageEvent.FAIL, "Duplicate request finished without audio");
        return false;
    }

    private void dispatch(String voice, List<QueuedMessage> misses, long gen) {
        List<SynthesisRequest> requests = misses.stream().map(SynthesisRequest::of).collect(Collectors.toList());
        String ids = misses.stream().map(m -> "#" + m.id()).collect(Collectors.joining(","));
        String voiceKey = voice.toLowerCase(Locale.ROOT);
        long start = System.nanoTime();

        LOG.info("Synthesizing batch {} for voice {} ({} texts)", ids, voice, requests.size());
        ThreadContext.put("voice", voice);
        ThreadContext.put("batch", ids);
        CompletableFuture<List<byte[]>> future;
        try {
            future = CompletableFuture
                    .supplyAsync(() -> client.synthesizeBatch(requests), executor)
                    .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            ThreadContext.remove("voice");
            ThreadContext.remove("batch");
        }
        inFlight.add(future);
        future.whenComplete((blobs, error) -> {
            try {
                inFlight.remove(future);
                completeBatch(voice, misses, gen, blobs, error, start);
            } finally {
                busyVoices.remove(voiceKey);
                guard.release();
                audioReadyListener.run();
            }
        });
    }

    private void completeBatch(String voice, List<QueuedMessage> misses, long gen,
                               List<byte[]> blobs, Throwable error, long startNanos) {
        if (gen != generation.get()) {
            LOG.info("Discarding stale synthesis result for voice {} ({} texts)", voice, misses.size());
            misses.forEach(m -> registry.complete(m.cacheKey(), gen));
            return;
        }

        Throwable cause = unwrap(error);
        if (cause == null && (blobs == null || blobs.size() != misses.size())) {
            cause = new SynthesisException("Expected " + misses.size() + " audio files, got "
                    + (blobs == null ? 0 : blobs.size()), voice, misses.size());
            metrics.incrementBatchFailure("count_mismatch");
        } else if (cause instanceof TimeoutException) {
            cause = new SynthesisException("Timed out after " + requestTimeout.toMillis() + " ms",
                    voice, misses.size(), cause);
            metrics.incrementBatchFailure("timeout");
        } else if (cause != null) {
            metrics.incrementBatchFailure("error");
        }

        if (cause != null) {
            failBatch(voice, misses, gen, cause);
            return;
        }

        long elapsed = System.nanoTime() - startNanos;
        metrics.recordSynthesisLatency(misses.size(), elapsed);
        metrics.incrementBatchSuccess();
        LOG.info("Synthesized {} texts for voice {} in {} ms", misses.size(), voice, TimeUtils.nanosToMillis(elapsed));

        for (int i = 0; i < misses.size(); i++) {
            QueuedMessage message = misses.get(i);
            byte[] blob = blobs.get(i);
            boolean cached = store(message, blob);
            advance(message, MessageEvent.SYNTHESIZED, null);
            for (QueuedMessage waiter : registry.complete(message.cacheKey(), gen)) {
                if (!cached) {
                    waiter.attachAudio(blob);
                }
                advance(waiter, MessageEvent.CACHE_HIT, null);
            }
        }
    }

    private boolean store(QueuedMessage message, byte[] blob) {
        try {
            cache.put(message.cacheKey(), blob);
            return true;
        } catch (CacheStorageException e) {
            LOG.warn("Could not cache audio for message #{}, keeping it in memory: {}", message.id(), e.getMessage());
            message.attachAudio(blob);
            return false;
        }
    }

    private void failBatch(String voice, List<QueuedMessage> misses, long gen, Throwable cause) {
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        LOG.error("Synthesis failed for voice {} ({} texts, keys {}): {}", voice, misses.size(),
                misses.stream().map(m -> LogSanitizer.shortKey(m.cacheKey())).collect(Collectors.joining(",")),
                detail);
        for (QueuedMessage message : misses) {
            advance(message, MessageEvent.FAIL, detail);
            for (QueuedMessage waiter : registry.complete(message.cacheKey(), gen)) {
                advance(waiter, MessageEvent.FAIL, detail);
            }
        }
    }

    private void expireWaiters() {
        for (QueuedMessage waiter : registry.removeExpired(clock.instant(), waitingTimeout)) {
            LOG.warn("Message #{} waited more than {} s for duplicate synthesis", waiter.id(),
                    waitingTimeout.toSeconds());
            advance(waiter, MessageEvent.FAIL, "Timed out waiting for duplicate synthesis");
        }
    }

    /**
     * Applies an event unless the message has moved on (typically skipped) in the meantime.
     */
    private boolean advance(QueuedMessage message, MessageEvent event, String error) {
        try {
            queue.transition(message, event, error);
            return true;
        } catch (IllegalStateTransitionException e) {
            LOG.debug("Message #{} no longer accepts {}: {}", message.id(), event, e.getMessage());
            return false;
        }
    }

    /**
     * Starts a new generation: requests in flight keep running but their results are dropped.
     * The caller is expected to skip the messages themselves through the queue manager.
     */
    public void skipAll() {
        long gen = generation.incrementAndGet();
        registry.clear();
        LOG.info("Synthesis generation advanced to {}; {} requests will be discarded", gen, inFlight.size());
    }

    /**
     * Cancels in-flight requests best-effort and discards their results.
     */
    public void stop() {
        generation.incrementAndGet();
        registry.clear();
        for (CompletableFuture<List<byte[]>> future : List.copyOf(inFlight)) {
            future.cancel(true);
        }
    }

    public void setBatchSize(int size) {
        batchSize.set(validBatchSize(size));
        LOG.info("Synthesis batch size set to {}", size);
    }

    public int batchSize() {
        return batchSize.get();
    }

    public void setServerAvailable(boolean available) {
        if (serverAvailable != available) {
            LOG.info("Synthesis {}", available ? "resumed: server available" : "paused: server unavailable");
        }
        this.serverAvailable = available;
    }

    public boolean isServerAvailable() {
        return serverAvailable;
    }

    public int inFlightRequests() {
        return inFlight.size();
    }

    public int waitingMessages() {
        return registry.waiterCount();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static int validBatchSize(int size) {
        if (size < SynthesisProperties.MIN_BATCH_SIZE || size > SynthesisProperties.MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batch size must be between " + SynthesisProperties.MIN_BATCH_SIZE
                    + " and " + SynthesisProperties.MAX_BATCH_SIZE + ": " + size);
        }
        return size;
    }
}
