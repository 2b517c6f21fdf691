package com.phillippitts.streamtalker.service.queue;

import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.MessageState;
import com.phillippitts.streamtalker.domain.QueuedMessage;
import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.domain.VoiceExtractionMode;
import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;
import com.phillippitts.streamtalker.exception.MessageNotFoundException;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.queue.event.MessageStateChangedEvent;
import com.phillippitts.streamtalker.service.queue.event.QueueChangedEvent;
import com.phillippitts.streamtalker.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns the per-voice FIFO queues and every non-terminal message.
 *
 * <p>Message ids come from one sequence, so id order is arrival order across all voices.
 * Playback follows that order through {@link #nextReadyMessage()}: a message that is still
 * waiting for audio blocks everything that arrived after it.
 *
 * <p><b>Thread Safety:</b> enqueue may be called from any thread. Structural changes (id
 * assignment with insertion, batch draining, skip-all) are serialized by one lock; read-only
 * snapshots go straight to the concurrent collections.
 *
 * @since 1.0
 */
public class VoiceQueueManager {

    private static final Logger LOG = LogManager.getLogger(VoiceQueueManager.class);

    static final int MAX_REMEMBERED_FAILURES = 100;
    private static final int DIGIT_SPEECH_WEIGHT = 5;

    private final VoiceExtractor extractor;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;

    private final AtomicLong sequence = new AtomicLong();
    private final Lock structureLock = new ReentrantLock();
    private final Map<String, ConcurrentLinkedDeque<QueuedMessage>> queues = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, QueuedMessage> active = new ConcurrentSkipListMap<>();
    private final Deque<QueuedMessage> recentFailures = new ArrayDeque<>();

    private volatile String defaultVoice;
    private volatile VoiceExtractionMode extractionMode;
    private volatile Set<String> knownVoices;
    private volatile SynthesisParameters defaultParameters;

    public VoiceQueueManager(VoiceExtractor extractor,
                             String defaultVoice,
                             VoiceExtractionMode extractionMode,
                             Collection<String> knownVoices,
                             SynthesisParameters defaultParameters,
                             Clock clock,
                             ApplicationEventPublisher publisher,
                             PipelineMetrics metrics) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.defaultVoice = requireVoice(defaultVoice);
        this.extractionMode = Objects.requireNonNull(extractionMode, "extractionMode");
        this.knownVoices = Set.copyOf(knownVoices);
        this.defaultParameters = Objects.requireNonNull(defaultParameters, "defaultParameters");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Enqueues a chat message. A voice named at the front of the text wins; otherwise the
     * default voice is used.
     */
    public EnqueueResult enqueue(String rawText, String username, String platform) {
        return enqueue(rawText, username, platform, false);
    }

    /**
     * Enqueues a chat message; with {@code requireVoice} a message that does not name a known
     * voice is skipped instead of falling back to the default voice.
     */
    public EnqueueResult enqueue(String rawText, String username, String platform, boolean requireVoice) {
        VoiceExtractor.Extraction extraction = extractor.extract(rawText, extractionMode, knownVoices);
        if (requireVoice && extraction.voice().isEmpty()) {
            LOG.debug("Skipping message from {} without a voice", username);
            metrics.incrementEnqueued("skipped");
            return EnqueueResult.skipped("no voice named");
        }
        return add(username, platform, rawText == null ? "" : rawText, extraction.text(),
                extraction.voice().orElse(defaultVoice), defaultParameters);
    }

    /**
     * Enqueues a chat message for a user bound to {@code boundVoice}. An explicitly named voice
     * still wins over the binding; the binding replaces the default voice.
     *
     * @param boundVoice voice bound to the user, or null for the default voice
     */
    public EnqueueResult enqueueWithBoundVoice(String rawText, String username, String platform, String boundVoice) {
        VoiceExtractor.Extraction extraction = extractor.extract(rawText, extractionMode, knownVoices);
        String fallback = (boundVoice == null || boundVoice.isBlank()) ? defaultVoice : boundVoice;
        String voice = extraction.voice().orElse(fallback);
        return add(username, platform, rawText == null ? "" : rawText, extraction.text(), voice, defaultParameters);
    }

    /**
     * Enqueues text with an explicit voice and explicit synthesis parameters. The text is not
     * inspected for a voice prefix.
     */
    public EnqueueResult enqueueManual(String text, String voice, SynthesisParameters parameters, String username) {
        String cleaned = text == null ? "" : text.strip();
        return add(username, "Manual", cleaned, cleaned, requireVoice(voice),
                Objects.requireNonNull(parameters, "parameters"));
    }

    private EnqueueResult add(String username, String platform, String originalText, String text,
                              String voice, SynthesisParameters parameters) {
        if (text.isBlank()) {
            LOG.debug("Skipping empty message from {}", username);
            metrics.incrementEnqueued("skipped");
            return EnqueueResult.skipped("empty text");
        }
        QueuedMessage message;
        boolean duplicate;
        int depth;
        structureLock.lock();
        try {
            message = new QueuedMessage(sequence.incrementAndGet(), username, platform, originalText, text,
                    voice, parameters, clock.instant());
            duplicate = hasPendingDuplicate(message.cacheKey());
            active.put(message.id(), message);
            queues.computeIfAbsent(queueName(voice), k -> new ConcurrentLinkedDeque<>()).addLast(message);
            depth = totalDepth();
        } finally {
            structureLock.unlock();
        }
        LOG.info("Queued #{} voice={} duplicate={} text=\"{}\"", message.id(), voice, duplicate,
                LogSanitizer.preview(text));
        metrics.incrementEnqueued(duplicate ? "duplicate" : "queued");
        publisher.publishEvent(new QueueChangedEvent(voice, depth, QueueChangedEvent.Reason.ENQUEUED));
        return EnqueueResult.queued(message, duplicate);
    }

    private boolean hasPendingDuplicate(String cacheKey) {
        for (QueuedMessage m : active.values()) {
            MessageState state = m.state();
            if (m.cacheKey().equals(cacheKey)
                    && (state == MessageState.QUEUED || state == MessageState.SYNTHESIZING)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes up to {@code maxCount} messages from the head of one voice queue.
     *
     * <p>The first message is always taken. Later ones are taken while they share the first
     * message's synthesis parameters and the summed speech length stays within
     * {@code maxTextLength}.
     *
     * @return drained messages in FIFO order, still in {@code QUEUED}
     */
    public List<QueuedMessage> drainBatch(String voice, int maxCount, int maxTextLength) {
        if (maxCount <= 0) {
            return List.of();
        }
        List<QueuedMessage> batch = new ArrayList<>(maxCount);
        int depth;
        structureLock.lock();
        try {
            ConcurrentLinkedDeque<QueuedMessage> queue = queues.get(queueName(voice));
            if (queue == null) {
                return List.of();
            }
            int length = 0;
            QueuedMessage head;
            while (batch.size() < maxCount && (head = queue.peekFirst()) != null) {
                int cost = speechLength(head.text());
                if (!batch.isEmpty()) {
                    if (!head.parameters().equals(batch.get(0).parameters()) || length + cost > maxTextLength) {
                        break;
                    }
                }
                queue.pollFirst();
                batch.add(head);
                length += cost;
            }
            depth = totalDepth();
        } finally {
            structureLock.unlock();
        }
        if (!batch.isEmpty()) {
            publisher.publishEvent(new QueueChangedEvent(batch.get(0).voice(), depth,
                    QueueChangedEvent.Reason.DRAINED));
        }
        return batch;
    }

    /**
     * Voices with queued work, ordered by the arrival of their head message.
     */
    public List<String> pendingVoices() {
        return queues.values().stream()
                .map(ConcurrentLinkedDeque::peekFirst)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingLong(QueuedMessage::id))
                .map(QueuedMessage::voice)
                .collect(Collectors.toList());
    }

    /**
     * Returns the earliest non-terminal message when it is {@code READY}. Anything earlier that is
     * still queued, synthesizing, waiting or playing blocks the result.
     */
    public Optional<QueuedMessage> nextReadyMessage() {
        Map.Entry<Long, QueuedMessage> first = active.firstEntry();
        if (first == null) {
            return Optional.empty();
        }
        QueuedMessage head = first.getValue();
        return head.state() == MessageState.READY ? Optional.of(head) : Optional.empty();
    }

    /**
     * Applies a lifecycle event, publishes the change and retires terminal messages.
     *
     * @throws IllegalStateTransitionException if the event is not valid in the message's state
     */
    public MessageState transition(QueuedMessage message, MessageEvent event) {
        return transition(message, event, null);
    }

    public MessageState transition(QueuedMessage message, MessageEvent event, String error) {
        QueuedMessage.StateChange change = message.change(event, clock.instant(), error);
        MessageState from = change.from();
        MessageState to = change.to();
        if (to.isTerminal()) {
            active.remove(message.id(), message);
            if (to == MessageState.FAILED) {
                rememberFailure(message);
            }
        }
        LOG.debug("Message #{} {} -> {} ({})", message.id(), from, to, event);
        publisher.publishEvent(new MessageStateChangedEvent(message.id(), message.voice(), from, to,
                clock.instant(), error));
        return to;
    }

    /**
     * Skips every non-terminal message and empties all queues.
     *
     * @return number of messages skipped
     */
    public int skipAll() {
        List<QueuedMessage> victims;
        structureLock.lock();
        try {
            queues.values().forEach(ConcurrentLinkedDeque::clear);
            victims = new ArrayList<>(active.values());
        } finally {
            structureLock.unlock();
        }
        int skipped = 0;
        for (QueuedMessage message : victims) {
            try {
                transition(message, MessageEvent.SKIP);
                skipped++;
            } catch (IllegalStateTransitionException e) {
                // finished concurrently
                LOG.debug("Message #{} already {} when skipping", message.id(), e.getFrom());
            }
        }
        LOG.info("Skipped {} messages", skipped);
        publisher.publishEvent(new QueueChangedEvent(null, 0, QueueChangedEvent.Reason.CLEARED));
        return skipped;
    }

    /**
     * Re-enqueues one recently failed message as a new message with the same text, voice and
     * parameters.
     *
     * @throws MessageNotFoundException if no failure with that id is remembered
     */
    public EnqueueResult requeue(long failedMessageId) {
        QueuedMessage failed;
        synchronized (recentFailures) {
            failed = recentFailures.stream()
                    .filter(m -> m.id() == failedMessageId)
                    .findFirst()
                    .orElseThrow(() -> new MessageNotFoundException(failedMessageId));
            recentFailures.remove(failed);
        }
        return requeueCopy(failed);
    }

    /**
     * Re-enqueues every remembered failure in their original order.
     *
     * @return number of messages queued again
     */
    public int requeueAllFailed() {
        List<QueuedMessage> failed;
        synchronized (recentFailures) {
            failed = new ArrayList<>(recentFailures);
            recentFailures.clear();
        }
        int requeued = 0;
        for (QueuedMessage message : failed) {
            if (requeueCopy(message).isQueued()) {
                requeued++;
            }
        }
        return requeued;
    }

    private EnqueueResult requeueCopy(QueuedMessage failed) {
        LOG.info("Requeueing failed message #{}", failed.id());
        return add(failed.username(), failed.platform(), failed.originalText(), failed.text(),
                failed.voice(), failed.parameters());
    }

    private void rememberFailure(QueuedMessage message) {
        synchronized (recentFailures) {
            recentFailures.addLast(message);
            while (recentFailures.size() > MAX_REMEMBERED_FAILURES) {
                recentFailures.removeFirst();
            }
        }
    }

    public List<QueuedMessage> recentFailures() {
        synchronized (recentFailures) {
            return List.copyOf(recentFailures);
        }
    }

    /** Snapshot of every non-terminal message in arrival order. */
    public List<QueuedMessage> activeMessages() {
        return List.copyOf(active.values());
    }

    public Optional<QueuedMessage> findActive(long id) {
        return Optional.ofNullable(active.get(id));
    }

    public int totalDepth() {
        return queues.values().stream().mapToInt(ConcurrentLinkedDeque::size).sum();
    }

    public int depth(String voice) {
        ConcurrentLinkedDeque<QueuedMessage> queue = queues.get(queueName(voice));
        return queue == null ? 0 : queue.size();
    }

    public void setKnownVoices(Collection<String> voices) {
        this.knownVoices = Set.copyOf(voices);
        LOG.info("Known voices updated: {}", knownVoices.size());
    }

    public Set<String> knownVoices() {
        return knownVoices;
    }

    public void setDefaultVoice(String voice) {
        this.defaultVoice = requireVoice(voice);
    }

    public String defaultVoice() {
        return defaultVoice;
    }

    public void setExtractionMode(VoiceExtractionMode mode) {
        this.extractionMode = Objects.requireNonNull(mode, "mode");
    }

    public void setDefaultParameters(SynthesisParameters parameters) {
        this.defaultParameters = Objects.requireNonNull(parameters, "parameters");
    }

    public SynthesisParameters defaultParameters() {
        return defaultParameters;
    }

    /**
     * Length of text as it counts against the batch budget: each digit counts five (numbers are
     * read out as words), everything else one.
     */
    static int speechLength(String text) {
        int length = 0;
        for (int i = 0; i < text.length(); i++) {
            length += Character.isDigit(text.charAt(i)) ? DIGIT_SPEECH_WEIGHT : 1;
        }
        return length;
    }

    private static String queueName(String voice) {
        return voice.toLowerCase(Locale.ROOT);
    }

    private static String requireVoice(String voice) {
        if (voice == null || voice.isBlank()) {
            throw new IllegalArgumentException("voice must not be blank");
        }
        return voice;
    }
}
