package com.phillippitts.streamtalker.service.chat;

import com.phillippitts.streamtalker.config.properties.ChatProperties;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.queue.EnqueueResult;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides which chat messages and reward redemptions reach the voice queues.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>blacklisted users are dropped</li>
 *   <li>a user bound to a voice is always read with that voice (an explicit voice in the text
 *       still wins); for redemptions a binding also bypasses the reward selection</li>
 *   <li>with a selected reward, plain chat is ignored and only that reward is read</li>
 *   <li>plain chat is read only with {@code read-all-messages}, and with {@code require-voice}
 *       only when it names a voice</li>
 * </ol>
 */
public class ChatMessageRouter {

    private static final Logger LOG = LogManager.getLogger(ChatMessageRouter.class);

    private final VoiceQueueManager queue;
    private final PipelineMetrics metrics;
    private final List<ChatProperties.Binding> bindings;
    private final List<ChatProperties.BlacklistEntry> blacklist;
    private final boolean readAllMessages;
    private final boolean requireVoice;
    private final String selectedRewardId;

    public ChatMessageRouter(ChatProperties properties, VoiceQueueManager queue, PipelineMetrics metrics) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.bindings = properties.getBindings();
        this.blacklist = properties.getBlacklist();
        this.readAllMessages = properties.isReadAllMessages();
        this.requireVoice = properties.isRequireVoice();
        this.selectedRewardId = properties.getSelectedRewardId();
    }

    /**
     * Routes a plain chat message.
     *
     * @param rewardId reward attached to the message, if the platform reports one
     */
    public EnqueueResult onMessage(String username, String platform, String text, String rewardId) {
        if (isBlacklisted(username, platform)) {
            return filtered(username, "blacklisted");
        }
        if (selectedRewardId != null) {
            return filtered(username, "reward mode");
        }
        Optional<ChatProperties.Binding> binding = activeBinding(username, platform);
        if (binding.isPresent()) {
            return queue.enqueueWithBoundVoice(text, username, platform, binding.get().voice());
        }
        if (!readAllMessages) {
            return filtered(username, "chat not read");
        }
        return queue.enqueue(text, username, platform, requireVoice);
    }

    /**
     * Routes a reward redemption.
     */
    public EnqueueResult onReward(String username, String platform, String text, String rewardId) {
        if (isBlacklisted(username, platform)) {
            return filtered(username, "blacklisted");
        }
        Optional<ChatProperties.Binding> binding = activeBinding(username, platform);
        if (binding.isPresent()) {
            return queue.enqueueWithBoundVoice(text, username, platform, binding.get().voice());
        }
        if (selectedRewardId == null || selectedRewardId.equals(rewardId)) {
            return queue.enqueue(text, username, platform);
        }
        return filtered(username, "other reward");
    }

    boolean isBlacklisted(String username, String platform) {
        return blacklist.stream().anyMatch(e -> e.enabled()
                && e.username() != null && e.username().equalsIgnoreCase(username)
                && platformMatches(e.platform(), platform));
    }

    Optional<ChatProperties.Binding> activeBinding(String username, String platform) {
        return bindings.stream()
                .filter(b -> b.enabled()
                        && b.username() != null && b.username().equalsIgnoreCase(username)
                        && b.voice() != null && !b.voice().isBlank()
                        && platformMatches(b.platform(), platform))
                .findFirst();
    }

    private EnqueueResult filtered(String username, String reason) {
        LOG.debug("Ignoring message from {}: {}", username, reason);
        metrics.incrementEnqueued("filtered");
        return EnqueueResult.filtered(reason);
    }

    private static boolean platformMatches(String rule, String platform) {
        return ChatProperties.ANY_PLATFORM.equalsIgnoreCase(rule) || rule.equalsIgnoreCase(platform);
    }
}
