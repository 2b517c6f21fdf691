package com.phillippitts.streamtalker.service.chat;

import com.phillippitts.streamtalker.config.properties.ChatProperties;
import com.phillippitts.streamtalker.domain.SynthesisParameters;
import com.phillippitts.streamtalker.domain.VoiceExtractionMode;
import com.phillippitts.streamtalker.service.metrics.PipelineMetrics;
import com.phillippitts.streamtalker.service.queue.EnqueueResult;
import com.phillippitts.streamtalker.service.queue.VoiceExtractor;
import com.phillippitts.streamtalker.service.queue.VoiceQueueManager;
import com.phillippitts.streamtalker.testutil.EventCapturingPublisher;
import com.phillippitts.streamtalker.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMessageRouterTest {

    private VoiceQueueManager queue;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new PipelineMetrics(new SimpleMeterRegistry());
        queue = new VoiceQueueManager(new VoiceExtractor(), "narrator", VoiceExtractionMode.BRACKET,
                Set.of("bob", "alice"), SynthesisParameters.defaults(), new MutableClock(),
                new EventCapturingPublisher(), metrics);
    }

    private ChatMessageRouter router(Boolean readAll, Boolean requireVoice, String rewardId,
                                     List<ChatProperties.Binding> bindings,
                                     List<ChatProperties.BlacklistEntry> blacklist) {
        return new ChatMessageRouter(new ChatProperties(readAll, requireVoice, rewardId, bindings, blacklist),
                queue, metrics);
    }

    private ChatMessageRouter defaults() {
        return router(null, null, null, null, null);
    }

    @Test
    void readsAllChatByDefault() {
        EnqueueResult result = defaults().onMessage("viewer", "Twitch", "[bob] hello", null);

        assertThat(result.status()).isEqualTo(EnqueueResult.Status.QUEUED);
        assertThat(result.message().voice()).isEqualTo("bob");
        assertThat(result.message().text()).isEqualTo("hello");
    }

    @Test
    void ignoresChatWhenReadAllIsOff() {
        EnqueueResult result = router(false, null, null, null, null).onMessage("viewer", "Twitch", "hi", null);

        assertThat(result.status()).isEqualTo(EnqueueResult.Status.FILTERED);
        assertThat(queue.totalDepth()).isZero();
    }

    @Test
    void requireVoiceSkipsMessagesWithoutOne() {
        ChatMessageRouter router = router(true, true, null, null, null);

        assertThat(router.onMessage("viewer", "Twitch", "just chatting", null).status())
                .isEqualTo(EnqueueResult.Status.SKIPPED);
        assertThat(router.onMessage("viewer", "Twitch", "[alice] hey", null).status())
                .isEqualTo(EnqueueResult.Status.QUEUED);
    }

    @Test
    void blacklistedUserIsDroppedOnAnyPlatformByDefault() {
        ChatMessageRouter router = router(true, null, null, null,
                List.of(new ChatProperties.BlacklistEntry("Spammer", null, null)));

        assertThat(router.onMessage("spammer", "YouTube", "buy now", null).status())
                .isEqualTo(EnqueueResult.Status.FILTERED);
        assertThat(router.onReward("SPAMMER", "Twitch", "buy now", "r1").status())
                .isEqualTo(EnqueueResult.Status.FILTERED);
    }

    @Test
    void disabledOrOtherPlatformBlacklistEntryDoesNotApply() {
        ChatMessageRouter router = router(true, null, null, null, List.of(
                new ChatProperties.BlacklistEntry("a", "Twitch", null),
                new ChatProperties.BlacklistEntry("b", null, false)));

        assertThat(router.onMessage("a", "YouTube", "hi", null).isQueued()).isTrue();
        assertThat(router.onMessage("b", "Twitch", "hi", null).isQueued()).isTrue();
        assertThat(router.onMessage("a", "Twitch", "hi", null).isQueued()).isFalse();
    }

    @Test
    void boundUserIsReadWithBoundVoice() {
        ChatMessageRouter router = router(false, true, null,
                List.of(new ChatProperties.Binding("fan", "Twitch", "alice", null)), null);

        EnqueueResult result = router.onMessage("Fan", "Twitch", "no prefix here", null);

        assertThat(result.isQueued()).isTrue();
        assertThat(result.message().voice()).isEqualTo("alice");
    }

    @Test
    void explicitVoiceBeatsBinding() {
        ChatMessageRouter router = router(true, null, null,
                List.of(new ChatProperties.Binding("fan", null, "alice", null)), null);

        EnqueueResult result = router.onMessage("fan", "Twitch", "[bob] mine", null);

        assertThat(result.message().voice()).isEqualTo("bob");
    }

    @Test
    void disabledBindingFallsBackToNormalRules() {
        ChatMessageRouter router = router(true, null, null,
                List.of(new ChatProperties.Binding("fan", null, "alice", false)), null);

        assertThat(router.onMessage("fan", "Twitch", "hello", null).message().voice()).isEqualTo("narrator");
    }

    @Test
    void selectedRewardFiltersChatAndOtherRewards() {
        ChatMessageRouter router = router(true, null, "tts-reward", null, null);

        assertThat(router.onMessage("viewer", "Twitch", "hello", null).status())
                .isEqualTo(EnqueueResult.Status.FILTERED);
        assertThat(router.onReward("viewer", "Twitch", "hello", "other").status())
                .isEqualTo(EnqueueResult.Status.FILTERED);
        assertThat(router.onReward("viewer", "Twitch", "hello", "tts-reward").status())
                .isEqualTo(EnqueueResult.Status.QUEUED);
    }

    @Test
    void bindingBypassesRewardMode() {
        ChatMessageRouter router = router(true, null, "tts-reward",
                List.of(new ChatProperties.Binding("vip", null, "bob", null)), null);

        EnqueueResult result = router.onMessage("vip", "Kick", "hello", null);

        assertThat(result.isQueued()).isFalse();
        assertThat(router.onReward("vip", "Kick", "hello", "other").message().voice()).isEqualTo("bob");
    }

    @Test
    void anyRewardIsReadWithoutSelection() {
        EnqueueResult result = router(false, null, null, null, null).onReward("viewer", "Twitch", "hi", "x");

        assertThat(result.isQueued()).isTrue();
    }
}
