package com.phillippitts.streamtalker.exception;

import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.MessageState;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void streamTalkerExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        StreamTalkerException ex = new StreamTalkerException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void synthesisExceptionShouldIncludeVoiceAndBatchSize() {
        SynthesisException ex = new SynthesisException("timeout", "bob", 3);

        assertThat(ex.getMessage()).contains("timeout").contains("bob").contains("3");
        assertThat(ex.getVoice()).isEqualTo("bob");
        assertThat(ex.getBatchSize()).isEqualTo(3);
    }

    @Test
    void synthesisExceptionWithoutContextUsesUnknownVoice() {
        SynthesisException ex = new SynthesisException("bad response");

        assertThat(ex.getVoice()).isEqualTo("unknown");
        assertThat(ex.getBatchSize()).isZero();
    }

    @Test
    void cacheStorageExceptionShouldIncludeKey() {
        CacheStorageException ex = new CacheStorageException("write failed", "abc", new IOException("disk full"));

        assertThat(ex.getMessage()).contains("write failed").contains("abc");
        assertThat(ex.getCacheKey()).isEqualTo("abc");
        assertThat(ex.getCause()).hasMessage("disk full");
    }

    @Test
    void cacheInitializationExceptionShouldIncludeDirectory() {
        CacheInitializationException ex = new CacheInitializationException("/tmp/cache", new IOException());

        assertThat(ex.getMessage()).contains("/tmp/cache");
        assertThat(ex.getCacheDirectory()).isEqualTo("/tmp/cache");
    }

    @Test
    void illegalStateTransitionShouldIncludeStateAndEvent() {
        IllegalStateTransitionException ex =
                new IllegalStateTransitionException(MessageState.DONE, MessageEvent.SKIP);

        assertThat(ex.getFrom()).isEqualTo(MessageState.DONE);
        assertThat(ex.getEvent()).isEqualTo(MessageEvent.SKIP);
        assertThat(ex.getMessage()).contains("DONE").contains("SKIP");
    }

    @Test
    void allExceptionsShouldExtendStreamTalkerException() {
        assertThat(new SynthesisException("x")).isInstanceOf(StreamTalkerException.class);
        assertThat(new CacheStorageException("x", "k", null)).isInstanceOf(StreamTalkerException.class);
        assertThat(new CacheInitializationException("d", null)).isInstanceOf(StreamTalkerException.class);
        assertThat(new MessageNotFoundException(7)).isInstanceOf(StreamTalkerException.class);
        assertThat(new StreamTalkerException("x")).isInstanceOf(RuntimeException.class);
    }
}
