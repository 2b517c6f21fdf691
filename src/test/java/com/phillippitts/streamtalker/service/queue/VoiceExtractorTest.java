package com.phillippitts.streamtalker.service.queue;

import com.phillippitts.streamtalker.domain.VoiceExtractionMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceExtractorTest {

    private static final Set<String> KNOWN = Set.of("Bob", "Alice");

    private final VoiceExtractor extractor = new VoiceExtractor();

    @Test
    void extractsBracketedVoice() {
        VoiceExtractor.Extraction e = extractor.extract("[bob] hello there", VoiceExtractionMode.BRACKET, KNOWN);

        assertThat(e.voice()).contains("Bob");
        assertThat(e.text()).isEqualTo("hello there");
    }

    @Test
    void unknownBracketedVoiceStaysInText() {
        VoiceExtractor.Extraction e = extractor.extract("[carol] hi", VoiceExtractionMode.BRACKET, KNOWN);

        assertThat(e.voice()).isEmpty();
        assertThat(e.text()).isEqualTo("[carol] hi");
    }

    @Test
    void emptyKnownSetAcceptsAnyVoice() {
        VoiceExtractor.Extraction e = extractor.extract("[carol] hi", VoiceExtractionMode.BRACKET, List.of());

        assertThat(e.voice()).contains("carol");
        assertThat(e.text()).isEqualTo("hi");
    }

    @Test
    void plainMessageHasNoVoice() {
        VoiceExtractor.Extraction e = extractor.extract("  just chatting  ", VoiceExtractionMode.BRACKET, KNOWN);

        assertThat(e.voice()).isEmpty();
        assertThat(e.text()).isEqualTo("just chatting");
    }

    @Test
    void firstWordModeUsesLeadingWord() {
        VoiceExtractor.Extraction e = extractor.extract("alice good\nmorning", VoiceExtractionMode.FIRST_WORD, KNOWN);

        assertThat(e.voice()).contains("Alice");
        assertThat(e.text()).isEqualTo("good\nmorning");
    }

    @Test
    void firstWordModeIgnoresOrdinaryWords() {
        VoiceExtractor.Extraction e = extractor.extract("hello world", VoiceExtractionMode.FIRST_WORD, KNOWN);

        assertThat(e.voice()).isEmpty();
        assertThat(e.text()).isEqualTo("hello world");
    }

    @Test
    void voiceWithNothingAfterItLeavesEmptyText() {
        VoiceExtractor.Extraction e = extractor.extract("[bob]", VoiceExtractionMode.BRACKET, KNOWN);

        assertThat(e.voice()).contains("Bob");
        assertThat(e.text()).isEmpty();
    }

    @Test
    void nullInputIsEmptyText() {
        assertThat(extractor.extract(null, VoiceExtractionMode.BRACKET, KNOWN).text()).isEmpty();
    }
}
