package com.phillippitts.streamtalker.service.queue;

import com.phillippitts.streamtalker.domain.VoiceExtractionMode;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a voice name off the front of a chat message.
 *
 * <p>A candidate voice that is not in the known-voice set is not a voice: the whole message is
 * returned as text. An empty known-voice set accepts any candidate.
 */
public class VoiceExtractor {

    private static final Pattern BRACKET = Pattern.compile("^\\[([^\\]]+)\\]\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern FIRST_WORD = Pattern.compile("^(\\S+)\\s+(.+)$", Pattern.DOTALL);

    /**
     * @param voice explicitly named voice, canonicalized to the known-voice spelling; empty when
     *              the message does not name one
     * @param text remaining message text, trimmed
     */
    public record Extraction(Optional<String> voice, String text) {
    }

    public Extraction extract(String raw, VoiceExtractionMode mode, Collection<String> knownVoices) {
        String trimmed = raw == null ? "" : raw.strip();
        Matcher matcher = (mode == VoiceExtractionMode.FIRST_WORD ? FIRST_WORD : BRACKET).matcher(trimmed);
        if (!matcher.matches()) {
            return new Extraction(Optional.empty(), trimmed);
        }
        String candidate = matcher.group(1).strip();
        Optional<String> known = resolve(candidate, knownVoices);
        if (known.isEmpty()) {
            return new Extraction(Optional.empty(), trimmed);
        }
        return new Extraction(known, matcher.group(2).strip());
    }

    private static Optional<String> resolve(String candidate, Collection<String> knownVoices) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        if (knownVoices.isEmpty()) {
            return Optional.of(candidate);
        }
        return knownVoices.stream()
                .filter(v -> v.equalsIgnoreCase(candidate))
                .findFirst();
    }
}
