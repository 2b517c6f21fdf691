package com.phillippitts.streamtalker.domain;

/**
 * How a voice name is read out of a chat message.
 */
public enum VoiceExtractionMode {
    /** {@code [voice] text} */
    BRACKET,
    /** {@code voice text}: the first token names the voice. */
    FIRST_WORD
}
