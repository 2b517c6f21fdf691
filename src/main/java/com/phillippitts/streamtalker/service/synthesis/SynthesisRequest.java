package com.phillippitts.streamtalker.service.synthesis;

import com.phillippitts.streamtalker.domain.QueuedMessage;
import com.phillippitts.streamtalker.domain.SynthesisParameters;

import java.util.Objects;

/**
 * One text to synthesize.
 */
public record SynthesisRequest(String text, String voice, SynthesisParameters parameters) {

    public SynthesisRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        Objects.requireNonNull(parameters, "parameters");
    }

    public static SynthesisRequest of(QueuedMessage message) {
        return new SynthesisRequest(message.text(), message.voice(), message.parameters());
    }
}
