package com.phillippitts.streamtalker.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Chat text to read; a leading {@code [voice]} selects the voice.
 */
public record EnqueueRequest(
        @NotBlank @Size(max = 2000) String text,
        String username,
        String platform
) {
}
