package com.phillippitts.streamtalker.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Chat message or reward redemption forwarded by a chat connector.
 */
public record ChatEventRequest(
        @NotBlank String username,
        @NotBlank String platform,
        @NotNull String text,
        String rewardId
) {
}
