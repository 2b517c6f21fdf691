package com.phillippitts.streamtalker.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Body of the single-value setters (volume, delay, batch size, cache limit).
 */
public record ValueRequest(@NotNull Integer value) {
}
