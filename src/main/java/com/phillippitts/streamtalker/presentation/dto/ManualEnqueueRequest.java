package com.phillippitts.streamtalker.presentation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Text with an explicit voice; unset parameters use the current defaults.
 */
public record ManualEnqueueRequest(
        @NotBlank @Size(max = 2000) String text,
        @NotBlank String voice,
        String model,
        String language,
        @DecimalMin("0.25") @DecimalMax("4.0") Double speed,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
        @Min(1) @Max(8192) Integer maxNewTokens,
        @DecimalMin("0.5") @DecimalMax("2.0") Double repetitionPenalty
) {
}
