package com.phillippitts.streamtalker.presentation.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record VoicesRequest(@NotNull List<String> voices) {
}
