package com.melo.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code preset} wins over {@code durationMs}; neither means a permanent ban.
 */
public record BanRequest(
        @NotBlank(message = "USER_ID_REQUIRED")
        String userId,
        @Size(max = 500, message = "REASON_TOO_LONG")
        String reason,
        Long durationMs,
        String preset
) {
}
