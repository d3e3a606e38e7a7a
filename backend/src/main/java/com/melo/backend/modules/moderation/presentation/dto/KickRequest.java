package com.melo.backend.modules.moderation.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record KickRequest(
        @NotBlank(message = "USER_ID_REQUIRED")
        String userId,
        @Size(max = 500, message = "REASON_TOO_LONG")
        String reason
) {
}
