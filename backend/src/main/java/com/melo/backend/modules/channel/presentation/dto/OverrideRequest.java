package com.melo.backend.modules.channel.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * {@code permissions} maps capability wire names to allowed (true) or denied (false). The
 * request replaces the target's existing entries.
 */
public record OverrideRequest(
        @Size(max = 100, message = "LABEL_TOO_LONG")
        String label,
        @NotNull(message = "PERMISSIONS_REQUIRED")
        Map<String, Boolean> permissions
) {
}
