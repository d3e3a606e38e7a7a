package com.melo.backend.modules.channel.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

public record BulkOverrideRequest(
        @NotBlank(message = "ACTION_REQUIRED")
        String action,
        @NotBlank(message = "TARGET_TYPE_REQUIRED")
        String targetType,
        @NotEmpty(message = "TARGETS_REQUIRED")
        List<String> targetIds,
        List<String> capabilities,
        String copyFromId
) {
}
