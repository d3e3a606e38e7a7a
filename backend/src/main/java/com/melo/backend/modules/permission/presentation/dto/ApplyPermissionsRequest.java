package com.melo.backend.modules.permission.presentation.dto;

import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ApplyPermissionsRequest(
        @NotNull(message = "CAPABILITIES_REQUIRED")
        Set<Capability> capabilities,
        @Min(value = 0, message = "BASELINE_OUT_OF_RANGE")
        @Max(value = 100, message = "BASELINE_OUT_OF_RANGE")
        Integer baseline
) {
}
