package com.melo.backend.modules.permission.presentation.dto;

import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

import jakarta.validation.constraints.NotNull;

public record CapabilityListRequest(
        @NotNull(message = "CAPABILITIES_REQUIRED")
        Set<Capability> capabilities
) {
}
