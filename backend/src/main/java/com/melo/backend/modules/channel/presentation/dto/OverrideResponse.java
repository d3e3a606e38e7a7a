package com.melo.backend.modules.channel.presentation.dto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.melo.backend.modules.channel.domain.PermissionOverride;

public record OverrideResponse(
        String targetId,
        String label,
        Map<String, Boolean> permissions,
        Instant createdAt,
        String createdBy
) {

    public static OverrideResponse from(PermissionOverride override) {
        Map<String, Boolean> permissions = new LinkedHashMap<>();
        override.permissions().forEach((capability, allowed) -> permissions.put(capability.wireName(), allowed));
        return new OverrideResponse(
                override.targetId(),
                override.label(),
                permissions,
                override.createdAt(),
                override.createdBy()
        );
    }
}
