package com.melo.backend.modules.channel.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.melo.backend.modules.permission.domain.Capability;

/**
 * Explicit allow/deny entries for one role or one user in one channel. Capabilities absent from
 * {@code permissions} fall through to the next source.
 */
public record PermissionOverride(
        String targetId,
        String label,
        Map<Capability, Boolean> permissions,
        Instant createdAt,
        String createdBy
) {

    public PermissionOverride {
        EnumMap<Capability, Boolean> copy = new EnumMap<>(Capability.class);
        copy.putAll(permissions);
        permissions = Collections.unmodifiableMap(copy);
    }

    public PermissionOverride withPermissions(String updatedLabel, Map<Capability, Boolean> updated) {
        return new PermissionOverride(targetId, updatedLabel, updated, createdAt, createdBy);
    }
}
