package com.melo.backend.modules.channel.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-channel overrides kept in the channel room's account data. {@code version} counts writes;
 * a channel that never had overrides reads as {@link #empty(String)} with version 0.
 */
public record ChannelPermissions(
        String channelId,
        List<PermissionOverride> roleOverrides,
        List<PermissionOverride> userOverrides,
        boolean inheritFromParent,
        Instant lastUpdated,
        String lastUpdatedBy,
        long version
) {

    public static final String ACCOUNT_DATA_KEY = "dev.haos.channel_permissions";

    public ChannelPermissions {
        roleOverrides = List.copyOf(roleOverrides);
        userOverrides = List.copyOf(userOverrides);
    }

    public static ChannelPermissions empty(String channelId) {
        return new ChannelPermissions(channelId, List.of(), List.of(), true, null, null, 0);
    }

    public List<PermissionOverride> overrides(OverrideTarget target) {
        return target == OverrideTarget.ROLE ? roleOverrides : userOverrides;
    }

    public Optional<PermissionOverride> find(OverrideTarget target, String targetId) {
        return overrides(target).stream()
                .filter(entry -> entry.targetId().equals(targetId))
                .findFirst();
    }

    /** Replaces the entry for the same target, or appends when there is none. */
    public ChannelPermissions withOverride(OverrideTarget target, PermissionOverride override) {
        List<PermissionOverride> updated = new ArrayList<>(overrides(target));
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).targetId().equals(override.targetId())) {
                updated.set(i, override);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            updated.add(override);
        }
        return withList(target, updated);
    }

    public ChannelPermissions withoutOverride(OverrideTarget target, String targetId) {
        List<PermissionOverride> updated = overrides(target).stream()
                .filter(entry -> !entry.targetId().equals(targetId))
                .toList();
        return withList(target, updated);
    }

    /** Stamps a write: bumps the version and records who made it. */
    public ChannelPermissions touched(String actor, Instant at) {
        return new ChannelPermissions(channelId, roleOverrides, userOverrides, inheritFromParent, at, actor, version + 1);
    }

    private ChannelPermissions withList(OverrideTarget target, List<PermissionOverride> updated) {
        return target == OverrideTarget.ROLE
                ? new ChannelPermissions(channelId, updated, userOverrides, inheritFromParent, lastUpdated, lastUpdatedBy, version)
                : new ChannelPermissions(channelId, roleOverrides, updated, inheritFromParent, lastUpdated, lastUpdatedBy, version);
    }
}
