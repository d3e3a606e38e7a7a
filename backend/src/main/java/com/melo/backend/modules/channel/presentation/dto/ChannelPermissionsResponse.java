package com.melo.backend.modules.channel.presentation.dto;

import java.time.Instant;
import java.util.List;

import com.melo.backend.modules.channel.domain.ChannelPermissions;

public record ChannelPermissionsResponse(
        String channelId,
        List<OverrideResponse> roleOverrides,
        List<OverrideResponse> userOverrides,
        boolean inheritFromParent,
        Instant lastUpdated,
        String lastUpdatedBy,
        long version
) {

    public static ChannelPermissionsResponse from(ChannelPermissions permissions) {
        return new ChannelPermissionsResponse(
                permissions.channelId(),
                permissions.roleOverrides().stream().map(OverrideResponse::from).toList(),
                permissions.userOverrides().stream().map(OverrideResponse::from).toList(),
                permissions.inheritFromParent(),
                permissions.lastUpdated(),
                permissions.lastUpdatedBy(),
                permissions.version()
        );
    }
}
