package com.melo.backend.modules.permission.presentation.dto;

import java.util.List;

import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.EffectivePermissions;

public record EffectivePermissionsResponse(String roomId, String userId, int level, List<Capability> capabilities) {

    public static EffectivePermissionsResponse from(EffectivePermissions permissions) {
        return new EffectivePermissionsResponse(
                permissions.roomId(),
                permissions.userId(),
                permissions.level(),
                List.copyOf(permissions.capabilities())
        );
    }
}
