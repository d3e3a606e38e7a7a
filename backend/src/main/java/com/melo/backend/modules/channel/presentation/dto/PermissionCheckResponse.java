package com.melo.backend.modules.channel.presentation.dto;

import com.melo.backend.modules.channel.domain.PermissionCheck;

public record PermissionCheckResponse(String capability, boolean allowed, String source, String reasoning) {

    public static PermissionCheckResponse from(PermissionCheck check) {
        return new PermissionCheckResponse(
                check.capability().wireName(),
                check.allowed(),
                check.source().wireName(),
                check.reasoning()
        );
    }
}
