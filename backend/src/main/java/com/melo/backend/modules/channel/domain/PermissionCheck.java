package com.melo.backend.modules.channel.domain;

import com.melo.backend.modules.permission.domain.Capability;

public record PermissionCheck(Capability capability, boolean allowed, PermissionSource source, String reasoning) {
}
