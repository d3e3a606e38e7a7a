package com.melo.backend.modules.permission.domain;

import java.util.Set;

public record EffectivePermissions(String roomId, String userId, int level, Set<Capability> capabilities) {
}
