package com.melo.backend.modules.role.domain;

import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

/**
 * Partial update; null fields are left unchanged.
 */
public record RolePatch(
        String name,
        String color,
        RoleIcon icon,
        Integer level,
        Set<Capability> capabilities,
        Boolean hoist,
        Boolean mentionable
) {
}
