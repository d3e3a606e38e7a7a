package com.melo.backend.modules.role.domain;

import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

/**
 * Input for creating a role. Nullable fields fall back to level-based defaults; a null
 * capability set is derived from the closest permission template.
 */
public record RoleSpec(
        String name,
        String color,
        RoleIcon icon,
        int level,
        Set<Capability> capabilities,
        Boolean hoist,
        Boolean mentionable
) {
}
