package com.melo.backend.modules.role.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

/**
 * Named role mapped onto an authorization level. Instances are immutable; the {@code with*}
 * methods return modified copies.
 */
public record Role(
        String id,
        String name,
        String color,
        RoleIcon icon,
        int level,
        Set<Capability> capabilities,
        boolean hoist,
        boolean mentionable,
        int memberCount,
        int position,
        boolean defaultRole,
        Instant createdAt
) {

    public Role {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public Role withName(String newName) {
        return new Role(id, newName, color, icon, level, capabilities, hoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withColor(String newColor) {
        return new Role(id, name, newColor, icon, level, capabilities, hoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withIcon(RoleIcon newIcon) {
        return new Role(id, name, color, newIcon, level, capabilities, hoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withLevel(int newLevel) {
        return new Role(id, name, color, icon, newLevel, capabilities, hoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withCapabilities(Set<Capability> newCapabilities) {
        return new Role(id, name, color, icon, level, newCapabilities, hoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withHoist(boolean newHoist) {
        return new Role(id, name, color, icon, level, capabilities, newHoist, mentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withMentionable(boolean newMentionable) {
        return new Role(id, name, color, icon, level, capabilities, hoist, newMentionable, memberCount, position, defaultRole, createdAt);
    }

    public Role withMemberCount(int newMemberCount) {
        return new Role(id, name, color, icon, level, capabilities, hoist, mentionable, newMemberCount, position, defaultRole, createdAt);
    }

    public Role withPosition(int newPosition) {
        return new Role(id, name, color, icon, level, capabilities, hoist, mentionable, memberCount, newPosition, defaultRole, createdAt);
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate.trim());
    }
}
