package com.melo.backend.modules.role.presentation.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.role.domain.Role;
import com.melo.backend.modules.role.domain.RoleIcon;

public record RoleResponse(
        String id,
        String name,
        String color,
        RoleIcon icon,
        int level,
        List<Capability> capabilities,
        boolean hoist,
        boolean mentionable,
        int memberCount,
        int position,
        @JsonProperty("isDefault")
        boolean isDefault,
        Instant createdAt
) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.id(),
                role.name(),
                role.color(),
                role.icon(),
                role.level(),
                List.copyOf(role.capabilities()),
                role.hoist(),
                role.mentionable(),
                role.memberCount(),
                role.position(),
                role.defaultRole(),
                role.createdAt()
        );
    }
}
