package com.melo.backend.modules.role.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Versioned role list kept in room account data.
 */
public record RoleDocument(String version, List<Role> roles) {

    public static final String ACCOUNT_DATA_KEY = "dev.haos.custom_roles";
    public static final String CURRENT_VERSION = "1.0.0";

    public RoleDocument {
        roles = List.copyOf(roles);
    }

    public static RoleDocument empty() {
        return new RoleDocument(CURRENT_VERSION, List.of());
    }

    public RoleDocument withRoles(List<Role> updated) {
        return new RoleDocument(CURRENT_VERSION, updated);
    }

    public List<Role> rolesByPosition() {
        return roles.stream()
                .sorted(Comparator.comparingInt(Role::position).thenComparing(Role::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .toList();
    }
}
