package com.melo.backend.modules.role.domain;

import java.util.Optional;

public final class RoleNames {

    public static final int MAX_LENGTH = 32;

    private RoleNames() {
    }

    /**
     * Reason the name is unusable, or empty when it is fine.
     */
    public static Optional<String> validate(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.of("Role name cannot be empty");
        }
        if (name.trim().length() > MAX_LENGTH) {
            return Optional.of("Role name cannot exceed " + MAX_LENGTH + " characters");
        }
        if (name.contains("@")) {
            return Optional.of("Role name cannot contain @ symbol");
        }
        return Optional.empty();
    }
}
