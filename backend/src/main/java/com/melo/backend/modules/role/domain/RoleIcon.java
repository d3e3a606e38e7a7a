package com.melo.backend.modules.role.domain;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RoleIcon {
    CROWN,
    HAMMER,
    SHIELD,
    USERS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoleIcon> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (RoleIcon icon : values()) {
            if (icon.name().equals(normalized)) {
                return Optional.of(icon);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static RoleIcon fromJson(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("Unknown role icon: " + value));
    }

    public static RoleIcon defaultForLevel(int level) {
        if (level >= 100) {
            return CROWN;
        }
        if (level >= 50) {
            return HAMMER;
        }
        if (level >= 25) {
            return SHIELD;
        }
        return USERS;
    }
}
