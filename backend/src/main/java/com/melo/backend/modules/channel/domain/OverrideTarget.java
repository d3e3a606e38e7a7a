package com.melo.backend.modules.channel.domain;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverrideTarget {
    ROLE,
    USER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<OverrideTarget> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (OverrideTarget target : values()) {
            if (target.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
