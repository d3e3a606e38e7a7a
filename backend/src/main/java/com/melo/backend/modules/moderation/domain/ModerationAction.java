package com.melo.backend.modules.moderation.domain;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModerationAction {
    KICK_USER,
    BAN_USER,
    UNBAN_USER,
    AUTO_UNBAN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModerationAction> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ModerationAction action : values()) {
            if (action.wireName().equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
