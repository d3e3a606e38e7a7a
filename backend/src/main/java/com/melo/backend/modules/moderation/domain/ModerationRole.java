package com.melo.backend.modules.moderation.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModerationRole {
    ADMIN,
    MODERATOR,
    MEMBER;

    public static ModerationRole fromLevel(int level) {
        if (level >= 100) {
            return ADMIN;
        }
        if (level >= 50) {
            return MODERATOR;
        }
        return MEMBER;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
