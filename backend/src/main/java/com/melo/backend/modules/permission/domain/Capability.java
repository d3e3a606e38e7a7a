package com.melo.backend.modules.permission.domain;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of named permissions a role can hold.
 */
public enum Capability {
    MANAGE_SERVER(CapabilityCategory.MANAGEMENT),
    MANAGE_ROLES(CapabilityCategory.MANAGEMENT),
    MANAGE_CHANNELS(CapabilityCategory.MANAGEMENT),
    MANAGE_SERVER_SETTINGS(CapabilityCategory.MANAGEMENT),
    VIEW_SERVER_INSIGHTS(CapabilityCategory.MANAGEMENT),
    KICK_MEMBERS(CapabilityCategory.MODERATION),
    BAN_MEMBERS(CapabilityCategory.MODERATION),
    TIMEOUT_MEMBERS(CapabilityCategory.MODERATION),
    MOVE_MEMBERS(CapabilityCategory.MODERATION),
    MANAGE_MEMBER_ROLES(CapabilityCategory.MANAGEMENT),
    VIEW_CHANNELS(CapabilityCategory.GENERAL),
    SEND_MESSAGES(CapabilityCategory.TEXT),
    SEND_MESSAGES_IN_THREADS(CapabilityCategory.TEXT),
    CREATE_PUBLIC_THREADS(CapabilityCategory.TEXT),
    CREATE_PRIVATE_THREADS(CapabilityCategory.TEXT),
    EMBED_LINKS(CapabilityCategory.TEXT),
    ATTACH_FILES(CapabilityCategory.TEXT),
    ADD_REACTIONS(CapabilityCategory.TEXT),
    USE_EXTERNAL_EMOJIS(CapabilityCategory.TEXT),
    READ_MESSAGE_HISTORY(CapabilityCategory.TEXT),
    CONNECT(CapabilityCategory.VOICE),
    SPEAK(CapabilityCategory.VOICE),
    USE_VOICE_ACTIVATION(CapabilityCategory.VOICE),
    SHARE_SCREEN(CapabilityCategory.VOICE),
    USE_VIDEO(CapabilityCategory.VOICE),
    MANAGE_MESSAGES(CapabilityCategory.MODERATION),
    PIN_MESSAGES(CapabilityCategory.MODERATION),
    MENTION_EVERYONE(CapabilityCategory.MODERATION),
    CREATE_INVITES(CapabilityCategory.GENERAL),
    USE_SLASH_COMMANDS(CapabilityCategory.GENERAL),
    CHANGE_NICKNAME(CapabilityCategory.GENERAL),
    MANAGE_NICKNAMES(CapabilityCategory.MODERATION),
    ADMINISTRATOR(CapabilityCategory.MANAGEMENT);

    private final CapabilityCategory category;

    Capability(CapabilityCategory category) {
        this.category = category;
    }

    public CapabilityCategory category() {
        return category;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Capability> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Capability capability : values()) {
            if (capability.name().equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Capability fromJson(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + value));
    }
}
