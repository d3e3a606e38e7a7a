package com.melo.backend.modules.permission.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Preset capability sets offered when a role is created without explicit capabilities.
 */
public enum PermissionTemplate {

    ADMIN("admin", "Administrator", "Full server control with all permissions", 100, "#f04747",
            EnumSet.allOf(Capability.class)),

    MODERATOR("moderator", "Moderator", "Can moderate members and manage channels", 50, "#7289da",
            EnumSet.complementOf(EnumSet.of(
                    Capability.MANAGE_SERVER,
                    Capability.MANAGE_ROLES,
                    Capability.MANAGE_SERVER_SETTINGS,
                    Capability.MANAGE_MEMBER_ROLES,
                    Capability.ADMINISTRATOR))),

    MEMBER("member", "Member", "Standard member permissions for regular users", 0, "#99aab5",
            EnumSet.of(
                    Capability.VIEW_CHANNELS,
                    Capability.SEND_MESSAGES,
                    Capability.SEND_MESSAGES_IN_THREADS,
                    Capability.CREATE_PUBLIC_THREADS,
                    Capability.EMBED_LINKS,
                    Capability.ATTACH_FILES,
                    Capability.ADD_REACTIONS,
                    Capability.USE_EXTERNAL_EMOJIS,
                    Capability.READ_MESSAGE_HISTORY,
                    Capability.CONNECT,
                    Capability.SPEAK,
                    Capability.USE_VOICE_ACTIVATION,
                    Capability.USE_VIDEO,
                    Capability.USE_SLASH_COMMANDS,
                    Capability.CHANGE_NICKNAME));

    private final String id;
    private final String displayName;
    private final String description;
    private final int recommendedLevel;
    private final String color;
    private final Set<Capability> capabilities;

    PermissionTemplate(String id, String displayName, String description, int recommendedLevel, String color,
                       EnumSet<Capability> capabilities) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.recommendedLevel = recommendedLevel;
        this.color = color;
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public int recommendedLevel() {
        return recommendedLevel;
    }

    public String color() {
        return color;
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    /**
     * Highest template whose recommended level does not exceed {@code level}, so a derived
     * capability set never needs more than the role holds.
     */
    public static PermissionTemplate closestTo(int level) {
        if (level >= ADMIN.recommendedLevel) {
            return ADMIN;
        }
        if (level >= MODERATOR.recommendedLevel) {
            return MODERATOR;
        }
        return MEMBER;
    }
}
