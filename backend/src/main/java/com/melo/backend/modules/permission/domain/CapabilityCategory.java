package com.melo.backend.modules.permission.domain;

/**
 * Grouping used to present capabilities; it carries no authorization meaning.
 */
public enum CapabilityCategory {
    GENERAL("general", "General Permissions", "Basic server and channel access"),
    TEXT("text", "Text Permissions", "Text channel and messaging permissions"),
    VOICE("voice", "Voice Permissions", "Voice and video channel permissions"),
    MODERATION("moderation", "Moderation Permissions", "Member and content moderation"),
    MANAGEMENT("management", "Management Permissions", "Server and role management");

    private final String wireName;
    private final String displayName;
    private final String description;

    CapabilityCategory(String wireName, String displayName, String description) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }
}
