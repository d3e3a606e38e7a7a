package com.melo.backend.modules.channel.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a channel permission decision came from, highest precedence first.
 */
public enum PermissionSource {
    CHANNEL_USER("channel-user"),
    CHANNEL_ROLE("channel-role"),
    ROLE("role"),
    DEFAULT("default");

    private final String wireName;

    PermissionSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
