package com.melo.backend.global.protocol;

import java.util.Locale;

/**
 * Membership state of a user in a room, as carried by {@code m.room.member} events.
 */
public enum Membership {
    JOIN("join"),
    INVITE("invite"),
    LEAVE("leave"),
    BAN("ban"),
    KNOCK("knock"),
    UNKNOWN("unknown");

    private final String wireValue;

    Membership(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Membership fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Membership membership : values()) {
            if (membership.wireValue.equals(normalized)) {
                return membership;
            }
        }
        return UNKNOWN;
    }
}
