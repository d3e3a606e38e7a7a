package com.melo.backend.modules.moderation.domain;

/**
 * Observation of a user's ban state. {@code record} is null unless {@code banned}.
 */
public record BanInfo(boolean banned, BanRecord record, boolean expired) {

    public static BanInfo notBanned() {
        return new BanInfo(false, null, false);
    }
}
