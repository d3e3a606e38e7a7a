package com.melo.backend.modules.moderation.domain;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Durable metadata of an active ban, stored as room state keyed by the target user.
 *
 * <p>{@code expiresAt} keeps the stored text so a malformed value survives a round trip and
 * can be told apart from a permanent ban.
 */
public record BanRecord(
        int schemaVersion,
        String targetUserId,
        String bannedBy,
        String reason,
        Instant bannedAt,
        long durationMs,
        String expiresAt
) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static BanRecord create(String targetUserId, String bannedBy, String reason, Instant bannedAt, long durationMs) {
        boolean timed = durationMs > 0;
        return new BanRecord(
                CURRENT_SCHEMA_VERSION,
                targetUserId,
                bannedBy,
                reason,
                bannedAt,
                timed ? durationMs : 0L,
                timed ? bannedAt.plusMillis(durationMs).toString() : null
        );
    }

    public boolean isPermanent() {
        return expiresAt == null;
    }

    /**
     * Parsed expiry; empty for permanent bans and for values that do not parse.
     */
    public Optional<Instant> expiryInstant() {
        if (expiresAt == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(expiresAt));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public boolean hasMalformedExpiry() {
        return expiresAt != null && expiryInstant().isEmpty();
    }

    /**
     * True only for a well-formed expiry at or before {@code now}. Malformed values never expire.
     */
    public boolean isExpiredAt(Instant now) {
        return expiryInstant().map(expiry -> !now.isBefore(expiry)).orElse(false);
    }
}
