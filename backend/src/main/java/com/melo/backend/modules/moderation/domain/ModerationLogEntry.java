package com.melo.backend.modules.moderation.domain;

import java.time.Instant;
import java.util.Map;

public record ModerationLogEntry(
        String id,
        ModerationAction action,
        String moderatorId,
        String targetUserId,
        String reason,
        Instant timestamp,
        Map<String, String> metadata
) {

    public ModerationLogEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
