package com.melo.backend.modules.moderation.presentation.dto;

import java.time.Instant;
import java.util.Map;

import com.melo.backend.modules.moderation.domain.ModerationLogEntry;

public record ModerationLogResponse(
        String id,
        String action,
        String moderatorId,
        String targetUserId,
        String reason,
        Instant timestamp,
        Map<String, String> metadata
) {

    public static ModerationLogResponse from(ModerationLogEntry entry) {
        return new ModerationLogResponse(
                entry.id(),
                entry.action().wireName(),
                entry.moderatorId(),
                entry.targetUserId(),
                entry.reason(),
                entry.timestamp(),
                entry.metadata()
        );
    }
}
