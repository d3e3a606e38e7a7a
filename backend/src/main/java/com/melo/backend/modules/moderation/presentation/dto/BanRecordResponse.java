package com.melo.backend.modules.moderation.presentation.dto;

import java.time.Instant;

import com.melo.backend.modules.moderation.domain.BanRecord;

public record BanRecordResponse(
        String userId,
        String bannedBy,
        String reason,
        Instant bannedAt,
        long durationMs,
        String expiresAt,
        boolean permanent
) {

    public static BanRecordResponse from(BanRecord record) {
        return new BanRecordResponse(
                record.targetUserId(),
                record.bannedBy(),
                record.reason(),
                record.bannedAt(),
                record.durationMs(),
                record.expiresAt(),
                record.isPermanent()
        );
    }
}
