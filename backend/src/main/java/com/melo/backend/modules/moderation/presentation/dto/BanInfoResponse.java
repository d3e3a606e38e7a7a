package com.melo.backend.modules.moderation.presentation.dto;

import com.melo.backend.modules.moderation.domain.BanInfo;

public record BanInfoResponse(
        boolean banned,
        boolean expired,
        BanRecordResponse record
) {

    public static BanInfoResponse from(BanInfo info) {
        return new BanInfoResponse(
                info.banned(),
                info.expired(),
                info.record() != null ? BanRecordResponse.from(info.record()) : null
        );
    }
}
