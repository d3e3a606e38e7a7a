package com.melo.backend.modules.moderation.presentation.dto;

import com.melo.backend.modules.moderation.domain.BanDurationPreset;

public record BanPresetResponse(String key, String label, long durationMs) {

    public static BanPresetResponse from(BanDurationPreset preset) {
        return new BanPresetResponse(preset.key(), preset.label(), preset.durationMs());
    }
}
