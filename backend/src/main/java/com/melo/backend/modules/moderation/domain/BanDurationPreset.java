package com.melo.backend.modules.moderation.domain;

import java.time.Duration;

public enum BanDurationPreset {
    ONE_HOUR("1h", "1 hour", Duration.ofHours(1)),
    ONE_DAY("24h", "24 hours", Duration.ofHours(24)),
    SEVEN_DAYS("7d", "7 days", Duration.ofDays(7)),
    PERMANENT("permanent", "Permanent", Duration.ZERO);

    private final String key;
    private final String label;
    private final Duration duration;

    BanDurationPreset(String key, String label, Duration duration) {
        this.key = key;
        this.label = label;
        this.duration = duration;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public long durationMs() {
        return duration.toMillis();
    }

    public static BanDurationPreset fromKey(String key) {
        for (BanDurationPreset preset : values()) {
            if (preset.key.equalsIgnoreCase(key)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown ban duration preset: " + key);
    }
}
