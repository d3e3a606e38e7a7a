package com.melo.backend.modules.channel.domain;

import java.util.Locale;
import java.util.Optional;

public enum BulkOverrideAction {
    /** Sets the listed capabilities to allowed, keeping the target's other entries. */
    ALLOW,
    /** Sets the listed capabilities to denied, keeping the target's other entries. */
    DENY,
    /** Replaces each target's entries with those of {@code copyFromId}. */
    COPY,
    /** Removes each target's override entirely. */
    RESET;

    public static Optional<BulkOverrideAction> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
