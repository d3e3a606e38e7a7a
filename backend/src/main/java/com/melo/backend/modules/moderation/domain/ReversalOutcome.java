package com.melo.backend.modules.moderation.domain;

public enum ReversalOutcome {
    /** The target was banned and has been unbanned. */
    REVERSED,
    /** The target was no longer banned; nothing was written. */
    NOT_BANNED
}
