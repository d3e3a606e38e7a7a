package com.melo.backend.modules.moderation.domain;

import java.util.List;

public record SweepReport(int checked, int reversed, List<SweepError> errors) {

    public SweepReport {
        errors = List.copyOf(errors);
    }

    public record SweepError(String target, String error) {
    }
}
