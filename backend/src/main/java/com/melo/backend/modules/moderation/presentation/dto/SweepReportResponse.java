package com.melo.backend.modules.moderation.presentation.dto;

import java.util.List;

import com.melo.backend.modules.moderation.domain.SweepReport;

public record SweepReportResponse(
        int checked,
        int reversed,
        List<SweepErrorResponse> errors
) {

    public static SweepReportResponse from(SweepReport report) {
        return new SweepReportResponse(
                report.checked(),
                report.reversed(),
                report.errors().stream()
                        .map(error -> new SweepErrorResponse(error.target(), error.error()))
                        .toList()
        );
    }

    public record SweepErrorResponse(String userId, String error) {
    }
}
