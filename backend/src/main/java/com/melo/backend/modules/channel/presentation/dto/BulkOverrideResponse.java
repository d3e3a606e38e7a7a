package com.melo.backend.modules.channel.presentation.dto;

import java.util.List;

import com.melo.backend.modules.channel.domain.BulkOverrideReport;

public record BulkOverrideResponse(List<String> succeeded, List<FailedTarget> failed) {

    public static BulkOverrideResponse from(BulkOverrideReport report) {
        return new BulkOverrideResponse(
                report.succeeded(),
                report.failed().stream().map(f -> new FailedTarget(f.targetId(), f.error())).toList()
        );
    }

    public record FailedTarget(String targetId, String error) {
    }
}
