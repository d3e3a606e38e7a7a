package com.melo.backend.modules.channel.domain;

import java.util.List;

public record BulkOverrideReport(List<String> succeeded, List<BulkFailure> failed) {

    public BulkOverrideReport {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public record BulkFailure(String targetId, String error) {
    }
}
