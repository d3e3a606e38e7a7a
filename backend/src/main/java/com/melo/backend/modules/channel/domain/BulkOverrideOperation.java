package com.melo.backend.modules.channel.domain;

import java.util.List;
import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;

public record BulkOverrideOperation(
        BulkOverrideAction action,
        OverrideTarget targetType,
        List<String> targetIds,
        Set<Capability> capabilities,
        String copyFromId
) {

    public BulkOverrideOperation {
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
