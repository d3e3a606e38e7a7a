package com.melo.backend.modules.permission.presentation.dto;

import java.util.List;

import com.melo.backend.modules.permission.domain.ValidationResult;

public record ValidationResponse(boolean valid, int requiredLevel, List<ViolationResponse> violations) {

    public static ValidationResponse from(ValidationResult result) {
        return new ValidationResponse(
                result.valid(),
                result.requiredLevel(),
                result.violations().stream()
                        .map(v -> new ViolationResponse(v.type().name(), v.kind().name(), v.message()))
                        .toList()
        );
    }

    public record ViolationResponse(String type, String kind, String message) {
    }
}
