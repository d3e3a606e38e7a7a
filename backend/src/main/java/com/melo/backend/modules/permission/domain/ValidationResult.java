package com.melo.backend.modules.permission.domain;

import java.util.List;

public record ValidationResult(boolean valid, int requiredLevel, List<Violation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static ValidationResult of(int requiredLevel, List<Violation> violations) {
        return new ValidationResult(violations.isEmpty(), requiredLevel, violations);
    }

    public boolean hasAuthorizationViolation() {
        return violations.stream().anyMatch(Violation::isAuthorization);
    }
}
