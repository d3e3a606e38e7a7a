package com.melo.backend.modules.permission.domain;

public record Violation(ViolationType type, String message) {

    public ViolationType.ViolationKind kind() {
        return type.kind();
    }

    public boolean isAuthorization() {
        return type.kind() == ViolationType.ViolationKind.AUTHORIZATION;
    }
}
