package com.melo.backend.modules.permission.domain;

public enum ViolationType {
    LEVEL_OUT_OF_RANGE(ViolationKind.AUTHORIZATION),
    LEVEL_BELOW_REQUIRED(ViolationKind.AUTHORIZATION),
    ADMINISTRATOR_REQUIRES_FULL_LEVEL(ViolationKind.AUTHORIZATION),
    MANAGE_ROLES_REQUIRES_MODERATOR(ViolationKind.AUTHORIZATION),
    SEND_WITHOUT_VIEW(ViolationKind.CONSISTENCY);

    private final ViolationKind kind;

    ViolationType(ViolationKind kind) {
        this.kind = kind;
    }

    public ViolationKind kind() {
        return kind;
    }

    public enum ViolationKind {
        AUTHORIZATION,
        CONSISTENCY
    }
}
