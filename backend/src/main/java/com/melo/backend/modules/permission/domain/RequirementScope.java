package com.melo.backend.modules.permission.domain;

public enum RequirementScope {
    ROOM,
    SPACE,
    BOTH
}
