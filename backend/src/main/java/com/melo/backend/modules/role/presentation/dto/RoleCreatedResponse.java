package com.melo.backend.modules.role.presentation.dto;

public record RoleCreatedResponse(String roleId) {
}
