package com.melo.backend.modules.role.domain;

public record RolePosition(String roleId, int position) {
}
