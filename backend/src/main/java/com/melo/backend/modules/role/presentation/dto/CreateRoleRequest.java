package com.melo.backend.modules.role.presentation.dto;

import java.util.Set;

import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.role.domain.RoleIcon;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 32, message = "NAME_TOO_LONG")
        String name,
        @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "INVALID_COLOR")
        String color,
        RoleIcon icon,
        @NotNull(message = "LEVEL_REQUIRED")
        @Min(value = 0, message = "LEVEL_OUT_OF_RANGE")
        @Max(value = 100, message = "LEVEL_OUT_OF_RANGE")
        Integer level,
        Set<Capability> capabilities,
        Boolean hoist,
        Boolean mentionable
) {
}
