package com.melo.backend.modules.role.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record ReorderRolesRequest(
        @NotEmpty(message = "POSITIONS_REQUIRED")
        List<@Valid PositionEntry> positions
) {

    public record PositionEntry(
            @NotBlank(message = "ROLE_ID_REQUIRED")
            String roleId,
            @NotNull(message = "POSITION_REQUIRED")
            @Min(value = 1, message = "POSITION_OUT_OF_RANGE")
            Integer position
    ) {
    }
}
