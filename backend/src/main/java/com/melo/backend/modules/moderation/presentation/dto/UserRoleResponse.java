package com.melo.backend.modules.moderation.presentation.dto;

import com.melo.backend.modules.moderation.domain.ModerationRole;

public record UserRoleResponse(String userId, ModerationRole role) {
}
