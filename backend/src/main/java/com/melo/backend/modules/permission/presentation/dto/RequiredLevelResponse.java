package com.melo.backend.modules.permission.presentation.dto;

public record RequiredLevelResponse(int requiredLevel, String closestTemplate) {
}
