package com.melo.backend.modules.permission.presentation.dto;

import java.util.List;

public record CapabilityCatalogResponse(
        List<CategoryEntry> categories,
        List<TemplateEntry> templates
) {

    public record CategoryEntry(String id, String name, String description, List<CapabilityEntry> capabilities) {
    }

    public record CapabilityEntry(String name, boolean soft, List<RequirementEntry> requirements) {
    }

    public record RequirementEntry(String actionKey, int requiredLevel, boolean stateEvent, String scope) {
    }

    public record TemplateEntry(String id, String name, String description, int recommendedLevel, String color,
                                List<String> capabilities) {
    }
}
