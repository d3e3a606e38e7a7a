package com.melo.backend.modules.permission.presentation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.melo.backend.global.error.ProblemException;
import com.melo.backend.global.security.SecurityUtils;
import com.melo.backend.modules.permission.application.AuthorizationModel;
import com.melo.backend.modules.permission.application.RoomPermissionService;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.CapabilityCategory;
import com.melo.backend.modules.permission.domain.CapabilityMappings;
import com.melo.backend.modules.permission.domain.PermissionTemplate;
import com.melo.backend.modules.permission.presentation.dto.ApplyPermissionsRequest;
import com.melo.backend.modules.permission.presentation.dto.CapabilityCatalogResponse;
import com.melo.backend.modules.permission.presentation.dto.CapabilityCatalogResponse.CapabilityEntry;
import com.melo.backend.modules.permission.presentation.dto.CapabilityCatalogResponse.CategoryEntry;
import com.melo.backend.modules.permission.presentation.dto.CapabilityCatalogResponse.RequirementEntry;
import com.melo.backend.modules.permission.presentation.dto.CapabilityCatalogResponse.TemplateEntry;
import com.melo.backend.modules.permission.presentation.dto.CapabilityListRequest;
import com.melo.backend.modules.permission.presentation.dto.EffectivePermissionsResponse;
import com.melo.backend.modules.permission.presentation.dto.RequiredLevelResponse;
import com.melo.backend.modules.permission.presentation.dto.ValidatePermissionsRequest;
import com.melo.backend.modules.permission.presentation.dto.ValidationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class PermissionController {

    private final AuthorizationModel authorizationModel;
    private final RoomPermissionService roomPermissionService;

    public PermissionController(AuthorizationModel authorizationModel, RoomPermissionService roomPermissionService) {
        this.authorizationModel = authorizationModel;
        this.roomPermissionService = roomPermissionService;
    }

    @Operation(summary = "Capability catalog", description = "Categories, protocol requirements and role templates.")
    @GetMapping("/permissions/catalog")
    public ResponseEntity<CapabilityCatalogResponse> getCatalog() {
        List<CategoryEntry> categories = new ArrayList<>();
        for (CapabilityCategory category : CapabilityCategory.values()) {
            List<CapabilityEntry> capabilities = Arrays.stream(Capability.values())
                    .filter(capability -> capability.category() == category)
                    .map(capability -> new CapabilityEntry(
                            capability.wireName(),
                            CapabilityMappings.isSoft(capability),
                            CapabilityMappings.requirementsFor(capability).stream()
                                    .map(r -> new RequirementEntry(r.actionKey(), r.requiredLevel(), r.durableState(),
                                            r.scope().name().toLowerCase()))
                                    .toList()))
                    .toList();
            categories.add(new CategoryEntry(category.wireName(), category.displayName(), category.description(), capabilities));
        }
        List<TemplateEntry> templates = Arrays.stream(PermissionTemplate.values())
                .map(template -> new TemplateEntry(
                        template.id(),
                        template.displayName(),
                        template.description(),
                        template.recommendedLevel(),
                        template.color(),
                        template.capabilities().stream().map(Capability::wireName).toList()))
                .toList();
        return ResponseEntity.ok(new CapabilityCatalogResponse(categories, templates));
    }

    @Operation(summary = "Minimum level for a capability set")
    @PostMapping("/permissions/required-level")
    public ResponseEntity<RequiredLevelResponse> requiredLevel(@Valid @RequestBody CapabilityListRequest request) {
        int required = authorizationModel.requiredLevel(request.capabilities());
        return ResponseEntity.ok(new RequiredLevelResponse(required, PermissionTemplate.closestTo(required).id()));
    }

    @Operation(summary = "Validate a capability set against a level", description = "Returns every violation found.")
    @PostMapping("/permissions/validation")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody ValidatePermissionsRequest request) {
        return ResponseEntity.ok(ValidationResponse.from(
                authorizationModel.validate(request.capabilities(), request.level())));
    }

    @Operation(summary = "Capabilities held at a level, without room overrides")
    @GetMapping("/permissions/effective")
    public ResponseEntity<EffectivePermissionsResponse> effectiveAtLevel(
            @Parameter(description = "Authorization level 0..100")
            @RequestParam(name = "level") @Min(0) @Max(100) int level
    ) {
        List<Capability> capabilities = List.copyOf(authorizationModel.effectiveCapabilities(level, null));
        return ResponseEntity.ok(new EffectivePermissionsResponse(null, null, level, capabilities));
    }

    @Operation(summary = "Apply a capability set to a room's level document")
    @PutMapping("/rooms/{roomId}/permissions")
    public ResponseEntity<JsonNode> applyToRoom(
            @PathVariable("roomId") String roomId,
            @Valid @RequestBody ApplyPermissionsRequest request
    ) {
        int baseline = Objects.requireNonNullElse(request.baseline(), 0);
        return ResponseEntity.ok(ProblemException.unwrap(roomPermissionService.applyCapabilities(
                roomId, SecurityUtils.getCurrentUserId(), request.capabilities(), baseline)).toJson());
    }

    @Operation(summary = "Effective capabilities of a member in a room")
    @GetMapping("/rooms/{roomId}/members/{userId}/permissions")
    public ResponseEntity<EffectivePermissionsResponse> memberPermissions(
            @PathVariable("roomId") String roomId,
            @PathVariable("userId") String userId
    ) {
        return ResponseEntity.ok(EffectivePermissionsResponse.from(
                ProblemException.unwrap(roomPermissionService.effectiveCapabilities(roomId, userId))));
    }
}
