package com.melo.backend.modules.channel.presentation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.melo.backend.global.error.ProblemException;
import com.melo.backend.global.security.SecurityUtils;
import com.melo.backend.modules.channel.application.ChannelPermissionService;
import com.melo.backend.modules.channel.domain.BulkOverrideAction;
import com.melo.backend.modules.channel.domain.BulkOverrideOperation;
import com.melo.backend.modules.channel.domain.ChannelPermissions;
import com.melo.backend.modules.channel.domain.HeldRole;
import com.melo.backend.modules.channel.domain.OverrideTarget;
import com.melo.backend.modules.channel.presentation.dto.BulkOverrideRequest;
import com.melo.backend.modules.channel.presentation.dto.BulkOverrideResponse;
import com.melo.backend.modules.channel.presentation.dto.ChannelPermissionsResponse;
import com.melo.backend.modules.channel.presentation.dto.OverrideRequest;
import com.melo.backend.modules.channel.presentation.dto.PermissionCheckResponse;
import com.melo.backend.modules.permission.domain.Capability;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/channels/{channelId}")
public class ChannelPermissionController {

    private final ChannelPermissionService channelPermissionService;

    public ChannelPermissionController(ChannelPermissionService channelPermissionService) {
        this.channelPermissionService = channelPermissionService;
    }

    @Operation(summary = "Channel overrides")
    @GetMapping("/permissions")
    public ResponseEntity<ChannelPermissionsResponse> getOverrides(@PathVariable("channelId") String channelId) {
        return ResponseEntity.ok(ChannelPermissionsResponse.from(
                ProblemException.unwrap(channelPermissionService.getChannelPermissions(channelId))));
    }

    @Operation(summary = "Set a role override", description = "Replaces the role's entries in this channel.")
    @PutMapping("/permissions/roles/{roleId}")
    public ResponseEntity<ChannelPermissionsResponse> setRoleOverride(
            @PathVariable("channelId") String channelId,
            @PathVariable("roleId") String roleId,
            @Valid @RequestBody OverrideRequest request
    ) {
        return setOverride(channelId, OverrideTarget.ROLE, roleId, request);
    }

    @Operation(summary = "Remove a role override")
    @DeleteMapping("/permissions/roles/{roleId}")
    public ResponseEntity<Void> removeRoleOverride(
            @PathVariable("channelId") String channelId,
            @PathVariable("roleId") String roleId
    ) {
        ProblemException.unwrap(channelPermissionService.removeOverride(
                channelId, OverrideTarget.ROLE, roleId, SecurityUtils.getCurrentUserId()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Set a user override", description = "Replaces the user's entries in this channel.")
    @PutMapping("/permissions/users/{userId}")
    public ResponseEntity<ChannelPermissionsResponse> setUserOverride(
            @PathVariable("channelId") String channelId,
            @PathVariable("userId") String userId,
            @Valid @RequestBody OverrideRequest request
    ) {
        return setOverride(channelId, OverrideTarget.USER, userId, request);
    }

    @Operation(summary = "Remove a user override")
    @DeleteMapping("/permissions/users/{userId}")
    public ResponseEntity<Void> removeUserOverride(
            @PathVariable("channelId") String channelId,
            @PathVariable("userId") String userId
    ) {
        ProblemException.unwrap(channelPermissionService.removeOverride(
                channelId, OverrideTarget.USER, userId, SecurityUtils.getCurrentUserId()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Apply one action to many targets",
            description = "Per-target results; a failed write fails every target.")
    @PostMapping("/permissions/bulk")
    public ResponseEntity<BulkOverrideResponse> bulkUpdate(
            @PathVariable("channelId") String channelId,
            @Valid @RequestBody BulkOverrideRequest request
    ) {
        BulkOverrideAction action = BulkOverrideAction.fromWire(request.action())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_ACTION",
                        "Unknown bulk action: " + request.action()));
        OverrideTarget targetType = OverrideTarget.fromWire(request.targetType())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_TARGET_TYPE",
                        "Unknown target type: " + request.targetType()));
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (request.capabilities() != null) {
            request.capabilities().forEach(name -> capabilities.add(parseCapability(name)));
        }
        BulkOverrideOperation operation = new BulkOverrideOperation(
                action, targetType, request.targetIds(), capabilities, request.copyFromId());
        return ResponseEntity.ok(BulkOverrideResponse.from(ProblemException.unwrap(
                channelPermissionService.executeBulk(channelId, operation, SecurityUtils.getCurrentUserId()))));
    }

    @Operation(summary = "Effective permissions of a member in the channel")
    @GetMapping("/members/{userId}/permissions")
    public ResponseEntity<List<PermissionCheckResponse>> getMemberPermissions(
            @PathVariable("channelId") String channelId,
            @PathVariable("userId") String userId,
            @Parameter(description = "Room whose roles the member holds; defaults to the channel itself")
            @RequestParam(value = "serverRoomId", required = false) String serverRoomId
    ) {
        List<HeldRole> roles = heldRoles(channelId, serverRoomId, userId);
        List<PermissionCheckResponse> checks = new ArrayList<>();
        ProblemException.unwrap(channelPermissionService.effectivePermissions(channelId, userId, roles))
                .forEach(check -> checks.add(PermissionCheckResponse.from(check)));
        return ResponseEntity.ok(checks);
    }

    @Operation(summary = "Check one capability of a member in the channel")
    @GetMapping("/members/{userId}/permissions/{capability}")
    public ResponseEntity<PermissionCheckResponse> checkMemberPermission(
            @PathVariable("channelId") String channelId,
            @PathVariable("userId") String userId,
            @PathVariable("capability") String capability,
            @RequestParam(value = "serverRoomId", required = false) String serverRoomId
    ) {
        Capability parsed = parseCapability(capability);
        List<HeldRole> roles = heldRoles(channelId, serverRoomId, userId);
        return ResponseEntity.ok(PermissionCheckResponse.from(
                ProblemException.unwrap(channelPermissionService.checkPermission(channelId, userId, parsed, roles))));
    }

    private ResponseEntity<ChannelPermissionsResponse> setOverride(
            String channelId,
            OverrideTarget target,
            String targetId,
            OverrideRequest request
    ) {
        Map<Capability, Boolean> permissions = new EnumMap<>(Capability.class);
        request.permissions().forEach((name, allowed) -> {
            if (allowed == null) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_PERMISSION_VALUE",
                        "Permission " + name + " must be true or false");
            }
            permissions.put(parseCapability(name), allowed);
        });
        ChannelPermissions updated = ProblemException.unwrap(channelPermissionService.setOverride(
                channelId, target, targetId, request.label(), permissions, SecurityUtils.getCurrentUserId()));
        return ResponseEntity.ok(ChannelPermissionsResponse.from(updated));
    }

    private List<HeldRole> heldRoles(String channelId, String serverRoomId, String userId) {
        String roomId = serverRoomId == null || serverRoomId.isBlank() ? channelId : serverRoomId;
        return ProblemException.unwrap(channelPermissionService.resolveHeldRoles(roomId, userId));
    }

    private static Capability parseCapability(String name) {
        return Capability.fromWire(name)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_CAPABILITY",
                        "Unknown capability: " + name));
    }
}
