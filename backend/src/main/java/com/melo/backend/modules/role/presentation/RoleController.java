package com.melo.backend.modules.role.presentation;

import java.util.List;

import com.melo.backend.global.error.ProblemException;
import com.melo.backend.global.security.SecurityUtils;
import com.melo.backend.modules.role.application.RoleAccessPolicy;
import com.melo.backend.modules.role.application.RoleRegistry;
import com.melo.backend.modules.role.domain.Role;
import com.melo.backend.modules.role.domain.RolePatch;
import com.melo.backend.modules.role.domain.RolePosition;
import com.melo.backend.modules.role.domain.RoleSpec;
import com.melo.backend.modules.role.presentation.dto.CreateRoleRequest;
import com.melo.backend.modules.role.presentation.dto.ReorderRolesRequest;
import com.melo.backend.modules.role.presentation.dto.RoleCreatedResponse;
import com.melo.backend.modules.role.presentation.dto.RoleResponse;
import com.melo.backend.modules.role.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rooms/{roomId}/roles")
public class RoleController {

    private final RoleRegistry roleRegistry;
    private final RoleAccessPolicy roleAccessPolicy;

    public RoleController(RoleRegistry roleRegistry, RoleAccessPolicy roleAccessPolicy) {
        this.roleRegistry = roleRegistry;
        this.roleAccessPolicy = roleAccessPolicy;
    }

    @Operation(summary = "List roles by position")
    @GetMapping
    public ResponseEntity<List<RoleResponse>> listRoles(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(toResponses(ProblemException.unwrap(roleRegistry.list(roomId))));
    }

    @Operation(summary = "Create a role", description = "Capabilities default to the closest template for the level.")
    @PostMapping
    public ResponseEntity<RoleCreatedResponse> createRole(
            @PathVariable("roomId") String roomId,
            @Valid @RequestBody CreateRoleRequest request
    ) {
        ProblemException.unwrap(roleAccessPolicy.requireCanGrant(roomId, SecurityUtils.getCurrentUserId(), request.level()));
        String roleId = ProblemException.unwrap(roleRegistry.create(roomId, new RoleSpec(
                request.name(),
                request.color(),
                request.icon(),
                request.level(),
                request.capabilities(),
                request.hoist(),
                request.mentionable()
        )));
        return ResponseEntity.status(HttpStatus.CREATED).body(new RoleCreatedResponse(roleId));
    }

    @Operation(summary = "Update a role", description = "A level change moves every user at the old level to the new one.")
    @PatchMapping("/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roomId") String roomId,
            @PathVariable("roleId") String roleId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        String actor = SecurityUtils.getCurrentUserId();
        Role current = findRole(roomId, roleId);
        ProblemException.unwrap(roleAccessPolicy.requireCanManageRole(roomId, actor, current.level()));
        if (request.level() != null) {
            ProblemException.unwrap(roleAccessPolicy.requireCanGrant(roomId, actor, request.level()));
        }
        Role updated = ProblemException.unwrap(roleRegistry.update(roomId, roleId, new RolePatch(
                request.name(),
                request.color(),
                request.icon(),
                request.level(),
                request.capabilities(),
                request.hoist(),
                request.mentionable()
        )));
        return ResponseEntity.ok(RoleResponse.from(updated));
    }

    @Operation(summary = "Delete a role", description = "Members at the role's level are demoted to 0.")
    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> deleteRole(
            @PathVariable("roomId") String roomId,
            @PathVariable("roleId") String roleId
    ) {
        Role target = findRole(roomId, roleId);
        ProblemException.unwrap(roleAccessPolicy.requireCanManageRole(roomId, SecurityUtils.getCurrentUserId(), target.level()));
        ProblemException.unwrap(roleRegistry.delete(roomId, roleId));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Reorder roles", description = "Positions are applied as given.")
    @PutMapping("/positions")
    public ResponseEntity<List<RoleResponse>> reorderRoles(
            @PathVariable("roomId") String roomId,
            @Valid @RequestBody ReorderRolesRequest request
    ) {
        ProblemException.unwrap(roleAccessPolicy.requireRoleManager(roomId, SecurityUtils.getCurrentUserId()));
        List<RolePosition> positions = request.positions().stream()
                .map(entry -> new RolePosition(entry.roleId(), entry.position()))
                .toList();
        return ResponseEntity.ok(toResponses(ProblemException.unwrap(roleRegistry.reorder(roomId, positions))));
    }

    @Operation(summary = "Assign a member to a role")
    @PutMapping("/{roleId}/members/{userId}")
    public ResponseEntity<RoleResponse> assignMember(
            @PathVariable("roomId") String roomId,
            @PathVariable("roleId") String roleId,
            @PathVariable("userId") String userId
    ) {
        String actor = SecurityUtils.getCurrentUserId();
        Role target = findRole(roomId, roleId);
        ProblemException.unwrap(roleAccessPolicy.requireCanGrant(roomId, actor, target.level()));
        return ResponseEntity.ok(RoleResponse.from(
                ProblemException.unwrap(roleRegistry.assignUserToRole(roomId, userId, roleId))));
    }

    @Operation(summary = "Seed the default roles", description = "No-op when the room already has roles.")
    @PostMapping("/defaults")
    public ResponseEntity<List<RoleResponse>> initializeDefaults(@PathVariable("roomId") String roomId) {
        ProblemException.unwrap(roleAccessPolicy.requireRoleManager(roomId, SecurityUtils.getCurrentUserId()));
        return ResponseEntity.ok(toResponses(ProblemException.unwrap(roleRegistry.initializeDefaults(roomId))));
    }

    private Role findRole(String roomId, String roleId) {
        return ProblemException.unwrap(roleRegistry.list(roomId)).stream()
                .filter(role -> role.id().equals(roleId))
                .findFirst()
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_FOUND", "Role not found: " + roleId));
    }

    private static List<RoleResponse> toResponses(List<Role> roles) {
        return roles.stream().map(RoleResponse::from).toList();
    }
}
