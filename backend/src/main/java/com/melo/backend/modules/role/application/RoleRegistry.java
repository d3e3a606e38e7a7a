package com.melo.backend.modules.role.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.permission.application.AuthorizationModel;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.PermissionTemplate;
import com.melo.backend.modules.permission.domain.ValidationResult;
import com.melo.backend.modules.permission.domain.Violation;
import com.melo.backend.modules.role.domain.Role;
import com.melo.backend.modules.role.domain.RoleColors;
import com.melo.backend.modules.role.domain.RoleDocument;
import com.melo.backend.modules.role.domain.RoleIcon;
import com.melo.backend.modules.role.domain.RoleNames;
import com.melo.backend.modules.role.domain.RolePatch;
import com.melo.backend.modules.role.domain.RolePosition;
import com.melo.backend.modules.role.domain.RoleSpec;
import com.melo.backend.modules.role.infrastructure.RoleDocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * CRUD over a room's named roles. Every mutation is one read-modify-write of the role
 * document. Level changes write the role document first and move users second; when moving
 * users fails the role document is put back.
 */
@Service
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);
    private static final String ROLE_ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final RoleDocumentStore roleDocumentStore;
    private final ProtocolClient protocolClient;
    private final AuthorizationModel authorizationModel;
    private final Clock clock;

    public RoleRegistry(
            RoleDocumentStore roleDocumentStore,
            ProtocolClient protocolClient,
            AuthorizationModel authorizationModel,
            Clock clock
    ) {
        this.roleDocumentStore = roleDocumentStore;
        this.protocolClient = protocolClient;
        this.authorizationModel = authorizationModel;
        this.clock = clock;
    }

    public OperationResult<List<Role>> list(String roomId) {
        OperationResult<RoleDocument> document = readDocument(roomId);
        if (!document.isSuccess()) {
            return document.propagate();
        }
        return OperationResult.success(document.value().rolesByPosition());
    }

    public OperationResult<String> create(String roomId, RoleSpec spec) {
        OperationResult<Void> checked = checkNameAndLevel(spec.name(), spec.level());
        if (!checked.isSuccess()) {
            return checked.propagate();
        }
        if (spec.color() != null && !RoleColors.isValid(spec.color())) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_COLOR", "Color must be #rrggbb");
        }
        Set<Capability> capabilities = spec.capabilities() != null
                ? spec.capabilities()
                : PermissionTemplate.closestTo(spec.level()).capabilities();
        if (spec.capabilities() != null) {
            OperationResult<Void> valid = checkCapabilities(capabilities, spec.level());
            if (!valid.isSuccess()) {
                return valid.propagate();
            }
        }

        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        if (findByName(document.roles(), spec.name(), null).isPresent()) {
            return OperationResult.failure(ErrorKind.CONFLICT, "DUPLICATE_NAME", "A role with this name already exists");
        }

        Role role = new Role(
                newRoleId(),
                spec.name().trim(),
                spec.color() != null ? spec.color() : RoleColors.defaultForLevel(spec.level()),
                spec.icon() != null ? spec.icon() : RoleIcon.defaultForLevel(spec.level()),
                spec.level(),
                capabilities,
                spec.hoist() == null || spec.hoist(),
                spec.mentionable() == null || spec.mentionable(),
                0,
                document.roles().size() + 1,
                false,
                clock.instant()
        );
        List<Role> updated = new ArrayList<>(document.roles());
        updated.add(role);

        OperationResult<Void> written = writeDocument(roomId, document.withRoles(updated));
        if (!written.isSuccess()) {
            return written.propagate();
        }
        log.info("Created role {} ({}) at level {} in room {}", role.id(), role.name(), role.level(), roomId);
        return OperationResult.success(role.id());
    }

    public OperationResult<Role> update(String roomId, String roleId, RolePatch patch) {
        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        Optional<Role> found = findById(document.roles(), roleId);
        if (found.isEmpty()) {
            return roleNotFound(roleId);
        }
        Role current = found.get();
        Role next = current;

        if (patch.name() != null && !patch.name().trim().equals(current.name())) {
            Optional<String> nameProblem = RoleNames.validate(patch.name());
            if (nameProblem.isPresent()) {
                return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_NAME", nameProblem.get());
            }
            if (findByName(document.roles(), patch.name(), roleId).isPresent()) {
                return OperationResult.failure(ErrorKind.CONFLICT, "DUPLICATE_NAME", "A role with this name already exists");
            }
            next = next.withName(patch.name().trim());
        }
        if (patch.color() != null) {
            if (!RoleColors.isValid(patch.color())) {
                return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_COLOR", "Color must be #rrggbb");
            }
            next = next.withColor(patch.color());
        }
        if (patch.icon() != null) {
            next = next.withIcon(patch.icon());
        }
        if (patch.hoist() != null) {
            next = next.withHoist(patch.hoist());
        }
        if (patch.mentionable() != null) {
            next = next.withMentionable(patch.mentionable());
        }
        if (patch.level() != null) {
            if (!AuthorizationLevels.isInRange(patch.level())) {
                return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_LEVEL", "Level must be within 0..100");
            }
            next = next.withLevel(patch.level());
        }
        if (patch.capabilities() != null) {
            next = next.withCapabilities(patch.capabilities());
        }
        if (patch.level() != null || patch.capabilities() != null) {
            OperationResult<Void> valid = checkCapabilities(next.capabilities(), next.level());
            if (!valid.isSuccess()) {
                return valid.propagate();
            }
        }

        Role updatedRole = next;
        List<Role> updated = document.roles().stream()
                .map(role -> role.id().equals(roleId) ? updatedRole : role)
                .toList();
        OperationResult<Void> written = writeDocument(roomId, document.withRoles(updated));
        if (!written.isSuccess()) {
            return written.propagate();
        }
        if (next.level() != current.level()) {
            OperationResult<Void> reassigned = reassignLevel(roomId, current.level(), next.level());
            if (!reassigned.isSuccess()) {
                restoreDocument(roomId, document);
                return reassigned.propagate();
            }
        }
        log.info("Updated role {} in room {}", roleId, roomId);
        return OperationResult.success(updatedRole);
    }

    public OperationResult<Void> delete(String roomId, String roleId) {
        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        Optional<Role> found = findById(document.roles(), roleId);
        if (found.isEmpty()) {
            return roleNotFound(roleId);
        }
        Role role = found.get();
        if (role.defaultRole()) {
            return OperationResult.failure(ErrorKind.CONFLICT, "CANNOT_DELETE_DEFAULT", "The default role cannot be deleted");
        }

        List<Role> remaining = document.rolesByPosition().stream()
                .filter(candidate -> !candidate.id().equals(roleId))
                .toList();
        List<Role> renumbered = new ArrayList<>(remaining.size());
        for (int i = 0; i < remaining.size(); i++) {
            renumbered.add(remaining.get(i).withPosition(i + 1));
        }

        OperationResult<Void> written = writeDocument(roomId, document.withRoles(renumbered));
        if (!written.isSuccess()) {
            return written;
        }
        if (role.level() != AuthorizationLevels.MEMBER) {
            OperationResult<Void> demoted = reassignLevel(roomId, role.level(), AuthorizationLevels.MEMBER);
            if (!demoted.isSuccess()) {
                restoreDocument(roomId, document);
                return demoted;
            }
        }
        log.info("Deleted role {} ({}) from room {}", roleId, role.name(), roomId);
        return OperationResult.success();
    }

    /**
     * Applies the given positions verbatim. Callers supply the permutation; collisions are
     * resolved by the last entry for a role.
     */
    public OperationResult<List<Role>> reorder(String roomId, List<RolePosition> positions) {
        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        Map<String, Integer> byId = new HashMap<>();
        for (RolePosition position : positions) {
            if (findById(document.roles(), position.roleId()).isEmpty()) {
                return roleNotFound(position.roleId());
            }
            byId.put(position.roleId(), position.position());
        }
        List<Role> updated = document.roles().stream()
                .map(role -> byId.containsKey(role.id()) ? role.withPosition(byId.get(role.id())) : role)
                .toList();
        RoleDocument next = document.withRoles(updated);
        OperationResult<Void> written = writeDocument(roomId, next);
        if (!written.isSuccess()) {
            return written.propagate();
        }
        return OperationResult.success(next.rolesByPosition());
    }

    /**
     * Sets the user's level to the role's level and bumps the role's cached member count.
     * The count is advisory; the level document stays the source of truth.
     */
    public OperationResult<Role> assignUserToRole(String roomId, String userId, String roleId) {
        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        Optional<Role> found = findById(document.roles(), roleId);
        if (found.isEmpty()) {
            return roleNotFound(roleId);
        }
        Role role = found.get();

        LevelDocument levels;
        try {
            levels = protocolClient.getLevelDocument(roomId).orElse(LevelDocument.defaults(AuthorizationLevels.MEMBER));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        try {
            protocolClient.setLevelDocument(roomId, levels.withUserLevel(userId, role.level()));
        } catch (ProtocolClientException ex) {
            log.warn("Failed to assign {} to role {} in room {}", userId, roleId, roomId, ex);
            return ProtocolFailures.upstream("LEVEL_DOCUMENT_WRITE_FAILED", ex);
        }

        Role counted = role.withMemberCount(role.memberCount() + 1);
        List<Role> updated = document.roles().stream()
                .map(candidate -> candidate.id().equals(roleId) ? counted : candidate)
                .toList();
        OperationResult<Void> written = writeDocument(roomId, document.withRoles(updated));
        if (!written.isSuccess()) {
            return written.propagate();
        }
        log.info("Assigned {} to role {} (level {}) in room {}", userId, roleId, role.level(), roomId);
        return OperationResult.success(counted);
    }

    /**
     * Seeds Administrator, Moderator and Member (the default role) when the room has no roles.
     * A room that already has roles is returned unchanged.
     */
    public OperationResult<List<Role>> initializeDefaults(String roomId) {
        OperationResult<RoleDocument> read = readDocument(roomId);
        if (!read.isSuccess()) {
            return read.propagate();
        }
        RoleDocument document = read.value();
        if (!document.roles().isEmpty()) {
            return OperationResult.success(document.rolesByPosition());
        }

        List<Role> seeded = new ArrayList<>();
        PermissionTemplate[] order = {PermissionTemplate.ADMIN, PermissionTemplate.MODERATOR, PermissionTemplate.MEMBER};
        for (int i = 0; i < order.length; i++) {
            PermissionTemplate template = order[i];
            seeded.add(new Role(
                    newRoleId(),
                    template.displayName(),
                    template.color(),
                    RoleIcon.defaultForLevel(template.recommendedLevel()),
                    template.recommendedLevel(),
                    template.capabilities(),
                    template != PermissionTemplate.MEMBER,
                    true,
                    0,
                    i + 1,
                    template == PermissionTemplate.MEMBER,
                    clock.instant()
            ));
        }
        OperationResult<Void> written = writeDocument(roomId, document.withRoles(seeded));
        if (!written.isSuccess()) {
            return written.propagate();
        }
        log.info("Seeded default roles in room {}", roomId);
        return OperationResult.success(seeded);
    }

    private OperationResult<Void> reassignLevel(String roomId, int from, int to) {
        LevelDocument levels;
        try {
            levels = protocolClient.getLevelDocument(roomId).orElse(null);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        if (levels == null) {
            return OperationResult.success();
        }
        LevelDocument reassigned = levels.withUsersReassigned(from, to);
        if (reassigned.equals(levels)) {
            return OperationResult.success();
        }
        try {
            protocolClient.setLevelDocument(roomId, reassigned);
        } catch (ProtocolClientException ex) {
            log.warn("Failed to move users from level {} to {} in room {}", from, to, roomId, ex);
            return ProtocolFailures.upstream("LEVEL_DOCUMENT_WRITE_FAILED", ex);
        }
        return OperationResult.success();
    }

    private OperationResult<Void> checkNameAndLevel(String name, int level) {
        Optional<String> nameProblem = RoleNames.validate(name);
        if (nameProblem.isPresent()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_NAME", nameProblem.get());
        }
        if (!AuthorizationLevels.isInRange(level)) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_LEVEL", "Level must be within 0..100");
        }
        return OperationResult.success();
    }

    private OperationResult<Void> checkCapabilities(Set<Capability> capabilities, int level) {
        ValidationResult validation = authorizationModel.validate(
                capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(capabilities), level);
        if (validation.valid()) {
            return OperationResult.success();
        }
        String message = String.join("; ", validation.violations().stream().map(Violation::message).toList());
        return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_CAPABILITIES", message);
    }

    private OperationResult<RoleDocument> readDocument(String roomId) {
        try {
            return OperationResult.success(roleDocumentStore.read(roomId));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
    }

    private OperationResult<Void> writeDocument(String roomId, RoleDocument document) {
        try {
            roleDocumentStore.write(roomId, document);
            return OperationResult.success();
        } catch (ProtocolClientException ex) {
            log.warn("Failed to write role document for room {}", roomId, ex);
            return ProtocolFailures.upstream("ROLE_DOCUMENT_WRITE_FAILED", ex);
        }
    }

    /**
     * Puts back the role document read at the start of a level-changing mutation after the level
     * document write failed, so neither document reflects the change.
     */
    private void restoreDocument(String roomId, RoleDocument original) {
        try {
            roleDocumentStore.write(roomId, original);
        } catch (ProtocolClientException ex) {
            log.error("Role document for room {} no longer matches its level document and could not be restored",
                    roomId, ex);
        }
    }

    private static Optional<Role> findById(List<Role> roles, String roleId) {
        return roles.stream().filter(role -> role.id().equals(roleId)).findFirst();
    }

    private static Optional<Role> findByName(List<Role> roles, String name, String excludeId) {
        return roles.stream()
                .filter(role -> excludeId == null || !role.id().equals(excludeId))
                .filter(role -> role.hasName(name))
                .max(Comparator.comparingInt(Role::position));
    }

    private static <T> OperationResult<T> roleNotFound(String roleId) {
        return OperationResult.failure(ErrorKind.NOT_FOUND, "ROLE_NOT_FOUND", "Role not found: " + roleId);
    }

    private String newRoleId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ROLE_ID_ALPHABET.charAt(random.nextInt(ROLE_ID_ALPHABET.length())));
        }
        return "role_" + clock.millis() + "_" + suffix;
    }
}
