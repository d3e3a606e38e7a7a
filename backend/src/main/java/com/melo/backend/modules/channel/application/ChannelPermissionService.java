package com.melo.backend.modules.channel.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.channel.domain.BulkOverrideAction;
import com.melo.backend.modules.channel.domain.BulkOverrideOperation;
import com.melo.backend.modules.channel.domain.BulkOverrideReport;
import com.melo.backend.modules.channel.domain.BulkOverrideReport.BulkFailure;
import com.melo.backend.modules.channel.domain.ChannelPermissions;
import com.melo.backend.modules.channel.domain.HeldRole;
import com.melo.backend.modules.channel.domain.OverrideTarget;
import com.melo.backend.modules.channel.domain.PermissionCheck;
import com.melo.backend.modules.channel.domain.PermissionOverride;
import com.melo.backend.modules.channel.domain.PermissionSource;
import com.melo.backend.modules.channel.infrastructure.ChannelPermissionStore;
import com.melo.backend.modules.permission.application.AuthorizationModel;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.role.application.RoleRegistry;
import com.melo.backend.modules.role.domain.Role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-channel allow/deny overrides on top of level-based capabilities. A user override wins
 * over a role override, which wins over the capability the member's level grants.
 *
 * <p>Changing overrides requires {@link Capability#MANAGE_CHANNELS} in the channel, and the caller
 * can only allow or deny capabilities they hold there.
 */
@Service
public class ChannelPermissionService {

    private static final Logger log = LoggerFactory.getLogger(ChannelPermissionService.class);

    private final ChannelPermissionStore channelPermissionStore;
    private final ProtocolClient protocolClient;
    private final AuthorizationModel authorizationModel;
    private final RoleRegistry roleRegistry;
    private final Clock clock;

    public ChannelPermissionService(
            ChannelPermissionStore channelPermissionStore,
            ProtocolClient protocolClient,
            AuthorizationModel authorizationModel,
            RoleRegistry roleRegistry,
            Clock clock
    ) {
        this.channelPermissionStore = channelPermissionStore;
        this.protocolClient = protocolClient;
        this.authorizationModel = authorizationModel;
        this.roleRegistry = roleRegistry;
        this.clock = clock;
    }

    public OperationResult<ChannelPermissions> getChannelPermissions(String channelId) {
        try {
            return OperationResult.success(channelPermissionStore.read(channelId));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("CHANNEL_NOT_FOUND", ex);
        }
    }

    /**
     * Replaces the target's override with {@code permissions}. The original creator and
     * creation time survive a replacement.
     */
    public OperationResult<ChannelPermissions> setOverride(
            String channelId,
            OverrideTarget target,
            String targetId,
            String label,
            Map<Capability, Boolean> permissions,
            String actor
    ) {
        if (targetId == null || targetId.isBlank()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "TARGET_REQUIRED", "Override target id is required");
        }
        OperationResult<Void> authorized = requireChannelManager(channelId, actor, permissions.keySet());
        if (!authorized.isSuccess()) {
            return authorized.propagate();
        }
        OperationResult<ChannelPermissions> current = getChannelPermissions(channelId);
        if (!current.isSuccess()) {
            return current;
        }

        PermissionOverride override = current.value().find(target, targetId)
                .map(existing -> existing.withPermissions(labelOr(label, existing.label(), target, targetId), permissions))
                .orElseGet(() -> new PermissionOverride(targetId, labelOr(label, null, target, targetId), permissions,
                        clock.instant(), actor));
        ChannelPermissions updated = current.value().withOverride(target, override).touched(actor, clock.instant());

        OperationResult<Void> written = write(channelId, updated);
        if (!written.isSuccess()) {
            return written.propagate();
        }
        log.info("Set {} override for {} in channel {} ({} entries) by {}",
                target.wireName(), targetId, channelId, permissions.size(), actor);
        return OperationResult.success(updated);
    }

    /**
     * Drops the target's override. Removing an override that does not exist writes nothing.
     */
    public OperationResult<ChannelPermissions> removeOverride(
            String channelId,
            OverrideTarget target,
            String targetId,
            String actor
    ) {
        OperationResult<Void> authorized = requireChannelManager(channelId, actor, Set.of());
        if (!authorized.isSuccess()) {
            return authorized.propagate();
        }
        OperationResult<ChannelPermissions> current = getChannelPermissions(channelId);
        if (!current.isSuccess()) {
            return current;
        }
        if (current.value().find(target, targetId).isEmpty()) {
            return current;
        }

        ChannelPermissions updated = current.value().withoutOverride(target, targetId).touched(actor, clock.instant());
        OperationResult<Void> written = write(channelId, updated);
        if (!written.isSuccess()) {
            return written.propagate();
        }
        log.info("Removed {} override for {} in channel {} by {}", target.wireName(), targetId, channelId, actor);
        return OperationResult.success(updated);
    }

    public OperationResult<PermissionCheck> checkPermission(
            String channelId,
            String userId,
            Capability capability,
            List<HeldRole> heldRoles
    ) {
        OperationResult<ChannelContext> context = loadContext(channelId);
        if (!context.isSuccess()) {
            return context.propagate();
        }
        return OperationResult.success(decide(context.value(), userId, capability, heldRoles));
    }

    /**
     * Every capability's decision for the user, in catalog order, from a single read.
     */
    public OperationResult<List<PermissionCheck>> effectivePermissions(
            String channelId,
            String userId,
            List<HeldRole> heldRoles
    ) {
        OperationResult<ChannelContext> context = loadContext(channelId);
        if (!context.isSuccess()) {
            return context.propagate();
        }
        List<PermissionCheck> checks = new ArrayList<>();
        for (Capability capability : Capability.values()) {
            checks.add(decide(context.value(), userId, capability, heldRoles));
        }
        return OperationResult.success(checks);
    }

    /**
     * Roles of {@code serverRoomId} whose level equals the user's level there. A user whose
     * level matches no role holds a synthetic {@code power_level_<n>} role.
     */
    public OperationResult<List<HeldRole>> resolveHeldRoles(String serverRoomId, String userId) {
        OperationResult<List<Role>> roles = roleRegistry.list(serverRoomId);
        if (!roles.isSuccess()) {
            return roles.propagate();
        }
        int level;
        try {
            level = protocolClient.getUserLevel(serverRoomId, userId);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        List<HeldRole> held = roles.value().stream()
                .filter(role -> role.level() == level)
                .map(role -> new HeldRole(role.id(), role.name(), role.level()))
                .toList();
        if (!held.isEmpty()) {
            return OperationResult.success(held);
        }
        return OperationResult.success(List.of(new HeldRole("power_level_" + level, fallbackRoleName(level), level)));
    }

    /**
     * Applies one action to many targets with a single read and a single write. Targets are
     * reported individually; when the write fails every target that had succeeded is moved to
     * the failed list.
     */
    public OperationResult<BulkOverrideReport> executeBulk(String channelId, BulkOverrideOperation operation, String actor) {
        OperationResult<Void> valid = validateBulk(operation);
        if (!valid.isSuccess()) {
            return valid.propagate();
        }
        OperationResult<Void> authorized = requireChannelManager(channelId, actor, operation.capabilities());
        if (!authorized.isSuccess()) {
            return authorized.propagate();
        }
        OperationResult<ChannelPermissions> current = getChannelPermissions(channelId);
        if (!current.isSuccess()) {
            return current.propagate();
        }

        OverrideTarget target = operation.targetType();
        ChannelPermissions working = current.value();
        List<String> succeeded = new ArrayList<>();
        List<BulkFailure> failed = new ArrayList<>();
        Optional<PermissionOverride> copySource = operation.action() == BulkOverrideAction.COPY
                ? working.find(target, operation.copyFromId())
                : Optional.empty();
        if (copySource.isPresent()) {
            OperationResult<Void> copyable = requireChannelManager(channelId, actor, copySource.get().permissions().keySet());
            if (!copyable.isSuccess()) {
                return copyable.propagate();
            }
        }

        for (String targetId : operation.targetIds()) {
            if (targetId == null || targetId.isBlank()) {
                failed.add(new BulkFailure(String.valueOf(targetId), "Target id is blank"));
                continue;
            }
            Optional<PermissionOverride> existing = working.find(target, targetId);
            switch (operation.action()) {
                case ALLOW, DENY -> {
                    Map<Capability, Boolean> merged = new EnumMap<>(Capability.class);
                    existing.ifPresent(entry -> merged.putAll(entry.permissions()));
                    boolean allowed = operation.action() == BulkOverrideAction.ALLOW;
                    operation.capabilities().forEach(capability -> merged.put(capability, allowed));
                    working = working.withOverride(target, upsert(existing, target, targetId, merged, actor));
                    succeeded.add(targetId);
                }
                case COPY -> {
                    if (copySource.isEmpty()) {
                        failed.add(new BulkFailure(targetId, "No " + target.wireName() + " override to copy from: "
                                + operation.copyFromId()));
                        continue;
                    }
                    working = working.withOverride(target,
                            upsert(existing, target, targetId, copySource.get().permissions(), actor));
                    succeeded.add(targetId);
                }
                case RESET -> {
                    working = working.withoutOverride(target, targetId);
                    succeeded.add(targetId);
                }
            }
        }

        if (!succeeded.isEmpty()) {
            OperationResult<Void> written = write(channelId, working.touched(actor, clock.instant()));
            if (!written.isSuccess()) {
                String error = written.errorOrNull().message();
                succeeded.forEach(targetId -> failed.add(new BulkFailure(targetId, error)));
                succeeded.clear();
            }
        }
        log.info("Bulk {} on {} {} targets in channel {} by {}: {} succeeded, {} failed",
                operation.action(), operation.targetIds().size(), target.wireName(), channelId, actor,
                succeeded.size(), failed.size());
        return OperationResult.success(new BulkOverrideReport(succeeded, failed));
    }

    private OperationResult<Void> validateBulk(BulkOverrideOperation operation) {
        if (operation.action() == null || operation.targetType() == null) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_BULK_OPERATION",
                    "Bulk operation needs an action and a target type");
        }
        if (operation.targetIds().isEmpty()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "TARGETS_REQUIRED", "Bulk operation has no targets");
        }
        boolean grants = operation.action() == BulkOverrideAction.ALLOW || operation.action() == BulkOverrideAction.DENY;
        if (grants && operation.capabilities().isEmpty()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "CAPABILITIES_REQUIRED",
                    operation.action().name().toLowerCase() + " needs at least one capability");
        }
        if (operation.action() == BulkOverrideAction.COPY
                && (operation.copyFromId() == null || operation.copyFromId().isBlank())) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "COPY_SOURCE_REQUIRED", "copy needs copyFromId");
        }
        return OperationResult.success();
    }

    private OperationResult<Void> requireChannelManager(String channelId, String actor, Collection<Capability> touched) {
        LevelDocument levels;
        try {
            levels = protocolClient.getLevelDocument(channelId).orElse(null);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("CHANNEL_NOT_FOUND", ex);
        }
        int actorLevel = levels != null ? levels.userLevel(actor) : AuthorizationLevels.MIN;
        Set<Capability> held = authorizationModel.effectiveCapabilities(actorLevel, levels);
        if (!held.contains(Capability.MANAGE_CHANNELS)) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "CANNOT_MANAGE_CHANNEL",
                    "Changing channel overrides requires manage_channels");
        }
        for (Capability capability : touched) {
            if (!held.contains(capability)) {
                return OperationResult.failure(ErrorKind.UNAUTHORIZED, "CAPABILITY_NOT_HELD",
                        "Cannot override " + capability.wireName() + " without holding it");
            }
        }
        return OperationResult.success();
    }

    private OperationResult<ChannelContext> loadContext(String channelId) {
        try {
            ChannelPermissions overrides = channelPermissionStore.read(channelId);
            LevelDocument levels = protocolClient.getLevelDocument(channelId).orElse(null);
            return OperationResult.success(new ChannelContext(overrides, levels));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("CHANNEL_NOT_FOUND", ex);
        }
    }

    private PermissionCheck decide(ChannelContext context, String userId, Capability capability, List<HeldRole> heldRoles) {
        Optional<Boolean> userValue = context.overrides().find(OverrideTarget.USER, userId)
                .map(entry -> entry.permissions().get(capability));
        if (userValue.isPresent()) {
            return new PermissionCheck(capability, userValue.get(), PermissionSource.CHANNEL_USER,
                    "User-specific override in channel");
        }

        List<HeldRole> roles = heldRoles == null ? List.of() : heldRoles;
        for (HeldRole role : roles) {
            Optional<Boolean> roleValue = context.overrides().find(OverrideTarget.ROLE, role.roleId())
                    .map(entry -> entry.permissions().get(capability));
            if (roleValue.isPresent()) {
                return new PermissionCheck(capability, roleValue.get(), PermissionSource.CHANNEL_ROLE,
                        "Role \"" + role.roleName() + "\" override in channel");
            }
        }

        if (!roles.isEmpty()) {
            int highest = roles.stream().mapToInt(HeldRole::level).max().orElse(AuthorizationLevels.MIN);
            return new PermissionCheck(capability, authorizationModel.isGranted(capability, highest, context.levels()),
                    PermissionSource.ROLE, "Base role permission (level " + highest + ")");
        }

        int level = context.levels() != null ? context.levels().userLevel(userId) : AuthorizationLevels.MIN;
        return new PermissionCheck(capability, authorizationModel.isGranted(capability, level, context.levels()),
                PermissionSource.DEFAULT, "Default level " + level);
    }

    private OperationResult<Void> write(String channelId, ChannelPermissions updated) {
        try {
            channelPermissionStore.write(channelId, updated);
            return OperationResult.success();
        } catch (ProtocolClientException ex) {
            log.warn("Failed to write channel overrides for {}", channelId, ex);
            return ProtocolFailures.upstream("OVERRIDE_WRITE_FAILED", ex);
        }
    }

    private PermissionOverride upsert(
            Optional<PermissionOverride> existing,
            OverrideTarget target,
            String targetId,
            Map<Capability, Boolean> permissions,
            String actor
    ) {
        return existing
                .map(entry -> entry.withPermissions(entry.label(), permissions))
                .orElseGet(() -> new PermissionOverride(targetId, labelOr(null, null, target, targetId), permissions,
                        clock.instant(), actor));
    }

    private static String labelOr(String requested, String existing, OverrideTarget target, String targetId) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        if (existing != null) {
            return existing;
        }
        return (target == OverrideTarget.ROLE ? "Role " : "User ") + targetId;
    }

    private static String fallbackRoleName(int level) {
        if (level >= AuthorizationLevels.ADMIN) {
            return "Admin";
        }
        return level >= AuthorizationLevels.MODERATOR ? "Moderator" : "Member";
    }

    private record ChannelContext(ChannelPermissions overrides, LevelDocument levels) {
    }
}
