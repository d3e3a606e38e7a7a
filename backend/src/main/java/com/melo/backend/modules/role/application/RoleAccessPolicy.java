package com.melo.backend.modules.role.application;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;

import org.springframework.stereotype.Component;

/**
 * Who may change a room's roles. The caller needs the level the room sets for
 * {@code m.room.power_levels} (50 when unset), may only hand out levels below their own, and
 * may only touch roles that already sit below their own level.
 */
@Component
public class RoleAccessPolicy {

    private static final String POWER_LEVELS_KEY = "m.room.power_levels";

    private final ProtocolClient protocolClient;

    public RoleAccessPolicy(ProtocolClient protocolClient) {
        this.protocolClient = protocolClient;
    }

    public OperationResult<Integer> requireRoleManager(String roomId, String actor) {
        LevelDocument levels;
        try {
            levels = protocolClient.getLevelDocument(roomId).orElse(null);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        int actorLevel = levels != null ? levels.userLevel(actor) : 0;
        int required = levels != null
                ? levels.explicitActionLevel(POWER_LEVELS_KEY).orElse(AuthorizationLevels.MODERATOR)
                : AuthorizationLevels.MODERATOR;
        if (actorLevel < required) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "CANNOT_MANAGE_ROLES",
                    "Managing roles requires level " + required);
        }
        return OperationResult.success(actorLevel);
    }

    /**
     * Role manager check plus: the existing role's level must be strictly below the caller's,
     * so nobody can edit or delete a role at or above their own standing.
     */
    public OperationResult<Integer> requireCanManageRole(String roomId, String actor, int roleLevel) {
        OperationResult<Integer> manager = requireRoleManager(roomId, actor);
        if (!manager.isSuccess()) {
            return manager;
        }
        if (roleLevel >= manager.value()) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "ROLE_NOT_BELOW_CALLER",
                    "Cannot change a role at or above your own level");
        }
        return manager;
    }

    /**
     * Role manager check plus: {@code grantedLevel} must be strictly below the caller's level.
     */
    public OperationResult<Integer> requireCanGrant(String roomId, String actor, int grantedLevel) {
        OperationResult<Integer> manager = requireRoleManager(roomId, actor);
        if (!manager.isSuccess()) {
            return manager;
        }
        if (grantedLevel >= manager.value()) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "LEVEL_NOT_BELOW_CALLER",
                    "Cannot grant a level equal to or higher than your own");
        }
        return manager;
    }
}
