package com.melo.backend.modules.permission.application;

import java.util.Set;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.EffectivePermissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies capability sets to a live room and reads effective capabilities back from it.
 */
@Service
public class RoomPermissionService {

    private static final Logger log = LoggerFactory.getLogger(RoomPermissionService.class);
    private static final String POWER_LEVELS_KEY = "m.room.power_levels";

    private final AuthorizationModel authorizationModel;
    private final ProtocolClient protocolClient;

    public RoomPermissionService(AuthorizationModel authorizationModel, ProtocolClient protocolClient) {
        this.authorizationModel = authorizationModel;
        this.protocolClient = protocolClient;
    }

    public OperationResult<LevelDocument> applyCapabilities(String roomId, String caller, Set<Capability> capabilities, int baseline) {
        if (!AuthorizationLevels.isInRange(baseline)) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "INVALID_BASELINE",
                    "Baseline level must be within 0..100");
        }

        LevelDocument existing;
        int callerLevel;
        try {
            existing = protocolClient.getLevelDocument(roomId).orElse(null);
            callerLevel = existing != null ? existing.userLevel(caller) : 0;
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }

        int requiredToEdit = existing == null
                ? AuthorizationLevels.MODERATOR
                : existing.explicitActionLevel(POWER_LEVELS_KEY).orElse(existing.stateDefault());
        if (callerLevel < requiredToEdit) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_LEVEL",
                    "Changing room levels requires level " + requiredToEdit);
        }

        LevelDocument generated = authorizationModel.generateLevelDocument(capabilities, baseline, existing);
        try {
            protocolClient.setLevelDocument(roomId, generated);
        } catch (ProtocolClientException ex) {
            log.warn("Failed to write level document for room {}", roomId, ex);
            return ProtocolFailures.upstream("LEVEL_DOCUMENT_WRITE_FAILED", ex);
        }
        log.info("Applied {} capabilities to room {} (caller={})", capabilities.size(), roomId, caller);
        return OperationResult.success(generated);
    }

    public OperationResult<EffectivePermissions> effectiveCapabilities(String roomId, String userId) {
        LevelDocument document;
        try {
            document = protocolClient.getLevelDocument(roomId).orElse(null);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        int level = document != null ? document.userLevel(userId) : 0;
        Set<Capability> capabilities = authorizationModel.effectiveCapabilities(level, document);
        return OperationResult.success(new EffectivePermissions(roomId, userId, level, capabilities));
    }
}
