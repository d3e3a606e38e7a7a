package com.melo.backend.modules.moderation.presentation;

import java.util.Arrays;
import java.util.List;

import com.melo.backend.global.error.ProblemException;
import com.melo.backend.global.security.SecurityUtils;
import com.melo.backend.modules.moderation.application.BanExpirySweeper;
import com.melo.backend.modules.moderation.application.ModerationService;
import com.melo.backend.modules.moderation.domain.BanDurationPreset;
import com.melo.backend.modules.moderation.domain.BanRecord;
import com.melo.backend.modules.moderation.presentation.dto.BanInfoResponse;
import com.melo.backend.modules.moderation.presentation.dto.BanPresetResponse;
import com.melo.backend.modules.moderation.presentation.dto.BanRecordResponse;
import com.melo.backend.modules.moderation.presentation.dto.BanRequest;
import com.melo.backend.modules.moderation.presentation.dto.KickRequest;
import com.melo.backend.modules.moderation.presentation.dto.ModerationLogResponse;
import com.melo.backend.modules.moderation.presentation.dto.SweepReportResponse;
import com.melo.backend.modules.moderation.presentation.dto.UserRoleResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ModerationController {

    private final ModerationService moderationService;
    private final BanExpirySweeper banExpirySweeper;

    public ModerationController(ModerationService moderationService, BanExpirySweeper banExpirySweeper) {
        this.moderationService = moderationService;
        this.banExpirySweeper = banExpirySweeper;
    }

    @Operation(summary = "Ban a member", description = "Timed bans are lifted automatically once they expire.")
    @PostMapping("/rooms/{roomId}/bans")
    public ResponseEntity<BanRecordResponse> banUser(
            @PathVariable("roomId") String roomId,
            @Valid @RequestBody BanRequest request
    ) {
        long durationMs = resolveDuration(request);
        BanRecord record = ProblemException.unwrap(moderationService.ban(
                roomId,
                SecurityUtils.getCurrentUserId(),
                request.userId(),
                request.reason(),
                durationMs
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(BanRecordResponse.from(record));
    }

    @Operation(summary = "Lift a ban")
    @DeleteMapping("/rooms/{roomId}/bans/{userId}")
    public ResponseEntity<Void> unbanUser(
            @PathVariable("roomId") String roomId,
            @PathVariable("userId") String userId
    ) {
        ProblemException.unwrap(moderationService.unban(roomId, SecurityUtils.getCurrentUserId(), userId));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List banned members", description = "Newest ban first.")
    @GetMapping("/rooms/{roomId}/bans")
    public ResponseEntity<List<BanRecordResponse>> getBannedUsers(@PathVariable("roomId") String roomId) {
        List<BanRecord> records = ProblemException.unwrap(moderationService.getBannedUsers(roomId));
        return ResponseEntity.ok(records.stream().map(BanRecordResponse::from).toList());
    }

    @Operation(summary = "Ban status of a member")
    @GetMapping("/rooms/{roomId}/bans/{userId}")
    public ResponseEntity<BanInfoResponse> getBanInfo(
            @PathVariable("roomId") String roomId,
            @PathVariable("userId") String userId
    ) {
        return ResponseEntity.ok(BanInfoResponse.from(ProblemException.unwrap(moderationService.getBanInfo(roomId, userId))));
    }

    @Operation(summary = "Lift expired bans now", description = "Same reconciliation the periodic sweep runs.")
    @PostMapping("/rooms/{roomId}/bans/expired-checks")
    public ResponseEntity<SweepReportResponse> checkExpiredBans(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(SweepReportResponse.from(ProblemException.unwrap(banExpirySweeper.checkExpiredBans(roomId))));
    }

    @Operation(summary = "Kick a member")
    @PostMapping("/rooms/{roomId}/kicks")
    public ResponseEntity<Void> kickUser(
            @PathVariable("roomId") String roomId,
            @Valid @RequestBody KickRequest request
    ) {
        ProblemException.unwrap(moderationService.kick(
                roomId, SecurityUtils.getCurrentUserId(), request.userId(), request.reason()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Moderation history", description = "Newest entry first.")
    @GetMapping("/rooms/{roomId}/moderation-logs")
    public ResponseEntity<List<ModerationLogResponse>> getModerationLogs(
            @PathVariable("roomId") String roomId,
            @Parameter(description = "Maximum entries, 50 when omitted")
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(ProblemException.unwrap(moderationService.getModerationLogs(roomId, limit)).stream()
                .map(ModerationLogResponse::from)
                .toList());
    }

    @Operation(summary = "Moderation role of a member")
    @GetMapping("/rooms/{roomId}/members/{userId}/role")
    public ResponseEntity<UserRoleResponse> getUserRole(
            @PathVariable("roomId") String roomId,
            @PathVariable("userId") String userId
    ) {
        return ResponseEntity.ok(new UserRoleResponse(userId, ProblemException.unwrap(moderationService.getUserRole(roomId, userId))));
    }

    @Operation(summary = "Ban duration presets")
    @GetMapping("/moderation/ban-presets")
    public ResponseEntity<List<BanPresetResponse>> getBanPresets() {
        return ResponseEntity.ok(Arrays.stream(BanDurationPreset.values()).map(BanPresetResponse::from).toList());
    }

    private static long resolveDuration(BanRequest request) {
        if (request.preset() != null && !request.preset().isBlank()) {
            try {
                return BanDurationPreset.fromKey(request.preset()).durationMs();
            } catch (IllegalArgumentException ex) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "UNKNOWN_PRESET", ex.getMessage());
            }
        }
        return request.durationMs() != null ? request.durationMs() : 0L;
    }
}
