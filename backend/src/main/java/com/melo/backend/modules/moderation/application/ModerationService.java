package com.melo.backend.modules.moderation.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.Membership;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.moderation.domain.BanInfo;
import com.melo.backend.modules.moderation.domain.BanRecord;
import com.melo.backend.modules.moderation.domain.ModerationAction;
import com.melo.backend.modules.moderation.domain.ModerationLogEntry;
import com.melo.backend.modules.moderation.domain.ModerationRole;
import com.melo.backend.modules.moderation.domain.ReversalOutcome;
import com.melo.backend.modules.moderation.infrastructure.BanStateStore;
import com.melo.backend.modules.moderation.infrastructure.ModerationLogStore;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Ban, unban and kick with level checks, durable ban records and in-process expiry timers.
 *
 * <p>The protocol action always commits before the ban record is written or cleared, so a
 * crash in between leaves a record the sweeper treats as stale, never the reverse. Timers are
 * not cancelled on manual unban; {@link #reverseIfActive} re-checks membership and makes a
 * late timer a no-op.
 */
@Service
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    static final String DEFAULT_BAN_REASON = "Banned by moderator";
    static final String DEFAULT_KICK_REASON = "Kicked by moderator";
    private static final int DEFAULT_LOG_LIMIT = 50;
    private static final int MAX_LOG_LIMIT = 500;

    private final ProtocolClient protocolClient;
    private final BanStateStore banStateStore;
    private final ModerationLogStore moderationLogStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration maxBanDuration;

    public ModerationService(
            ProtocolClient protocolClient,
            BanStateStore banStateStore,
            ModerationLogStore moderationLogStore,
            TaskScheduler taskScheduler,
            Clock clock,
            @Value("${app.moderation.max-ban-duration:P365D}") String maxBanDuration
    ) {
        this.protocolClient = protocolClient;
        this.banStateStore = banStateStore;
        this.moderationLogStore = moderationLogStore;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.maxBanDuration = Duration.parse(maxBanDuration);
    }

    /**
     * Bans {@code target}. Checks run in order and the first failure wins: self-ban, duration
     * limit, room and member resolution, relative level, then an existing ban. {@code durationMs <= 0}
     * is a permanent ban with no expiry and no timer.
     *
     * <p>An existing ban is never overwritten here; changing it goes through {@link #unban}, which
     * enforces the original banner's level.
     */
    public OperationResult<BanRecord> ban(String roomId, String moderator, String target, String reason, long durationMs) {
        if (moderator.equals(target)) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "CANNOT_BAN_SELF", "You cannot ban yourself");
        }
        if (durationMs > maxBanDuration.toMillis()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "DURATION_TOO_LONG",
                    "Duration cannot exceed " + maxBanDuration.toMillis() + "ms");
        }

        OperationResult<ActionContext> context = resolve(roomId, moderator, target);
        if (!context.isSuccess()) {
            return context.propagate();
        }
        ActionContext ctx = context.value();
        if (ctx.moderatorLevel() <= ctx.targetLevel() || ctx.moderatorLevel() < ctx.levels().ban()) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_LEVEL",
                    "You don't have permission to ban this user");
        }
        if (ctx.targetMembership() == Membership.BAN) {
            return OperationResult.failure(ErrorKind.CONFLICT, "ALREADY_BANNED",
                    "User is already banned; lift the existing ban first");
        }

        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_BAN_REASON : reason;
        try {
            protocolClient.ban(roomId, target, effectiveReason);
        } catch (ProtocolClientException ex) {
            log.warn("Ban of {} in room {} rejected by homeserver", target, roomId, ex);
            return ProtocolFailures.upstream("BAN_FAILED", ex);
        }

        Instant now = clock.instant();
        BanRecord record = BanRecord.create(target, moderator, effectiveReason, now, durationMs);
        boolean recordWritten = true;
        try {
            banStateStore.write(roomId, record);
        } catch (ProtocolClientException ex) {
            recordWritten = false;
            log.warn("Banned {} in room {} but could not persist the ban record", target, roomId, ex);
        }

        // The ban is live either way, so the timer is armed even without a record.
        record.expiryInstant().ifPresent(expiry -> scheduleReversal(roomId, target, expiry));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("duration", Long.toString(record.durationMs()));
        if (record.expiresAt() != null) {
            metadata.put("expiresAt", record.expiresAt());
        }
        appendLog(roomId, ModerationAction.BAN_USER, moderator, target, effectiveReason, metadata);
        log.info("{} banned {} in room {} (durationMs={})", moderator, target, roomId, record.durationMs());

        if (!recordWritten) {
            return OperationResult.failure(ErrorKind.UPSTREAM_FAILURE, "BAN_RECORD_WRITE_FAILED",
                    "User was banned but the ban record could not be stored; expiry relies on the in-process timer");
        }
        return OperationResult.success(record);
    }

    /**
     * Lifts a ban. The caller needs the room's ban level and, when someone else placed the ban,
     * at least that banner's current level.
     */
    public OperationResult<Void> unban(String roomId, String moderator, String target) {
        OperationResult<ActionContext> context = resolve(roomId, moderator, target);
        if (!context.isSuccess()) {
            return context.propagate();
        }
        ActionContext ctx = context.value();
        if (ctx.moderatorLevel() < ctx.levels().ban()) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_LEVEL",
                    "You don't have permission to unban users");
        }
        if (ctx.targetMembership() != Membership.BAN) {
            clearStaleRecord(roomId, target);
            return OperationResult.failure(ErrorKind.NOT_FOUND, "NOT_BANNED", "User is not banned in this room");
        }

        Optional<BanRecord> record;
        try {
            record = banStateStore.read(roomId, target);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.upstream("BAN_RECORD_READ_FAILED", ex);
        }
        if (record.isPresent() && record.get().bannedBy() != null && !record.get().bannedBy().equals(moderator)) {
            int bannerLevel = ctx.levels().userLevel(record.get().bannedBy());
            if (ctx.moderatorLevel() < bannerLevel) {
                return OperationResult.failure(ErrorKind.UNAUTHORIZED, "BANNED_BY_HIGHER_LEVEL",
                        "This ban was placed by someone with a higher level");
            }
        }

        try {
            protocolClient.unban(roomId, target);
        } catch (ProtocolClientException ex) {
            log.warn("Unban of {} in room {} rejected by homeserver", target, roomId, ex);
            return ProtocolFailures.upstream("UNBAN_FAILED", ex);
        }
        clearRecord(roomId, target);
        appendLog(roomId, ModerationAction.UNBAN_USER, moderator, target, null, Map.of());
        log.info("{} unbanned {} in room {}", moderator, target, roomId);
        return OperationResult.success();
    }

    public OperationResult<Void> kick(String roomId, String moderator, String target, String reason) {
        if (moderator.equals(target)) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "CANNOT_KICK_SELF", "You cannot kick yourself");
        }
        OperationResult<ActionContext> context = resolve(roomId, moderator, target);
        if (!context.isSuccess()) {
            return context.propagate();
        }
        ActionContext ctx = context.value();
        if (ctx.targetMembership() != Membership.JOIN && ctx.targetMembership() != Membership.INVITE
                && ctx.targetMembership() != Membership.KNOCK) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "TARGET_NOT_IN_ROOM", "User not found in this room");
        }
        if (ctx.moderatorLevel() <= ctx.targetLevel() || ctx.moderatorLevel() < ctx.levels().kick()) {
            return OperationResult.failure(ErrorKind.UNAUTHORIZED, "INSUFFICIENT_LEVEL",
                    "You don't have permission to kick this user");
        }

        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_KICK_REASON : reason;
        try {
            protocolClient.kick(roomId, target, effectiveReason);
        } catch (ProtocolClientException ex) {
            log.warn("Kick of {} in room {} rejected by homeserver", target, roomId, ex);
            return ProtocolFailures.upstream("KICK_FAILED", ex);
        }
        appendLog(roomId, ModerationAction.KICK_USER, moderator, target, effectiveReason, Map.of());
        log.info("{} kicked {} from room {}", moderator, target, roomId);
        return OperationResult.success();
    }

    /**
     * Single reversal path for timers and sweeps. Re-reads membership first: a target that is
     * no longer banned is left alone with no writes at all.
     */
    public OperationResult<ReversalOutcome> reverseIfActive(String roomId, String target) {
        Optional<Membership> membership;
        try {
            membership = protocolClient.getMembership(roomId, target);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        if (membership.isEmpty() || membership.get() != Membership.BAN) {
            return OperationResult.success(ReversalOutcome.NOT_BANNED);
        }

        try {
            protocolClient.unban(roomId, target);
        } catch (ProtocolClientException ex) {
            log.warn("Automatic unban of {} in room {} failed", target, roomId, ex);
            return ProtocolFailures.upstream("UNBAN_FAILED", ex);
        }
        clearRecord(roomId, target);

        String serviceAccount;
        try {
            serviceAccount = protocolClient.ownUserId();
        } catch (ProtocolClientException ex) {
            serviceAccount = "system";
        }
        appendLog(roomId, ModerationAction.AUTO_UNBAN, serviceAccount, target, "Ban expired", Map.of());
        log.info("Ban of {} in room {} expired and was lifted", target, roomId);
        return OperationResult.success(ReversalOutcome.REVERSED);
    }

    /**
     * Observational only: never reverses anything. A record whose target is not banned is stale
     * and reads as not banned.
     */
    public OperationResult<BanInfo> getBanInfo(String roomId, String target) {
        Optional<Membership> membership;
        Optional<BanRecord> record;
        try {
            membership = protocolClient.getMembership(roomId, target);
            record = banStateStore.read(roomId, target);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        if (record.isEmpty() || membership.isEmpty() || membership.get() != Membership.BAN) {
            return OperationResult.success(BanInfo.notBanned());
        }
        return OperationResult.success(new BanInfo(true, record.get(), record.get().isExpiredAt(clock.instant())));
    }

    /**
     * Live ban records, newest first. Stale records are skipped.
     */
    public OperationResult<List<BanRecord>> getBannedUsers(String roomId) {
        List<BanRecord> banned = new ArrayList<>();
        try {
            for (BanRecord record : banStateStore.enumerate(roomId)) {
                Optional<Membership> membership = protocolClient.getMembership(roomId, record.targetUserId());
                if (membership.isPresent() && membership.get() == Membership.BAN) {
                    banned.add(record);
                }
            }
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
        banned.sort(Comparator.comparing(BanRecord::bannedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return OperationResult.success(banned);
    }

    public OperationResult<ModerationRole> getUserRole(String roomId, String userId) {
        try {
            int level = protocolClient.getUserLevel(roomId, userId);
            return OperationResult.success(ModerationRole.fromLevel(level));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
    }

    public OperationResult<List<ModerationLogEntry>> getModerationLogs(String roomId, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LOG_LIMIT : Math.min(limit, MAX_LOG_LIMIT);
        try {
            return OperationResult.success(moderationLogStore.list(roomId, effectiveLimit));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
    }

    private void scheduleReversal(String roomId, String target, Instant expiry) {
        taskScheduler.schedule(() -> onBanTimerFired(roomId, target, expiry), expiry);
        log.debug("Armed expiry timer for {} in room {} at {}", target, roomId, expiry);
    }

    /**
     * Skips when the target has since been re-banned with a later or no expiry; otherwise
     * defers to {@link #reverseIfActive}.
     */
    void onBanTimerFired(String roomId, String target, Instant scheduledExpiry) {
        try {
            Optional<BanRecord> current = banStateStore.read(roomId, target);
            if (current.isPresent()) {
                BanRecord record = current.get();
                boolean supersededByLaterBan = record.isPermanent()
                        || record.hasMalformedExpiry()
                        || record.expiryInstant().map(expiry -> expiry.isAfter(scheduledExpiry)).orElse(false);
                if (supersededByLaterBan) {
                    log.debug("Timer for {} in room {} superseded by a newer ban", target, roomId);
                    return;
                }
            }
            OperationResult<ReversalOutcome> outcome = reverseIfActive(roomId, target);
            if (!outcome.isSuccess()) {
                log.warn("Timed unban of {} in room {} failed: {}; the next sweep will retry",
                        target, roomId, outcome.errorOrNull().message());
            }
        } catch (RuntimeException ex) {
            log.error("Timed unban of {} in room {} crashed; the next sweep will retry", target, roomId, ex);
        }
    }

    private void clearRecord(String roomId, String target) {
        try {
            banStateStore.clear(roomId, target);
        } catch (ProtocolClientException ex) {
            // Membership is no longer ban, so the leftover record reads as stale.
            log.warn("Could not clear ban record of {} in room {}", target, roomId, ex);
        }
    }

    private void clearStaleRecord(String roomId, String target) {
        try {
            if (banStateStore.read(roomId, target).isPresent()) {
                banStateStore.clear(roomId, target);
                log.info("Cleared stale ban record of {} in room {}", target, roomId);
            }
        } catch (ProtocolClientException ex) {
            log.warn("Could not clear stale ban record of {} in room {}", target, roomId, ex);
        }
    }

    private void appendLog(String roomId, ModerationAction action, String moderator, String target, String reason,
                           Map<String, String> metadata) {
        Instant now = clock.instant();
        ModerationLogEntry entry = new ModerationLogEntry(
                ModerationLogStore.newLogId(now), action, moderator, target, reason, now, metadata);
        try {
            moderationLogStore.append(roomId, entry);
        } catch (ProtocolClientException ex) {
            log.warn("Failed to record {} of {} in room {}", action.wireName(), target, roomId, ex);
        }
    }

    private OperationResult<ActionContext> resolve(String roomId, String moderator, String target) {
        try {
            LevelDocument levels = protocolClient.getLevelDocument(roomId)
                    .orElse(LevelDocument.defaults(AuthorizationLevels.MEMBER));
            Optional<Membership> moderatorMembership = protocolClient.getMembership(roomId, moderator);
            if (moderatorMembership.isEmpty() || moderatorMembership.get() != Membership.JOIN) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "MODERATOR_NOT_IN_ROOM",
                        "Moderator is not a member of this room");
            }
            Optional<Membership> targetMembership = protocolClient.getMembership(roomId, target);
            if (targetMembership.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "TARGET_NOT_FOUND", "User not found in this room");
            }
            return OperationResult.success(new ActionContext(
                    levels,
                    levels.userLevel(moderator),
                    levels.userLevel(target),
                    targetMembership.get()
            ));
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }
    }

    private record ActionContext(LevelDocument levels, int moderatorLevel, int targetLevel, Membership targetMembership) {
    }
}
