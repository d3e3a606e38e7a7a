package com.melo.backend.modules.moderation.application;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.global.protocol.ProtocolFailures;
import com.melo.backend.modules.moderation.domain.BanRecord;
import com.melo.backend.modules.moderation.domain.ReversalOutcome;
import com.melo.backend.modules.moderation.domain.SweepReport;
import com.melo.backend.modules.moderation.infrastructure.BanStateStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reconciles timed bans whose in-process timer was lost, for example across a restart.
 */
@Component
public class BanExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(BanExpirySweeper.class);

    private final ProtocolClient protocolClient;
    private final BanStateStore banStateStore;
    private final ModerationService moderationService;
    private final Clock clock;

    public BanExpirySweeper(
            ProtocolClient protocolClient,
            BanStateStore banStateStore,
            ModerationService moderationService,
            Clock clock
    ) {
        this.protocolClient = protocolClient;
        this.banStateStore = banStateStore;
        this.moderationService = moderationService;
        this.clock = clock;
    }

    /**
     * Reverses every record in the room whose expiry has passed. One failing target never stops
     * the scan; records with an unparseable expiry are counted as checked and left alone.
     */
    public OperationResult<SweepReport> checkExpiredBans(String roomId) {
        List<BanRecord> records;
        try {
            records = banStateStore.enumerate(roomId);
        } catch (ProtocolClientException ex) {
            return ProtocolFailures.resolution("ROOM_NOT_FOUND", ex);
        }

        Instant now = clock.instant();
        int reversed = 0;
        List<SweepReport.SweepError> errors = new ArrayList<>();
        for (BanRecord record : records) {
            if (!record.isExpiredAt(now)) {
                continue;
            }
            try {
                OperationResult<ReversalOutcome> outcome = moderationService.reverseIfActive(roomId, record.targetUserId());
                if (!outcome.isSuccess()) {
                    errors.add(new SweepReport.SweepError(record.targetUserId(), outcome.errorOrNull().message()));
                } else if (outcome.value() == ReversalOutcome.REVERSED) {
                    reversed++;
                }
            } catch (RuntimeException ex) {
                log.warn("Sweep of {} in room {} failed", record.targetUserId(), roomId, ex);
                errors.add(new SweepReport.SweepError(record.targetUserId(), String.valueOf(ex.getMessage())));
            }
        }
        return OperationResult.success(new SweepReport(records.size(), reversed, errors));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void sweepOnStartup() {
        log.info("Running start-up ban expiry sweep");
        sweepAllRooms();
    }

    @Scheduled(fixedDelayString = "${app.moderation.sweep-interval:PT30S}")
    public void sweepAllRooms() {
        List<String> rooms;
        try {
            rooms = protocolClient.joinedRooms();
        } catch (ProtocolClientException ex) {
            log.warn("Skipping ban expiry sweep: could not list joined rooms", ex);
            return;
        }
        for (String roomId : rooms) {
            OperationResult<SweepReport> result = checkExpiredBans(roomId);
            if (!result.isSuccess()) {
                log.warn("Ban expiry sweep of room {} failed: {}", roomId, result.errorOrNull().message());
                continue;
            }
            SweepReport report = result.value();
            if (report.reversed() > 0 || !report.errors().isEmpty()) {
                log.info("Ban expiry sweep of room {}: checked={}, reversed={}, errors={}",
                        roomId, report.checked(), report.reversed(), report.errors().size());
            }
        }
    }
}
