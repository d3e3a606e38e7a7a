package com.melo.backend.modules.moderation.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.Membership;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.modules.moderation.domain.BanRecord;
import com.melo.backend.modules.moderation.domain.SweepReport;
import com.melo.backend.modules.moderation.infrastructure.BanStateStore;
import com.melo.backend.modules.moderation.infrastructure.ModerationLogStore;
import com.melo.backend.support.InMemoryProtocolClient;
import com.melo.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class BanExpirySweeperTest {

    private static final String ROOM = "!room:melo.test";
    private static final String MOD = "@mod:melo.test";
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private TaskScheduler taskScheduler;

    private InMemoryProtocolClient protocolClient;
    private BanStateStore banStateStore;
    private MutableClock clock;
    private BanExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        protocolClient = new InMemoryProtocolClient().createRoom(ROOM).join(ROOM, MOD, 50);
        banStateStore = new BanStateStore(protocolClient);
        clock = new MutableClock(START);
        ModerationService moderationService = new ModerationService(
                protocolClient, banStateStore, new ModerationLogStore(protocolClient), taskScheduler, clock, "P365D");
        sweeper = new BanExpirySweeper(protocolClient, banStateStore, moderationService, clock);
    }

    @Test
    @DisplayName("다섯 기록 중 만료 시각이 잘못된 하나는 해제도 오류도 아니다")
    void malformedExpiry_isNeitherReversedNorError() {
        for (int i = 1; i <= 4; i++) {
            bannedWithRecord("@user" + i + ":melo.test", START.minusSeconds(10).toString());
        }
        bannedWithRecord("@broken:melo.test", "not-a-timestamp");

        SweepReport report = sweeper.checkExpiredBans(ROOM).value();

        assertThat(report.checked()).isEqualTo(5);
        assertThat(report.reversed()).isEqualTo(4);
        assertThat(report.errors()).isEmpty();
        assertThat(protocolClient.getMembership(ROOM, "@broken:melo.test")).contains(Membership.BAN);
        assertThat(banStateStore.read(ROOM, "@broken:melo.test")).isPresent();
    }

    @Test
    @DisplayName("아직 만료되지 않았거나 영구인 밴은 건드리지 않는다")
    void activeAndPermanentBans_areLeftAlone() {
        bannedWithRecord("@later:melo.test", START.plus(Duration.ofHours(1)).toString());
        bannedWithRecord("@forever:melo.test", null);

        SweepReport report = sweeper.checkExpiredBans(ROOM).value();

        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.reversed()).isZero();
        assertThat(protocolClient.callCount("unban")).isZero();
    }

    @Test
    @DisplayName("대상별 오류는 모아서 보고하고 나머지 처리는 계속한다")
    void perTargetErrors_doNotAbortScan() {
        bannedWithRecord("@a:melo.test", START.minusSeconds(1).toString());
        bannedWithRecord("@b:melo.test", START.minusSeconds(1).toString());
        protocolClient.failOn("unban", new ProtocolClientException(502, "M_UNKNOWN", "gateway"));

        SweepReport report = sweeper.checkExpiredBans(ROOM).value();

        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.reversed()).isZero();
        assertThat(report.errors()).extracting(SweepReport.SweepError::target)
                .containsExactlyInAnyOrder("@a:melo.test", "@b:melo.test");
        assertThat(report.errors().get(0).error()).contains("gateway");
    }

    @Test
    @DisplayName("이미 해제된 대상의 기록은 해제 호출 없이 넘어간다")
    void staleRecord_isNoOp() {
        bannedWithRecord("@gone:melo.test", START.minusSeconds(1).toString());
        protocolClient.setMembership(ROOM, "@gone:melo.test", Membership.LEAVE);

        SweepReport report = sweeper.checkExpiredBans(ROOM).value();

        assertThat(report.reversed()).isZero();
        assertThat(report.errors()).isEmpty();
        assertThat(protocolClient.callCount("unban")).isZero();
    }

    @Test
    @DisplayName("같은 방을 연달아 정리해도 해제는 한 번만 일어난다")
    void repeatedSweeps_areIdempotent() {
        bannedWithRecord("@a:melo.test", START.minusSeconds(1).toString());

        sweeper.checkExpiredBans(ROOM);
        SweepReport second = sweeper.checkExpiredBans(ROOM).value();

        assertThat(second.checked()).isZero();
        assertThat(protocolClient.callCount("unban")).isEqualTo(1);
    }

    @Test
    @DisplayName("없는 방은 NOT_FOUND 결과로 돌아온다")
    void unknownRoom_isFailure() {
        OperationResult<SweepReport> result = sweeper.checkExpiredBans("!missing:melo.test");

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("전체 정리는 참여 중인 모든 방을 훑는다")
    void sweepAllRooms_visitsJoinedRooms() {
        protocolClient.createRoom("!other:melo.test");
        protocolClient.join("!other:melo.test", MOD, 50);
        bannedWithRecord("@a:melo.test", START.minusSeconds(1).toString());
        protocolClient.setMembership("!other:melo.test", "@b:melo.test", Membership.BAN);
        protocolClient.putState("!other:melo.test", BanStateStore.RECORD_TYPE, "@b:melo.test",
                record("@b:melo.test", START.minusSeconds(1).toString()));

        sweeper.sweepAllRooms();

        assertThat(protocolClient.callCount("unban")).isEqualTo(2);
        assertThat(protocolClient.getMembership("!other:melo.test", "@b:melo.test")).contains(Membership.LEAVE);
    }

    private void bannedWithRecord(String userId, String expiresAt) {
        protocolClient.setMembership(ROOM, userId, Membership.BAN);
        protocolClient.putState(ROOM, BanStateStore.RECORD_TYPE, userId, record(userId, expiresAt));
    }

    private static ObjectNode record(String userId, String expiresAt) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("schemaVersion", BanRecord.CURRENT_SCHEMA_VERSION);
        node.put("targetUserId", userId);
        node.put("bannedBy", MOD);
        node.put("reason", "test");
        node.put("bannedAt", START.minus(Duration.ofHours(1)).toString());
        node.put("duration", expiresAt == null ? 0 : 1000);
        if (expiresAt != null) {
            node.put("expiresAt", expiresAt);
        }
        return node;
    }
}
