package com.melo.backend.modules.channel.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.modules.channel.domain.BulkOverrideAction;
import com.melo.backend.modules.channel.domain.BulkOverrideOperation;
import com.melo.backend.modules.channel.domain.BulkOverrideReport;
import com.melo.backend.modules.channel.domain.ChannelPermissions;
import com.melo.backend.modules.channel.domain.HeldRole;
import com.melo.backend.modules.channel.domain.OverrideTarget;
import com.melo.backend.modules.channel.domain.PermissionCheck;
import com.melo.backend.modules.channel.domain.PermissionOverride;
import com.melo.backend.modules.channel.domain.PermissionSource;
import com.melo.backend.modules.channel.infrastructure.ChannelPermissionStore;
import com.melo.backend.modules.permission.application.AuthorizationModel;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.role.application.RoleRegistry;
import com.melo.backend.modules.role.domain.RoleSpec;
import com.melo.backend.modules.role.infrastructure.RoleDocumentStore;
import com.melo.backend.support.InMemoryProtocolClient;
import com.melo.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChannelPermissionServiceTest {

    private static final String CHANNEL = "!channel:melo.test";
    private static final String SERVER = "!server:melo.test";
    private static final String MODERATOR = "@mod:melo.test";
    private static final String MEMBER = "@member:melo.test";
    private static final String OTHER = "@other:melo.test";

    private InMemoryProtocolClient protocolClient;
    private MutableClock clock;
    private RoleRegistry roleRegistry;
    private ChannelPermissionService service;

    @BeforeEach
    void setUp() {
        protocolClient = new InMemoryProtocolClient()
                .createRoom(CHANNEL)
                .createRoom(SERVER)
                .join(CHANNEL, MODERATOR, 50)
                .join(CHANNEL, MEMBER, 0)
                .join(CHANNEL, OTHER, 0);
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        AuthorizationModel authorizationModel = new AuthorizationModel();
        roleRegistry = new RoleRegistry(new RoleDocumentStore(protocolClient), protocolClient, authorizationModel, clock);
        service = new ChannelPermissionService(
                new ChannelPermissionStore(protocolClient), protocolClient, authorizationModel, roleRegistry, clock);
    }

    @Test
    @DisplayName("오버라이드가 없는 채널은 버전 0의 빈 설정으로 읽힌다")
    void get_emptyChannel() {
        ChannelPermissions permissions = service.getChannelPermissions(CHANNEL).value();

        assertThat(permissions.roleOverrides()).isEmpty();
        assertThat(permissions.userOverrides()).isEmpty();
        assertThat(permissions.version()).isZero();
        assertThat(permissions.inheritFromParent()).isTrue();
    }

    @Test
    @DisplayName("사용자 오버라이드가 역할 오버라이드와 기본 권한보다 우선한다")
    void check_userOverrideWinsOverRoleOverride() {
        HeldRole regulars = new HeldRole("role_regulars", "Regulars", 0);
        service.setOverride(CHANNEL, OverrideTarget.ROLE, regulars.roleId(), "Regulars",
                Map.of(Capability.SEND_MESSAGES, true), MODERATOR);
        service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null,
                Map.of(Capability.SEND_MESSAGES, false), MODERATOR);

        PermissionCheck member = service.checkPermission(CHANNEL, MEMBER, Capability.SEND_MESSAGES, List.of(regulars)).value();
        PermissionCheck other = service.checkPermission(CHANNEL, OTHER, Capability.SEND_MESSAGES, List.of(regulars)).value();

        assertThat(member.allowed()).isFalse();
        assertThat(member.source()).isEqualTo(PermissionSource.CHANNEL_USER);
        assertThat(other.allowed()).isTrue();
        assertThat(other.source()).isEqualTo(PermissionSource.CHANNEL_ROLE);
        assertThat(other.reasoning()).contains("Regulars");
    }

    @Test
    @DisplayName("오버라이드에 없는 권한은 보유 역할 중 가장 높은 레벨로 판단한다")
    void check_fallsBackToHighestRoleLevel() {
        service.setOverride(CHANNEL, OverrideTarget.ROLE, "role_helpers", null,
                Map.of(Capability.SEND_MESSAGES, false), MODERATOR);
        List<HeldRole> roles = List.of(new HeldRole("role_helpers", "Helpers", 25), new HeldRole("role_mods", "Mods", 50));

        PermissionCheck kick = service.checkPermission(CHANNEL, MEMBER, Capability.KICK_MEMBERS, roles).value();

        assertThat(kick.allowed()).isTrue();
        assertThat(kick.source()).isEqualTo(PermissionSource.ROLE);
        assertThat(kick.reasoning()).contains("50");
    }

    @Test
    @DisplayName("역할 정보가 없으면 채널에서의 사용자 레벨로 판단한다")
    void check_withoutRolesUsesChannelLevel() {
        PermissionCheck member = service.checkPermission(CHANNEL, MEMBER, Capability.KICK_MEMBERS, List.of()).value();
        PermissionCheck moderator = service.checkPermission(CHANNEL, MODERATOR, Capability.KICK_MEMBERS, null).value();

        assertThat(member.allowed()).isFalse();
        assertThat(member.source()).isEqualTo(PermissionSource.DEFAULT);
        assertThat(moderator.allowed()).isTrue();
    }

    @Test
    @DisplayName("전체 권한 조회는 한 번만 읽고 카탈로그 순서대로 반환한다")
    void effective_readsOnce() {
        service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null, Map.of(Capability.ATTACH_FILES, false), MODERATOR);
        protocolClient.resetCounters();

        List<PermissionCheck> checks = service.effectivePermissions(CHANNEL, MEMBER, List.of()).value();

        assertThat(checks).hasSize(Capability.values().length);
        assertThat(checks.get(0).capability()).isEqualTo(Capability.values()[0]);
        assertThat(checks).filteredOn(check -> check.capability() == Capability.ATTACH_FILES)
                .singleElement()
                .satisfies(check -> assertThat(check.allowed()).isFalse());
        assertThat(protocolClient.callCount("readAccountDocument")).isEqualTo(1);
    }

    @Test
    @DisplayName("오버라이드를 다시 설정하면 항목을 교체하고 생성자 정보는 유지하며 버전이 오른다")
    void set_replacesEntriesAndKeepsCreator() {
        service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, "Member",
                Map.of(Capability.SEND_MESSAGES, false, Capability.ATTACH_FILES, false), MODERATOR);
        clock.advance(Duration.ofMinutes(5));

        ChannelPermissions updated = service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null,
                Map.of(Capability.ADD_REACTIONS, false), MODERATOR).value();

        PermissionOverride override = updated.find(OverrideTarget.USER, MEMBER).orElseThrow();
        assertThat(override.permissions()).containsOnlyKeys(Capability.ADD_REACTIONS);
        assertThat(override.label()).isEqualTo("Member");
        assertThat(override.createdAt()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(override.createdBy()).isEqualTo(MODERATOR);
        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.lastUpdated()).isEqualTo(Instant.parse("2025-03-01T00:05:00Z"));
        assertThat(service.getChannelPermissions(CHANNEL).value().version()).isEqualTo(2);
    }

    @Test
    @DisplayName("없는 오버라이드를 제거하면 아무것도 쓰지 않는다")
    void remove_absentOverrideWritesNothing() {
        OperationResult<ChannelPermissions> result = service.removeOverride(CHANNEL, OverrideTarget.ROLE, "role_x", MODERATOR);

        assertThat(result.isSuccess()).isTrue();
        assertThat(protocolClient.callCount("writeAccountDocument")).isZero();
    }

    @Test
    @DisplayName("오버라이드를 제거하면 해당 권한은 다음 단계로 넘어간다")
    void remove_fallsThroughAfterwards() {
        service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null, Map.of(Capability.KICK_MEMBERS, true), MODERATOR);
        assertThat(service.checkPermission(CHANNEL, MEMBER, Capability.KICK_MEMBERS, List.of()).value().allowed()).isTrue();

        ChannelPermissions removed = service.removeOverride(CHANNEL, OverrideTarget.USER, MEMBER, MODERATOR).value();

        assertThat(removed.userOverrides()).isEmpty();
        assertThat(removed.version()).isEqualTo(2);
        assertThat(service.checkPermission(CHANNEL, MEMBER, Capability.KICK_MEMBERS, List.of()).value().allowed()).isFalse();
    }

    @Test
    @DisplayName("manage_channels가 없는 사용자는 오버라이드를 바꿀 수 없다")
    void set_requiresManageChannels() {
        OperationResult<ChannelPermissions> result = service.setOverride(CHANNEL, OverrideTarget.USER, OTHER, null,
                Map.of(Capability.SEND_MESSAGES, true), MEMBER);
        OperationResult<ChannelPermissions> removal = service.removeOverride(CHANNEL, OverrideTarget.USER, OTHER, MEMBER);

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
        assertThat(result.errorOrNull().code()).isEqualTo("CANNOT_MANAGE_CHANNEL");
        assertThat(removal.errorOrNull().code()).isEqualTo("CANNOT_MANAGE_CHANNEL");
        assertThat(protocolClient.callCount("writeAccountDocument")).isZero();
    }

    @Test
    @DisplayName("자신이 보유하지 않은 권한은 허용하거나 거부할 수 없다")
    void set_rejectsCapabilityNotHeld() {
        protocolClient.setLevels(CHANNEL, LevelDocument.defaults(0)
                .withActionLevel("ban", 75)
                .withUserLevel(MODERATOR, 50));

        OperationResult<ChannelPermissions> result = service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null,
                Map.of(Capability.BAN_MEMBERS, true), MODERATOR);
        OperationResult<BulkOverrideReport> bulk = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.DENY, OverrideTarget.USER, List.of(MEMBER), Set.of(Capability.BAN_MEMBERS), null), MODERATOR);

        assertThat(result.errorOrNull().code()).isEqualTo("CAPABILITY_NOT_HELD");
        assertThat(bulk.errorOrNull().code()).isEqualTo("CAPABILITY_NOT_HELD");
        assertThat(service.getChannelPermissions(CHANNEL).value().userOverrides()).isEmpty();
    }

    @Test
    @DisplayName("보유하지 않은 권한이 담긴 오버라이드는 복사할 수 없다")
    void bulk_copyRejectsSourceWithCapabilityNotHeld() {
        service.setOverride(CHANNEL, OverrideTarget.USER, OTHER, null, Map.of(Capability.BAN_MEMBERS, true), MODERATOR);
        protocolClient.setLevels(CHANNEL, LevelDocument.defaults(0)
                .withActionLevel("ban", 75)
                .withUserLevel(MODERATOR, 50));

        OperationResult<BulkOverrideReport> result = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.COPY, OverrideTarget.USER, List.of(MEMBER), null, OTHER), MODERATOR);

        assertThat(result.errorOrNull().code()).isEqualTo("CAPABILITY_NOT_HELD");
        assertThat(service.getChannelPermissions(CHANNEL).value().find(OverrideTarget.USER, MEMBER)).isEmpty();
    }

    @Test
    @DisplayName("일괄 허용은 기존 항목에 합쳐지고 한 번만 쓴다")
    void bulk_allowMergesWithExistingEntries() {
        service.setOverride(CHANNEL, OverrideTarget.ROLE, "role_a", "A", Map.of(Capability.ATTACH_FILES, false), MODERATOR);
        protocolClient.resetCounters();

        BulkOverrideReport report = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.ALLOW, OverrideTarget.ROLE, List.of("role_a", "role_b"),
                Set.of(Capability.SEND_MESSAGES, Capability.ADD_REACTIONS), null), MODERATOR).value();

        assertThat(report.succeeded()).containsExactly("role_a", "role_b");
        assertThat(report.failed()).isEmpty();
        assertThat(protocolClient.callCount("writeAccountDocument")).isEqualTo(1);
        ChannelPermissions stored = service.getChannelPermissions(CHANNEL).value();
        assertThat(stored.find(OverrideTarget.ROLE, "role_a").orElseThrow().permissions())
                .containsEntry(Capability.ATTACH_FILES, false)
                .containsEntry(Capability.SEND_MESSAGES, true)
                .containsEntry(Capability.ADD_REACTIONS, true);
        assertThat(stored.find(OverrideTarget.ROLE, "role_b").orElseThrow().label()).isEqualTo("Role role_b");
        assertThat(stored.version()).isEqualTo(2);
    }

    @Test
    @DisplayName("복사 원본이 없으면 대상별로 실패를 보고한다")
    void bulk_copyWithoutSourceFailsEachTarget() {
        BulkOverrideReport report = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.COPY, OverrideTarget.USER, List.of(MEMBER, OTHER), Set.of(), "@ghost:melo.test"),
                MODERATOR).value();

        assertThat(report.succeeded()).isEmpty();
        assertThat(report.failed()).extracting(BulkOverrideReport.BulkFailure::targetId).containsExactly(MEMBER, OTHER);
        assertThat(protocolClient.callCount("writeAccountDocument")).isZero();
    }

    @Test
    @DisplayName("복사는 원본의 항목으로 대상의 항목을 교체하고 초기화는 오버라이드를 지운다")
    void bulk_copyThenReset() {
        Map<Capability, Boolean> template = new EnumMap<>(Capability.class);
        template.put(Capability.SEND_MESSAGES, false);
        template.put(Capability.ADD_REACTIONS, true);
        service.setOverride(CHANNEL, OverrideTarget.USER, MEMBER, null, template, MODERATOR);
        service.setOverride(CHANNEL, OverrideTarget.USER, OTHER, null, Map.of(Capability.ATTACH_FILES, false), MODERATOR);

        service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.COPY, OverrideTarget.USER, List.of(OTHER), null, MEMBER), MODERATOR);
        assertThat(service.getChannelPermissions(CHANNEL).value().find(OverrideTarget.USER, OTHER).orElseThrow().permissions())
                .isEqualTo(template);

        BulkOverrideReport reset = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.RESET, OverrideTarget.USER, List.of(MEMBER, OTHER), null, null), MODERATOR).value();
        assertThat(reset.succeeded()).containsExactly(MEMBER, OTHER);
        assertThat(service.getChannelPermissions(CHANNEL).value().userOverrides()).isEmpty();
    }

    @Test
    @DisplayName("쓰기가 실패하면 모든 대상이 실패로 보고되고 저장된 설정은 그대로다")
    void bulk_writeFailureFailsEveryTarget() {
        protocolClient.failOn("writeAccountDocument", new ProtocolClientException(500, "M_UNKNOWN", "boom"));

        BulkOverrideReport report = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.DENY, OverrideTarget.USER, List.of(MEMBER, OTHER), Set.of(Capability.SEND_MESSAGES), null),
                MODERATOR).value();

        assertThat(report.succeeded()).isEmpty();
        assertThat(report.failed()).hasSize(2).allSatisfy(failure -> assertThat(failure.error()).contains("boom"));
        protocolClient.clearFailures();
        assertThat(service.getChannelPermissions(CHANNEL).value().version()).isZero();
    }

    @Test
    @DisplayName("잘못된 일괄 작업은 읽기 전에 거부된다")
    void bulk_rejectsInvalidOperationWithoutIo() {
        OperationResult<BulkOverrideReport> noTargets = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.RESET, OverrideTarget.USER, List.of(), null, null), MODERATOR);
        OperationResult<BulkOverrideReport> noCapabilities = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.ALLOW, OverrideTarget.USER, List.of(MEMBER), null, null), MODERATOR);
        OperationResult<BulkOverrideReport> noSource = service.executeBulk(CHANNEL, new BulkOverrideOperation(
                BulkOverrideAction.COPY, OverrideTarget.ROLE, List.of("role_a"), null, " "), MODERATOR);

        assertThat(noTargets.errorOrNull().code()).isEqualTo("TARGETS_REQUIRED");
        assertThat(noCapabilities.errorOrNull().code()).isEqualTo("CAPABILITIES_REQUIRED");
        assertThat(noSource.errorOrNull().code()).isEqualTo("COPY_SOURCE_REQUIRED");
        assertThat(noSource.errorOrNull().kind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(protocolClient.callCount("readAccountDocument")).isZero();
    }

    @Test
    @DisplayName("서버 방의 역할 중 사용자 레벨과 같은 역할을 보유 역할로 본다")
    void resolveHeldRoles_matchesLevelInServerRoom() {
        protocolClient.join(SERVER, MODERATOR, 50).join(SERVER, MEMBER, 10);
        String mods = roleRegistry.create(SERVER, new RoleSpec("Mods", null, null, 50, null, null, null)).value();

        List<HeldRole> moderatorRoles = service.resolveHeldRoles(SERVER, MODERATOR).value();
        List<HeldRole> memberRoles = service.resolveHeldRoles(SERVER, MEMBER).value();

        assertThat(moderatorRoles).containsExactly(new HeldRole(mods, "Mods", 50));
        assertThat(memberRoles).containsExactly(new HeldRole("power_level_10", "Member", 10));
    }

    @Test
    @DisplayName("존재하지 않는 채널은 NOT_FOUND로 보고된다")
    void unknownChannelIsNotFound() {
        OperationResult<PermissionCheck> result = service.checkPermission("!missing:melo.test", MEMBER,
                Capability.SEND_MESSAGES, List.of());

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.errorOrNull().code()).isEqualTo("CHANNEL_NOT_FOUND");
    }
}
