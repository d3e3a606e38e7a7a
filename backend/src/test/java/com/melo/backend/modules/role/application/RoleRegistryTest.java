package com.melo.backend.modules.role.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import com.melo.backend.global.common.result.ErrorKind;
import com.melo.backend.global.common.result.OperationResult;
import com.melo.backend.global.protocol.ProtocolClientException;
import com.melo.backend.modules.permission.application.AuthorizationModel;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.PermissionTemplate;
import com.melo.backend.modules.role.domain.Role;
import com.melo.backend.modules.role.domain.RolePatch;
import com.melo.backend.modules.role.domain.RolePosition;
import com.melo.backend.modules.role.domain.RoleSpec;
import com.melo.backend.modules.role.infrastructure.RoleDocumentStore;
import com.melo.backend.support.InMemoryProtocolClient;
import com.melo.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoleRegistryTest {

    private static final String ROOM = "!room:melo.test";

    private InMemoryProtocolClient protocolClient;
    private MutableClock clock;
    private RoleRegistry roleRegistry;

    @BeforeEach
    void setUp() {
        protocolClient = new InMemoryProtocolClient().createRoom(ROOM);
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        roleRegistry = new RoleRegistry(new RoleDocumentStore(protocolClient), protocolClient, new AuthorizationModel(), clock);
    }

    @Test
    @DisplayName("레벨 50 역할을 삭제하면 해당 멤버는 0으로 강등되고 위치는 1..N으로 재정렬된다")
    void delete_demotesMembersAndRenumbers() {
        protocolClient.join(ROOM, "@a:melo.test", 50).join(ROOM, "@b:melo.test", 50).join(ROOM, "@owner:melo.test", 100);
        String first = create("Helpers", 25);
        String moderators = create("Moderators", 50);
        clock.advance(Duration.ofSeconds(1));
        String third = create("Regulars", 0);

        OperationResult<Void> result = roleRegistry.delete(ROOM, moderators);

        assertThat(result.isSuccess()).isTrue();
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isZero();
        assertThat(protocolClient.getUserLevel(ROOM, "@b:melo.test")).isZero();
        assertThat(protocolClient.getUserLevel(ROOM, "@owner:melo.test")).isEqualTo(100);
        List<Role> remaining = roleRegistry.list(ROOM).value();
        assertThat(remaining).extracting(Role::id).containsExactly(first, third);
        assertThat(remaining).extracting(Role::position).containsExactly(1, 2);
    }

    @Test
    @DisplayName("이름 중복은 대소문자를 구분하지 않고 거부된다")
    void create_rejectsDuplicateNameIgnoringCase() {
        create("Moderators", 50);

        OperationResult<String> duplicate = roleRegistry.create(ROOM, spec("moderators", 40, null));

        assertThat(duplicate.errorOrNull().kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(duplicate.errorOrNull().code()).isEqualTo("DUPLICATE_NAME");
    }

    @Test
    @DisplayName("잘못된 이름은 문서를 읽기 전에 거부된다")
    void create_rejectsInvalidNameWithoutIo() {
        OperationResult<String> withAt = roleRegistry.create(ROOM, spec("@mods", 50, null));
        OperationResult<String> tooLong = roleRegistry.create(ROOM, spec("x".repeat(33), 50, null));

        assertThat(withAt.errorOrNull().kind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(tooLong.errorOrNull().kind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(protocolClient.callCount("readAccountDocument")).isZero();
    }

    @Test
    @DisplayName("권한을 생략하면 가장 가까운 템플릿의 권한을 쓴다")
    void create_defaultsCapabilitiesFromTemplate() {
        String id = create("Mods", 60);

        Role role = find(id);
        assertThat(role.capabilities()).containsExactlyInAnyOrderElementsOf(PermissionTemplate.MODERATOR.capabilities());
        assertThat(role.color()).isEqualTo("#7289da");
        assertThat(role.position()).isEqualTo(1);
    }

    @Test
    @DisplayName("명시한 권한이 레벨에 비해 과하면 거부된다")
    void create_rejectsCapabilitiesAboveLevel() {
        OperationResult<String> result = roleRegistry.create(ROOM,
                spec("Helpers", 25, Set.of(Capability.VIEW_CHANNELS, Capability.BAN_MEMBERS)));

        assertThat(result.errorOrNull().code()).isEqualTo("INVALID_CAPABILITIES");
    }

    @Test
    @DisplayName("레벨을 바꾸면 이전 레벨의 모든 사용자가 새 레벨로 옮겨진다")
    void update_levelChangeReassignsUsers() {
        protocolClient.join(ROOM, "@a:melo.test", 50).join(ROOM, "@b:melo.test", 25);
        String id = create("Moderators", 50);

        OperationResult<Role> result = roleRegistry.update(ROOM, id, new RolePatch(null, null, null, 60, null, null, null));

        assertThat(result.value().level()).isEqualTo(60);
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isEqualTo(60);
        assertThat(protocolClient.getUserLevel(ROOM, "@b:melo.test")).isEqualTo(25);
    }

    @Test
    @DisplayName("레벨 변경 중 역할 문서 저장이 실패하면 사용자 레벨도 그대로 남는다")
    void update_roleWriteFailureLeavesLevelsUntouched() {
        protocolClient.join(ROOM, "@a:melo.test", 50);
        String id = create("Moderators", 50);
        protocolClient.failOn("writeAccountDocument", new ProtocolClientException(500, "M_UNKNOWN", "boom"));

        OperationResult<Role> result = roleRegistry.update(ROOM, id, new RolePatch(null, null, null, 60, null, null, null));

        assertThat(result.errorOrNull().code()).isEqualTo("ROLE_DOCUMENT_WRITE_FAILED");
        assertThat(protocolClient.callCount("setLevelDocument")).isZero();
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isEqualTo(50);
        protocolClient.clearFailures();
        assertThat(find(id).level()).isEqualTo(50);
    }

    @Test
    @DisplayName("레벨 변경 중 레벨 문서 저장이 실패하면 역할 문서를 원래대로 되돌린다")
    void update_levelWriteFailureRestoresRole() {
        protocolClient.join(ROOM, "@a:melo.test", 50);
        String id = create("Moderators", 50);
        protocolClient.failOn("setLevelDocument", new ProtocolClientException(403, "M_FORBIDDEN", "not allowed"));

        OperationResult<Role> result = roleRegistry.update(ROOM, id, new RolePatch("Wardens", null, null, 60, null, null, null));

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isEqualTo(50);
        Role role = find(id);
        assertThat(role.level()).isEqualTo(50);
        assertThat(role.name()).isEqualTo("Moderators");
    }

    @Test
    @DisplayName("삭제 중 역할 문서 저장이 실패하면 멤버를 강등하지 않는다")
    void delete_roleWriteFailureKeepsMembers() {
        protocolClient.join(ROOM, "@a:melo.test", 50);
        String id = create("Moderators", 50);
        protocolClient.failOn("writeAccountDocument", new ProtocolClientException(500, "M_UNKNOWN", "boom"));

        OperationResult<Void> result = roleRegistry.delete(ROOM, id);

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isEqualTo(50);
        protocolClient.clearFailures();
        assertThat(roleRegistry.list(ROOM).value()).extracting(Role::id).containsExactly(id);
    }

    @Test
    @DisplayName("삭제 중 강등이 실패하면 역할이 다시 살아난다")
    void delete_demotionFailureRestoresRole() {
        protocolClient.join(ROOM, "@a:melo.test", 50);
        String id = create("Moderators", 50);
        protocolClient.failOn("setLevelDocument", new ProtocolClientException(403, "M_FORBIDDEN", "not allowed"));

        OperationResult<Void> result = roleRegistry.delete(ROOM, id);

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
        assertThat(protocolClient.getUserLevel(ROOM, "@a:melo.test")).isEqualTo(50);
        assertThat(roleRegistry.list(ROOM).value()).extracting(Role::id).containsExactly(id);
    }

    @Test
    @DisplayName("자기 자신의 이름으로 다시 저장하는 것은 중복이 아니다")
    void update_sameNameIsNotDuplicate() {
        String id = create("Moderators", 50);

        OperationResult<Role> result = roleRegistry.update(ROOM, id, new RolePatch("MODERATORS", "#123456", null, null, null, null, null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().name()).isEqualTo("MODERATORS");
        assertThat(result.value().color()).isEqualTo("#123456");
    }

    @Test
    @DisplayName("기본 역할은 삭제할 수 없다")
    void delete_defaultRoleIsRejected() {
        List<Role> seeded = roleRegistry.initializeDefaults(ROOM).value();
        Role member = seeded.stream().filter(Role::defaultRole).findFirst().orElseThrow();

        OperationResult<Void> result = roleRegistry.delete(ROOM, member.id());

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(roleRegistry.list(ROOM).value()).hasSize(3);
    }

    @Test
    @DisplayName("기본 역할 초기화는 역할이 이미 있으면 아무것도 바꾸지 않는다")
    void initializeDefaults_isNoOpWhenRolesExist() {
        create("Custom", 10);

        List<Role> roles = roleRegistry.initializeDefaults(ROOM).value();

        assertThat(roles).extracting(Role::name).containsExactly("Custom");
    }

    @Test
    @DisplayName("재정렬은 주어진 위치를 그대로 적용한다")
    void reorder_appliesPositionsVerbatim() {
        String a = create("A", 10);
        String b = create("B", 20);

        List<Role> reordered = roleRegistry.reorder(ROOM, List.of(new RolePosition(a, 7), new RolePosition(b, 3))).value();

        assertThat(reordered).extracting(Role::id).containsExactly(b, a);
        assertThat(reordered).extracting(Role::position).containsExactly(3, 7);
    }

    @Test
    @DisplayName("알 수 없는 역할로 재정렬하면 NOT_FOUND")
    void reorder_unknownRole() {
        OperationResult<List<Role>> result = roleRegistry.reorder(ROOM, List.of(new RolePosition("role_missing", 1)));

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("역할 배정은 사용자 레벨을 바꾸고 멤버 수를 늘린다")
    void assignUserToRole_setsLevelAndCounts() {
        protocolClient.join(ROOM, "@new:melo.test", 0);
        String id = create("Helpers", 25);

        Role role = roleRegistry.assignUserToRole(ROOM, "@new:melo.test", id).value();

        assertThat(role.memberCount()).isEqualTo(1);
        assertThat(protocolClient.getUserLevel(ROOM, "@new:melo.test")).isEqualTo(25);
    }

    @Test
    @DisplayName("레벨 문서 쓰기가 실패하면 역할 문서도 바뀌지 않는다")
    void assignUserToRole_upstreamFailureLeavesDocument() {
        String id = create("Helpers", 25);
        protocolClient.failOn("setLevelDocument", new ProtocolClientException(403, "M_FORBIDDEN", "not allowed"));

        OperationResult<Role> result = roleRegistry.assignUserToRole(ROOM, "@new:melo.test", id);

        assertThat(result.errorOrNull().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
        assertThat(find(id).memberCount()).isZero();
    }

    @Test
    @DisplayName("없는 방은 ROOM_NOT_FOUND")
    void list_unknownRoom() {
        OperationResult<List<Role>> result = roleRegistry.list("!missing:melo.test");

        assertThat(result.errorOrNull().code()).isEqualTo("ROOM_NOT_FOUND");
    }

    private String create(String name, int level) {
        return roleRegistry.create(ROOM, spec(name, level, null)).value();
    }

    private Role find(String id) {
        return roleRegistry.list(ROOM).value().stream().filter(role -> role.id().equals(id)).findFirst().orElseThrow();
    }

    private static RoleSpec spec(String name, int level, Set<Capability> capabilities) {
        return new RoleSpec(name, null, null, level, capabilities, null, null);
    }
}
