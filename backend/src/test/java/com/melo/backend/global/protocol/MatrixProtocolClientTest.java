package com.melo.backend.global.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatrixProtocolClientTest {

    private static final String PREFIX = "/_matrix/client/v3";
    private static final String ROOM_PATH = PREFIX + "/rooms/%21room%3Amelo.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, StubResponse> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private MatrixProtocolClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        client = new MatrixProtocolClient(
                objectMapper,
                "http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "service-token",
                "PT2S"
        );
        stub("GET", PREFIX + "/account/whoami", 200, "{\"user_id\":\"@melo-bot:melo.test\"}");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("권한 레벨 문서를 읽고 경로 세그먼트를 인코딩한다")
    void readsLevelDocument() {
        stub("GET", ROOM_PATH + "/state/m.room.power_levels/", 200, "{\"ban\":60,\"users\":{\"@a:melo.test\":100}}");

        LevelDocument document = client.getLevelDocument("!room:melo.test").orElseThrow();

        assertThat(document.ban()).isEqualTo(60);
        assertThat(document.userLevel("@a:melo.test")).isEqualTo(100);
        assertThat(requests.get(0).authorization()).isEqualTo("Bearer service-token");
    }

    @Test
    @DisplayName("404 상태 조회는 빈 값으로 돌아온다")
    void missingStateIsEmpty() {
        stub("GET", ROOM_PATH + "/state/m.room.member/%40ghost%3Amelo.test", 404,
                "{\"errcode\":\"M_NOT_FOUND\",\"error\":\"Event not found\"}");

        assertThat(client.getMembership("!room:melo.test", "@ghost:melo.test")).isEmpty();
    }

    @Test
    @DisplayName("밴 요청은 user_id와 reason을 본문에 담는다")
    void banPostsUserAndReason() throws Exception {
        stub("POST", ROOM_PATH + "/ban", 200, "{}");

        client.ban("!room:melo.test", "@t:melo.test", "spam");

        JsonNode body = objectMapper.readTree(requests.get(0).body());
        assertThat(body.path("user_id").asText()).isEqualTo("@t:melo.test");
        assertThat(body.path("reason").asText()).isEqualTo("spam");
    }

    @Test
    @DisplayName("홈서버 오류는 errcode와 메시지를 담은 예외가 된다")
    void errorResponseBecomesException() {
        stub("POST", ROOM_PATH + "/unban", 403, "{\"errcode\":\"M_FORBIDDEN\",\"error\":\"You don't have permission to unban\"}");

        assertThatThrownBy(() -> client.unban("!room:melo.test", "@t:melo.test"))
                .isInstanceOf(ProtocolClientException.class)
                .hasMessage("You don't have permission to unban")
                .satisfies(ex -> {
                    ProtocolClientException failure = (ProtocolClientException) ex;
                    assertThat(failure.getStatus()).isEqualTo(403);
                    assertThat(failure.getErrcode()).isEqualTo("M_FORBIDDEN");
                });
    }

    @Test
    @DisplayName("상태 목록에서 요청한 타입만 골라낸다")
    void enumeratesOnlyRequestedType() {
        stub("GET", ROOM_PATH + "/state", 200, """
                [
                  {"type":"org.melo.moderation.ban","state_key":"@a:melo.test","content":{"duration":0}},
                  {"type":"m.room.member","state_key":"@a:melo.test","content":{"membership":"ban"}},
                  {"type":"org.melo.moderation.ban","state_key":"@b:melo.test","content":{}}
                ]
                """);

        List<DurableRecord> records = client.enumerateDurableRecords("!room:melo.test", "org.melo.moderation.ban");

        assertThat(records).extracting(DurableRecord::target).containsExactly("@a:melo.test", "@b:melo.test");
    }

    @Test
    @DisplayName("계정 데이터는 서비스 계정 경로로 읽고 쓴다")
    void accountDataUsesServiceAccountPath() throws Exception {
        String path = PREFIX + "/user/%40melo-bot%3Amelo.test/rooms/%21room%3Amelo.test/account_data/dev.haos.custom_roles";
        stub("PUT", path, 200, "{}");
        stub("GET", path, 200, "{\"version\":\"1.0.0\",\"roles\":[]}");

        client.writeAccountDocument("!room:melo.test", "dev.haos.custom_roles", objectMapper.readTree("{\"roles\":[]}"));
        JsonNode read = client.readAccountDocument("!room:melo.test", "dev.haos.custom_roles").orElseThrow();

        assertThat(read.path("version").asText()).isEqualTo("1.0.0");
        assertThat(requests).extracting(RecordedRequest::method).containsExactly("GET", "PUT", "GET");
    }

    @Test
    @DisplayName("연결할 수 없으면 전송 오류로 보고한다")
    void transportFailure() {
        server.stop(0);

        assertThatThrownBy(client::joinedRooms)
                .isInstanceOf(ProtocolClientException.class)
                .extracting(ex -> ((ProtocolClientException) ex).getErrcode())
                .isEqualTo(ProtocolClientException.ERRCODE_TRANSPORT);
    }

    private void stub(String method, String rawPath, int status, String body) {
        routes.put(method + " " + rawPath, new StubResponse(status, body));
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String rawPath = exchange.getRequestURI().getRawPath();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new RecordedRequest(method, rawPath, exchange.getRequestHeaders().getFirst("Authorization"), body));

        StubResponse response = routes.getOrDefault(method + " " + rawPath,
                new StubResponse(404, "{\"errcode\":\"M_UNRECOGNIZED\",\"error\":\"no stub for " + rawPath + "\"}"));
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private record StubResponse(int status, String body) {
    }

    private record RecordedRequest(String method, String path, String authorization, String body) {
    }
}
