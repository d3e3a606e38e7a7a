package com.melo.backend.global.protocol;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link ProtocolClient} over the Matrix client-server API (v3), authenticated as the
 * moderation service account.
 */
@Component
public class MatrixProtocolClient implements ProtocolClient {

    private static final Logger log = LoggerFactory.getLogger(MatrixProtocolClient.class);

    private static final String API_PREFIX = "/_matrix/client/v3";
    private static final String POWER_LEVELS_TYPE = "m.room.power_levels";
    private static final String MEMBER_TYPE = "m.room.member";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String homeserverUrl;
    private final String accessToken;
    private final Duration requestTimeout;

    private volatile String ownUserId;

    public MatrixProtocolClient(
            ObjectMapper objectMapper,
            @Value("${app.protocol.homeserver-url}") String homeserverUrl,
            @Value("${app.protocol.access-token}") String accessToken,
            @Value("${app.protocol.request-timeout:PT10S}") String requestTimeout
    ) {
        this.objectMapper = objectMapper;
        this.homeserverUrl = stripTrailingSlash(homeserverUrl);
        this.accessToken = accessToken;
        this.requestTimeout = Duration.parse(requestTimeout);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.requestTimeout)
                .build();
    }

    @Override
    public String ownUserId() {
        String cached = ownUserId;
        if (cached == null) {
            JsonNode whoami = send("GET", "/account/whoami", null)
                    .orElseThrow(() -> new ProtocolClientException(404, ProtocolClientException.ERRCODE_NOT_FOUND, "whoami returned no body"));
            cached = whoami.path("user_id").asText(null);
            if (cached == null) {
                throw new ProtocolClientException(200, "M_BAD_JSON", "whoami response carries no user_id");
            }
            ownUserId = cached;
        }
        return cached;
    }

    @Override
    public List<String> joinedRooms() {
        JsonNode body = send("GET", "/joined_rooms", null).orElse(null);
        List<String> rooms = new ArrayList<>();
        if (body != null) {
            body.path("joined_rooms").forEach(room -> rooms.add(room.asText()));
        }
        return rooms;
    }

    @Override
    public Optional<LevelDocument> getLevelDocument(String roomId) {
        return getStateContent(roomId, POWER_LEVELS_TYPE, "")
                .map(LevelDocument::fromJson);
    }

    @Override
    public void setLevelDocument(String roomId, LevelDocument document) {
        send("PUT", statePath(roomId, POWER_LEVELS_TYPE, ""), document.toJson());
    }

    @Override
    public void ban(String roomId, String userId, String reason) {
        send("POST", roomPath(roomId) + "/ban", membershipBody(userId, reason));
    }

    @Override
    public void unban(String roomId, String userId) {
        send("POST", roomPath(roomId) + "/unban", membershipBody(userId, null));
    }

    @Override
    public void kick(String roomId, String userId, String reason) {
        send("POST", roomPath(roomId) + "/kick", membershipBody(userId, reason));
    }

    @Override
    public void writeDurableRecord(String roomId, String recordType, String target, JsonNode payload) {
        send("PUT", statePath(roomId, recordType, target), payload);
    }

    @Override
    public Optional<JsonNode> readDurableRecord(String roomId, String recordType, String target) {
        return getStateContent(roomId, recordType, target);
    }

    @Override
    public List<DurableRecord> enumerateDurableRecords(String roomId, String recordType) {
        JsonNode state = send("GET", roomPath(roomId) + "/state", null).orElse(null);
        List<DurableRecord> records = new ArrayList<>();
        if (state == null || !state.isArray()) {
            return records;
        }
        for (JsonNode event : state) {
            if (!recordType.equals(event.path("type").asText())) {
                continue;
            }
            JsonNode stateKey = event.get("state_key");
            if (stateKey == null || !stateKey.isTextual()) {
                continue;
            }
            records.add(new DurableRecord(stateKey.asText(), event.path("content")));
        }
        return records;
    }

    @Override
    public Optional<JsonNode> readAccountDocument(String roomId, String key) {
        try {
            return send("GET", accountDataPath(roomId, key), null);
        } catch (ProtocolClientException ex) {
            if (ex.isNotFound()) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    @Override
    public void writeAccountDocument(String roomId, String key, JsonNode document) {
        send("PUT", accountDataPath(roomId, key), document);
    }

    @Override
    public Optional<Membership> getMembership(String roomId, String userId) {
        return getStateContent(roomId, MEMBER_TYPE, userId)
                .map(content -> Membership.fromWire(content.path("membership").asText(null)));
    }

    private Optional<JsonNode> getStateContent(String roomId, String type, String stateKey) {
        try {
            return send("GET", statePath(roomId, type, stateKey), null);
        } catch (ProtocolClientException ex) {
            if (ex.isNotFound()) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    private ObjectNode membershipBody(String userId, String reason) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("user_id", userId);
        if (reason != null && !reason.isBlank()) {
            body.put("reason", reason);
        }
        return body;
    }

    private Optional<JsonNode> send(String method, String path, JsonNode body) {
        String url = homeserverUrl + API_PREFIX + path;
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new ProtocolClientException(0, "M_BAD_JSON", "Failed to serialize request: " + e.getOriginalMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + accessToken)
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .method(method, publisher)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProtocolClientException(0, ProtocolClientException.ERRCODE_TRANSPORT, "Request timeout: " + method + " " + path, e);
        } catch (IOException e) {
            throw new ProtocolClientException(0, ProtocolClientException.ERRCODE_TRANSPORT, "IO error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolClientException(0, ProtocolClientException.ERRCODE_TRANSPORT, "Request interrupted: " + method + " " + path, e);
        }

        int statusCode = response.statusCode();
        JsonNode parsed = parseBody(response.body());
        if (statusCode >= 200 && statusCode < 300) {
            log.debug("{} {} returned {}", method, path, statusCode);
            return Optional.ofNullable(parsed);
        }

        String errcode = parsed != null ? parsed.path("errcode").asText(null) : null;
        String error = parsed != null ? parsed.path("error").asText(null) : null;
        String message = error != null ? error : "Homeserver returned " + statusCode;
        if (statusCode != 404) {
            log.warn("Homeserver error: {} {} returned {} ({})", method, path, statusCode, errcode);
        }
        throw new ProtocolClientException(statusCode, errcode, message);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolClientException(0, "M_BAD_JSON", "Malformed homeserver response: " + e.getOriginalMessage(), e);
        }
    }

    private String roomPath(String roomId) {
        return "/rooms/" + encode(roomId);
    }

    private String statePath(String roomId, String type, String stateKey) {
        return roomPath(roomId) + "/state/" + encode(type) + "/" + encode(stateKey);
    }

    private String accountDataPath(String roomId, String key) {
        return "/user/" + encode(ownUserId()) + roomPath(roomId) + "/account_data/" + encode(key);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
