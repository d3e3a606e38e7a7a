package com.melo.backend.modules.moderation.infrastructure;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.melo.backend.global.protocol.DurableRecord;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.modules.moderation.domain.BanRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ban records as {@code org.melo.moderation.ban} state events keyed by target user. A cleared
 * record is an empty content and reads as absent. Membership is not consulted here.
 */
@Component
public class BanStateStore {

    public static final String RECORD_TYPE = "org.melo.moderation.ban";

    private static final Logger log = LoggerFactory.getLogger(BanStateStore.class);

    private final ProtocolClient protocolClient;

    public BanStateStore(ProtocolClient protocolClient) {
        this.protocolClient = protocolClient;
    }

    public void write(String roomId, BanRecord record) {
        protocolClient.writeDurableRecord(roomId, RECORD_TYPE, record.targetUserId(), encode(record));
    }

    public Optional<BanRecord> read(String roomId, String targetUserId) {
        return protocolClient.readDurableRecord(roomId, RECORD_TYPE, targetUserId)
                .flatMap(content -> decode(targetUserId, content));
    }

    public void clear(String roomId, String targetUserId) {
        protocolClient.writeDurableRecord(roomId, RECORD_TYPE, targetUserId, JsonNodeFactory.instance.objectNode());
    }

    public List<BanRecord> enumerate(String roomId) {
        List<BanRecord> records = new ArrayList<>();
        for (DurableRecord entry : protocolClient.enumerateDurableRecords(roomId, RECORD_TYPE)) {
            decode(entry.target(), entry.payload()).ifPresent(records::add);
        }
        return records;
    }

    ObjectNode encode(BanRecord record) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("schemaVersion", record.schemaVersion());
        node.put("targetUserId", record.targetUserId());
        node.put("bannedBy", record.bannedBy());
        if (record.reason() != null) {
            node.put("reason", record.reason());
        }
        if (record.bannedAt() != null) {
            node.put("bannedAt", record.bannedAt().toString());
        }
        node.put("duration", record.durationMs());
        if (record.expiresAt() != null) {
            node.put("expiresAt", record.expiresAt());
        }
        return node;
    }

    /**
     * Missing fields get defaults and unknown ones are ignored. The state key always wins
     * over a {@code targetUserId} field in the content.
     */
    Optional<BanRecord> decode(String stateKey, JsonNode content) {
        if (content == null || !content.isObject() || content.isEmpty()) {
            return Optional.empty();
        }
        int schemaVersion = content.path("schemaVersion").asInt(BanRecord.CURRENT_SCHEMA_VERSION);
        if (schemaVersion > BanRecord.CURRENT_SCHEMA_VERSION) {
            log.warn("Ban record for {} has schema version {} (newest known {})",
                    stateKey, schemaVersion, BanRecord.CURRENT_SCHEMA_VERSION);
        }
        JsonNode expiresAt = content.get("expiresAt");
        return Optional.of(new BanRecord(
                schemaVersion,
                stateKey,
                textOrNull(content.get("bannedBy")),
                textOrNull(content.get("reason")),
                parseInstant(textOrNull(content.get("bannedAt"))),
                Math.max(0L, content.path("duration").asLong(0L)),
                expiresAt == null || expiresAt.isNull() ? null : expiresAt.asText()
        ));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
