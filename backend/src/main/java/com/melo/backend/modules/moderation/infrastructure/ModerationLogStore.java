package com.melo.backend.modules.moderation.infrastructure;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.melo.backend.global.protocol.DurableRecord;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.modules.moderation.domain.ModerationAction;
import com.melo.backend.modules.moderation.domain.ModerationLogEntry;

import org.springframework.stereotype.Component;

/**
 * Append-only moderation audit trail, one {@code org.melo.moderation.log} state event per entry.
 */
@Component
public class ModerationLogStore {

    public static final String RECORD_TYPE = "org.melo.moderation.log";

    private final ProtocolClient protocolClient;

    public ModerationLogStore(ProtocolClient protocolClient) {
        this.protocolClient = protocolClient;
    }

    public static String newLogId(Instant timestamp) {
        return "log_" + timestamp.toEpochMilli() + "_" + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    public void append(String roomId, ModerationLogEntry entry) {
        protocolClient.writeDurableRecord(roomId, RECORD_TYPE, entry.id(), encode(entry));
    }

    /**
     * Entries newest first; {@code limit <= 0} returns everything.
     */
    public List<ModerationLogEntry> list(String roomId, int limit) {
        List<ModerationLogEntry> entries = protocolClient.enumerateDurableRecords(roomId, RECORD_TYPE).stream()
                .map(this::decode)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(ModerationLogEntry::timestamp).reversed())
                .toList();
        return limit > 0 && entries.size() > limit ? entries.subList(0, limit) : entries;
    }

    private ObjectNode encode(ModerationLogEntry entry) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("action", entry.action().wireName());
        node.put("moderatorId", entry.moderatorId());
        node.put("targetUserId", entry.targetUserId());
        node.put("timestamp", entry.timestamp().toString());
        if (entry.reason() != null) {
            node.put("reason", entry.reason());
        }
        if (!entry.metadata().isEmpty()) {
            ObjectNode metadata = node.putObject("metadata");
            entry.metadata().forEach(metadata::put);
        }
        return node;
    }

    private Optional<ModerationLogEntry> decode(DurableRecord record) {
        JsonNode content = record.payload();
        if (content == null || !content.isObject() || content.isEmpty()) {
            return Optional.empty();
        }
        Optional<ModerationAction> action = ModerationAction.fromWire(content.path("action").asText(null));
        Instant timestamp;
        try {
            timestamp = Instant.parse(content.path("timestamp").asText(""));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
        if (action.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        JsonNode metadataNode = content.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = metadataNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }
        return Optional.of(new ModerationLogEntry(
                record.target(),
                action.get(),
                content.path("moderatorId").asText(null),
                content.path("targetUserId").asText(null),
                content.hasNonNull("reason") ? content.get("reason").asText() : null,
                timestamp,
                metadata
        ));
    }
}
