package com.melo.backend.global.protocol;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Operations this backend consumes from the homeserver. Every call may block on I/O and
 * reports failure with {@link ProtocolClientException}.
 */
public interface ProtocolClient {

    /** Matrix id of the service account this client acts as. */
    String ownUserId();

    List<String> joinedRooms();

    /** The room's power levels, empty when the room has never set them. */
    Optional<LevelDocument> getLevelDocument(String roomId);

    void setLevelDocument(String roomId, LevelDocument document);

    default int getUserLevel(String roomId, String userId) {
        return getLevelDocument(roomId)
                .map(document -> document.userLevel(userId))
                .orElse(0);
    }

    void ban(String roomId, String userId, String reason);

    void unban(String roomId, String userId);

    void kick(String roomId, String userId, String reason);

    void writeDurableRecord(String roomId, String recordType, String target, JsonNode payload);

    Optional<JsonNode> readDurableRecord(String roomId, String recordType, String target);

    List<DurableRecord> enumerateDurableRecords(String roomId, String recordType);

    Optional<JsonNode> readAccountDocument(String roomId, String key);

    void writeAccountDocument(String roomId, String key, JsonNode document);

    /** Current membership, empty when the user has no member event in the room. */
    Optional<Membership> getMembership(String roomId, String userId);
}
