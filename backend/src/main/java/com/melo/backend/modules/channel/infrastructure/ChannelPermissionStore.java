package com.melo.backend.modules.channel.infrastructure;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.modules.channel.domain.ChannelPermissions;
import com.melo.backend.modules.channel.domain.OverrideTarget;
import com.melo.backend.modules.channel.domain.PermissionOverride;
import com.melo.backend.modules.permission.domain.Capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Channel overrides in the channel room's account data. Role entries are keyed by
 * {@code roleId}/{@code roleName}, user entries by {@code userId}/{@code displayName}.
 * Permission keys are written as capability wire names; camelCase keys are accepted on read.
 */
@Component
public class ChannelPermissionStore {

    private static final Logger log = LoggerFactory.getLogger(ChannelPermissionStore.class);

    private final ProtocolClient protocolClient;

    public ChannelPermissionStore(ProtocolClient protocolClient) {
        this.protocolClient = protocolClient;
    }

    public ChannelPermissions read(String channelId) {
        Optional<JsonNode> content = protocolClient.readAccountDocument(channelId, ChannelPermissions.ACCOUNT_DATA_KEY);
        if (content.isEmpty() || !content.get().isObject() || content.get().isEmpty()) {
            return ChannelPermissions.empty(channelId);
        }
        return decode(channelId, content.get());
    }

    public void write(String channelId, ChannelPermissions permissions) {
        protocolClient.writeAccountDocument(channelId, ChannelPermissions.ACCOUNT_DATA_KEY, encode(permissions));
    }

    ChannelPermissions decode(String channelId, JsonNode content) {
        return new ChannelPermissions(
                channelId,
                decodeOverrides(channelId, content.path("roleOverrides"), OverrideTarget.ROLE),
                decodeOverrides(channelId, content.path("userOverrides"), OverrideTarget.USER),
                content.path("inheritFromParent").asBoolean(true),
                parseInstant(textOrNull(content.get("lastUpdated"))),
                textOrNull(content.get("lastUpdatedBy")),
                Math.max(0, content.path("version").asLong(0))
        );
    }

    ObjectNode encode(ChannelPermissions permissions) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("channelId", permissions.channelId());
        encodeOverrides(root.putArray("roleOverrides"), permissions.roleOverrides(), OverrideTarget.ROLE);
        encodeOverrides(root.putArray("userOverrides"), permissions.userOverrides(), OverrideTarget.USER);
        root.put("inheritFromParent", permissions.inheritFromParent());
        if (permissions.lastUpdated() != null) {
            root.put("lastUpdated", permissions.lastUpdated().toString());
        }
        if (permissions.lastUpdatedBy() != null) {
            root.put("lastUpdatedBy", permissions.lastUpdatedBy());
        }
        root.put("version", permissions.version());
        return root;
    }

    private List<PermissionOverride> decodeOverrides(String channelId, JsonNode node, OverrideTarget target) {
        List<PermissionOverride> overrides = new ArrayList<>();
        if (!node.isArray()) {
            return overrides;
        }
        for (JsonNode entry : node) {
            String targetId = textOrNull(entry.get(idField(target)));
            if (targetId == null) {
                log.warn("Skipping {} override without an id in channel {}", target.wireName(), channelId);
                continue;
            }
            overrides.add(new PermissionOverride(
                    targetId,
                    textOrNull(entry.get(labelField(target))),
                    decodePermissions(entry.get("permissions")),
                    parseInstant(textOrNull(entry.get("createdAt"))),
                    textOrNull(entry.get("createdBy"))
            ));
        }
        return overrides;
    }

    private void encodeOverrides(ArrayNode array, List<PermissionOverride> overrides, OverrideTarget target) {
        for (PermissionOverride override : overrides) {
            ObjectNode node = array.addObject();
            node.put(idField(target), override.targetId());
            if (override.label() != null) {
                node.put(labelField(target), override.label());
            }
            ObjectNode permissions = node.putObject("permissions");
            override.permissions().forEach((capability, allowed) -> permissions.put(capability.wireName(), allowed));
            if (override.createdAt() != null) {
                node.put("createdAt", override.createdAt().toString());
            }
            if (override.createdBy() != null) {
                node.put("createdBy", override.createdBy());
            }
        }
    }

    private static Map<Capability, Boolean> decodePermissions(JsonNode node) {
        Map<Capability, Boolean> permissions = new EnumMap<>(Capability.class);
        if (node == null || !node.isObject()) {
            return permissions;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isBoolean()) {
                continue;
            }
            Capability.fromWire(camelToSnake(field.getKey()))
                    .ifPresent(capability -> permissions.put(capability, field.getValue().asBoolean()));
        }
        return permissions;
    }

    private static String idField(OverrideTarget target) {
        return target == OverrideTarget.ROLE ? "roleId" : "userId";
    }

    private static String labelField(OverrideTarget target) {
        return target == OverrideTarget.ROLE ? "roleName" : "displayName";
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
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

    private static String camelToSnake(String value) {
        return value.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
    }
}
