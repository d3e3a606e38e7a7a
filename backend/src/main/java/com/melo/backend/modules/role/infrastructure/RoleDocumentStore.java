package com.melo.backend.modules.role.infrastructure;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.melo.backend.global.protocol.ProtocolClient;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.role.domain.Role;
import com.melo.backend.modules.role.domain.RoleColors;
import com.melo.backend.modules.role.domain.RoleDocument;
import com.melo.backend.modules.role.domain.RoleIcon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the role document in room account data. Decoding is tolerant: unknown
 * fields are dropped, missing ones defaulted, entries without an id or name skipped.
 */
@Component
public class RoleDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(RoleDocumentStore.class);

    private final ProtocolClient protocolClient;

    public RoleDocumentStore(ProtocolClient protocolClient) {
        this.protocolClient = protocolClient;
    }

    public RoleDocument read(String roomId) {
        Optional<JsonNode> content = protocolClient.readAccountDocument(roomId, RoleDocument.ACCOUNT_DATA_KEY);
        if (content.isEmpty() || !content.get().isObject() || content.get().isEmpty()) {
            return RoleDocument.empty();
        }
        return decode(roomId, content.get());
    }

    public void write(String roomId, RoleDocument document) {
        protocolClient.writeAccountDocument(roomId, RoleDocument.ACCOUNT_DATA_KEY, encode(document));
    }

    RoleDocument decode(String roomId, JsonNode content) {
        String version = content.path("version").asText(null);
        if (!RoleDocument.CURRENT_VERSION.equals(version)) {
            log.warn("Role document for room {} has version {} (expected {}); decoding leniently",
                    roomId, version, RoleDocument.CURRENT_VERSION);
        }
        List<Role> roles = new ArrayList<>();
        JsonNode rolesNode = content.path("roles");
        if (rolesNode.isArray()) {
            int index = 0;
            for (JsonNode entry : rolesNode) {
                index++;
                Role role = decodeRole(entry, index);
                if (role == null) {
                    log.warn("Skipping malformed role entry #{} in room {}", index, roomId);
                    continue;
                }
                roles.add(role);
            }
        }
        return new RoleDocument(version == null ? RoleDocument.CURRENT_VERSION : version, roles);
    }

    private Role decodeRole(JsonNode entry, int fallbackPosition) {
        if (!entry.isObject()) {
            return null;
        }
        String id = textOrNull(entry.get("id"));
        String name = textOrNull(entry.get("name"));
        if (id == null || name == null) {
            return null;
        }
        int level = clampLevel(entry.path("powerLevel").asInt(0));
        String color = textOrNull(entry.get("color"));
        if (!RoleColors.isValid(color)) {
            color = RoleColors.defaultForLevel(level);
        }
        RoleIcon icon = RoleIcon.fromWire(textOrNull(entry.get("icon"))).orElse(RoleIcon.defaultForLevel(level));
        return new Role(
                id,
                name,
                color,
                icon,
                level,
                decodeCapabilities(entry.get("permissions")),
                entry.path("isHoist").asBoolean(true),
                entry.path("isMentionable").asBoolean(true),
                Math.max(0, entry.path("memberCount").asInt(0)),
                entry.path("position").asInt(fallbackPosition),
                entry.path("isDefault").asBoolean(false),
                parseInstant(textOrNull(entry.get("createdAt")))
        );
    }

    /**
     * Accepts the current list form ({@code ["ban_members", ...]}) and the older boolean map
     * form ({@code {"banMembers": true}}); names that are not capabilities are ignored.
     */
    private EnumSet<Capability> decodeCapabilities(JsonNode node) {
        EnumSet<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (node == null) {
            return capabilities;
        }
        if (node.isArray()) {
            node.forEach(item -> Capability.fromWire(item.asText()).ifPresent(capabilities::add));
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().asBoolean(false)) {
                    Capability.fromWire(camelToSnake(field.getKey())).ifPresent(capabilities::add);
                }
            }
        }
        return capabilities;
    }

    ObjectNode encode(RoleDocument document) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("version", RoleDocument.CURRENT_VERSION);
        ArrayNode roles = root.putArray("roles");
        for (Role role : document.roles()) {
            ObjectNode node = roles.addObject();
            node.put("id", role.id());
            node.put("name", role.name());
            node.put("color", role.color());
            node.put("icon", role.icon().wireName());
            node.put("powerLevel", role.level());
            node.put("isHoist", role.hoist());
            node.put("isMentionable", role.mentionable());
            node.put("memberCount", role.memberCount());
            node.put("position", role.position());
            node.put("isDefault", role.defaultRole());
            ArrayNode permissions = node.putArray("permissions");
            role.capabilities().forEach(capability -> permissions.add(capability.wireName()));
            if (role.createdAt() != null) {
                node.put("createdAt", role.createdAt().toString());
            }
        }
        return root;
    }

    private static int clampLevel(int level) {
        return Math.max(0, Math.min(100, level));
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
