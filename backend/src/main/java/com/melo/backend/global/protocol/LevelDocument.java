package com.melo.backend.global.protocol;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Immutable view of a room's {@code m.room.power_levels} content.
 *
 * <p>Top-level thresholds keep track of whether they were present on the wire so a
 * read-modify-write never introduces keys the room did not have. Fields this class does not
 * model are carried through untouched.
 */
public final class LevelDocument {

    public static final String BAN = "ban";
    public static final String KICK = "kick";
    public static final String INVITE = "invite";
    public static final String REDACT = "redact";
    public static final String EVENTS_DEFAULT = "events_default";
    public static final String STATE_DEFAULT = "state_default";
    public static final String USERS_DEFAULT = "users_default";
    public static final String EVENTS = "events";
    public static final String USERS = "users";

    /** Keys that live at the top level of the document rather than under {@code events}. */
    public static final Set<String> TOP_LEVEL_KEYS = Set.of(BAN, KICK, INVITE, REDACT, EVENTS_DEFAULT, STATE_DEFAULT);

    private static final Map<String, Integer> PROTOCOL_DEFAULTS = Map.of(
            BAN, 50,
            KICK, 50,
            INVITE, 0,
            REDACT, 50,
            EVENTS_DEFAULT, 0,
            STATE_DEFAULT, 50,
            USERS_DEFAULT, 0
    );

    private final Map<String, Integer> thresholds;
    private final Map<String, Integer> events;
    private final Map<String, Integer> users;
    private final Map<String, JsonNode> extras;

    private LevelDocument(
            Map<String, Integer> thresholds,
            Map<String, Integer> events,
            Map<String, Integer> users,
            Map<String, JsonNode> extras
    ) {
        this.thresholds = Collections.unmodifiableMap(new TreeMap<>(thresholds));
        this.events = Collections.unmodifiableMap(new TreeMap<>(events));
        this.users = Collections.unmodifiableMap(new TreeMap<>(users));
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Document used when a room has none: ban 50, kick 50, invite 25, redact 50,
     * events_default 0, state_default 50 and the given users_default.
     */
    public static LevelDocument defaults(int usersDefault) {
        Map<String, Integer> thresholds = new TreeMap<>();
        thresholds.put(BAN, 50);
        thresholds.put(KICK, 50);
        thresholds.put(INVITE, 25);
        thresholds.put(REDACT, 50);
        thresholds.put(EVENTS_DEFAULT, 0);
        thresholds.put(STATE_DEFAULT, 50);
        thresholds.put(USERS_DEFAULT, usersDefault);
        return new LevelDocument(thresholds, Map.of(), Map.of(), Map.of());
    }

    public static LevelDocument fromJson(JsonNode content) {
        Map<String, Integer> thresholds = new TreeMap<>();
        Map<String, Integer> events = new TreeMap<>();
        Map<String, Integer> users = new TreeMap<>();
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        if (content == null || !content.isObject()) {
            return new LevelDocument(thresholds, events, users, extras);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = content.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (PROTOCOL_DEFAULTS.containsKey(key) && isLevel(value)) {
                thresholds.put(key, value.asInt());
            } else if (EVENTS.equals(key) && value.isObject()) {
                readLevelMap(value, events);
            } else if (USERS.equals(key) && value.isObject()) {
                readLevelMap(value, users);
            } else {
                extras.put(key, value.deepCopy());
            }
        }
        return new LevelDocument(thresholds, events, users, extras);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        extras.forEach((key, value) -> node.set(key, value.deepCopy()));
        thresholds.forEach(node::put);
        ObjectNode eventsNode = node.putObject(EVENTS);
        events.forEach(eventsNode::put);
        ObjectNode usersNode = node.putObject(USERS);
        users.forEach(usersNode::put);
        return node;
    }

    public int ban() {
        return threshold(BAN);
    }

    public int kick() {
        return threshold(KICK);
    }

    public int invite() {
        return threshold(INVITE);
    }

    public int redact() {
        return threshold(REDACT);
    }

    public int eventsDefault() {
        return threshold(EVENTS_DEFAULT);
    }

    public int stateDefault() {
        return threshold(STATE_DEFAULT);
    }

    public int usersDefault() {
        return threshold(USERS_DEFAULT);
    }

    public Map<String, Integer> events() {
        return events;
    }

    public Map<String, Integer> users() {
        return users;
    }

    public Map<String, JsonNode> extras() {
        return extras;
    }

    /**
     * Effective level of a user: the explicit entry, else {@code users_default}.
     */
    public int userLevel(String userId) {
        Integer explicit = users.get(userId);
        return explicit != null ? explicit : usersDefault();
    }

    /**
     * Level the room itself sets for an action key, if any. {@code events} entries win over
     * top-level thresholds; protocol defaults do not count as an override.
     */
    public OptionalInt explicitActionLevel(String actionKey) {
        Integer eventLevel = events.get(actionKey);
        if (eventLevel != null) {
            return OptionalInt.of(eventLevel);
        }
        Integer topLevel = thresholds.get(actionKey);
        return topLevel != null ? OptionalInt.of(topLevel) : OptionalInt.empty();
    }

    public LevelDocument withActionLevel(String actionKey, int level) {
        if (TOP_LEVEL_KEYS.contains(actionKey) || USERS_DEFAULT.equals(actionKey)) {
            Map<String, Integer> updated = new TreeMap<>(thresholds);
            updated.put(actionKey, level);
            return new LevelDocument(updated, events, users, extras);
        }
        Map<String, Integer> updated = new TreeMap<>(events);
        updated.put(actionKey, level);
        return new LevelDocument(thresholds, updated, users, extras);
    }

    /**
     * Fills thresholds this document leaves unset from {@code fallback}. Explicit values,
     * events, users and unknown fields of this document are kept.
     */
    public LevelDocument withMissingThresholdsFrom(LevelDocument fallback) {
        Map<String, Integer> merged = new TreeMap<>(fallback.thresholds);
        merged.putAll(thresholds);
        return new LevelDocument(merged, events, users, extras);
    }

    public LevelDocument withUserLevel(String userId, int level) {
        Map<String, Integer> updated = new TreeMap<>(users);
        updated.put(userId, level);
        return new LevelDocument(thresholds, events, updated, extras);
    }

    /**
     * Moves every user whose explicit level equals {@code from} to {@code to}.
     */
    public LevelDocument withUsersReassigned(int from, int to) {
        Map<String, Integer> updated = new TreeMap<>(users);
        updated.replaceAll((user, level) -> level == from ? to : level);
        return new LevelDocument(thresholds, events, updated, extras);
    }

    private int threshold(String key) {
        Integer value = thresholds.get(key);
        return value != null ? value : PROTOCOL_DEFAULTS.get(key);
    }

    private static boolean isLevel(JsonNode value) {
        return value.isIntegralNumber() || (value.isTextual() && value.asText().matches("-?\\d+"));
    }

    private static void readLevelMap(JsonNode source, Map<String, Integer> target) {
        Iterator<Map.Entry<String, JsonNode>> entries = source.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (isLevel(entry.getValue())) {
                target.put(entry.getKey(), entry.getValue().asInt());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LevelDocument other)) {
            return false;
        }
        return thresholds.equals(other.thresholds)
                && events.equals(other.events)
                && users.equals(other.users)
                && extras.equals(other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(thresholds, events, users, extras);
    }

    @Override
    public String toString() {
        return "LevelDocument" + toJson();
    }
}
