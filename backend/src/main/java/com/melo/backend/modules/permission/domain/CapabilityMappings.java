package com.melo.backend.modules.permission.domain;

import static com.melo.backend.modules.permission.domain.LevelRequirement.action;
import static com.melo.backend.modules.permission.domain.LevelRequirement.state;
import static com.melo.backend.modules.permission.domain.RequirementScope.BOTH;
import static com.melo.backend.modules.permission.domain.RequirementScope.ROOM;
import static com.melo.backend.modules.permission.domain.RequirementScope.SPACE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static capability to protocol-level mapping. Every capability has an entry; an empty entry
 * marks a soft capability the protocol cannot gate on its own.
 */
public final class CapabilityMappings {

    private static final Map<Capability, List<LevelRequirement>> MAPPINGS;

    static {
        EnumMap<Capability, List<LevelRequirement>> table = new EnumMap<>(Capability.class);

        table.put(Capability.MANAGE_SERVER, List.of(
                state("m.room.name", 100, BOTH),
                state("m.room.avatar", 100, BOTH),
                state("m.room.topic", 100, BOTH)));
        table.put(Capability.MANAGE_ROLES, List.of(state("m.room.power_levels", 100, BOTH)));
        table.put(Capability.MANAGE_CHANNELS, List.of(
                state("m.space.child", 50, SPACE),
                state("m.room.create", 50, BOTH)));
        table.put(Capability.MANAGE_SERVER_SETTINGS, List.of(
                state("m.room.join_rules", 100, BOTH),
                state("m.room.history_visibility", 100, BOTH)));
        table.put(Capability.VIEW_SERVER_INSIGHTS, List.of());

        table.put(Capability.KICK_MEMBERS, List.of(action("kick", 50, BOTH)));
        table.put(Capability.BAN_MEMBERS, List.of(action("ban", 50, BOTH)));
        table.put(Capability.TIMEOUT_MEMBERS, List.of());
        table.put(Capability.MOVE_MEMBERS, List.of());
        table.put(Capability.MANAGE_MEMBER_ROLES, List.of(state("m.room.power_levels", 50, BOTH)));

        table.put(Capability.VIEW_CHANNELS, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.SEND_MESSAGES, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.SEND_MESSAGES_IN_THREADS, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.CREATE_PUBLIC_THREADS, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.CREATE_PRIVATE_THREADS, List.of(action("m.room.message", 25, ROOM)));
        table.put(Capability.EMBED_LINKS, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.ATTACH_FILES, List.of(action("m.room.message", 0, ROOM)));
        table.put(Capability.ADD_REACTIONS, List.of(action("m.reaction", 0, ROOM)));
        table.put(Capability.USE_EXTERNAL_EMOJIS, List.of());
        table.put(Capability.READ_MESSAGE_HISTORY, List.of(action("events_default", 0, ROOM)));

        table.put(Capability.CONNECT, List.of());
        table.put(Capability.SPEAK, List.of());
        table.put(Capability.USE_VOICE_ACTIVATION, List.of());
        table.put(Capability.SHARE_SCREEN, List.of());
        table.put(Capability.USE_VIDEO, List.of());

        table.put(Capability.MANAGE_MESSAGES, List.of(action("redact", 50, ROOM)));
        table.put(Capability.PIN_MESSAGES, List.of(state("m.room.pinned_events", 50, ROOM)));
        table.put(Capability.MENTION_EVERYONE, List.of());
        table.put(Capability.CREATE_INVITES, List.of(action("invite", 25, BOTH)));
        table.put(Capability.USE_SLASH_COMMANDS, List.of());
        table.put(Capability.CHANGE_NICKNAME, List.of(state("m.room.member", 0, ROOM)));
        table.put(Capability.MANAGE_NICKNAMES, List.of(state("m.room.member", 50, ROOM)));
        table.put(Capability.ADMINISTRATOR, List.of(state("state_default", 100, BOTH)));

        for (Capability capability : Capability.values()) {
            if (!table.containsKey(capability)) {
                throw new IllegalStateException("No level mapping for capability " + capability);
            }
        }
        MAPPINGS = Collections.unmodifiableMap(table);
    }

    private CapabilityMappings() {
    }

    public static List<LevelRequirement> requirementsFor(Capability capability) {
        return MAPPINGS.get(capability);
    }

    public static boolean isSoft(Capability capability) {
        return MAPPINGS.get(capability).isEmpty();
    }

    public static Map<Capability, List<LevelRequirement>> all() {
        return MAPPINGS;
    }
}
