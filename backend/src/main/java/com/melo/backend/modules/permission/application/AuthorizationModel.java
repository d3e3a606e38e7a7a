package com.melo.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.melo.backend.global.protocol.LevelDocument;
import com.melo.backend.modules.permission.domain.AuthorizationLevels;
import com.melo.backend.modules.permission.domain.Capability;
import com.melo.backend.modules.permission.domain.CapabilityMappings;
import com.melo.backend.modules.permission.domain.LevelRequirement;
import com.melo.backend.modules.permission.domain.ValidationResult;
import com.melo.backend.modules.permission.domain.Violation;
import com.melo.backend.modules.permission.domain.ViolationType;

import org.springframework.stereotype.Component;

/**
 * Translates between named capabilities and numeric authorization levels. Pure: no I/O and
 * no failure modes beyond the violations it reports.
 */
@Component
public class AuthorizationModel {

    /**
     * Highest level any enabled capability's requirements ask for; 0 when none is gated.
     */
    public int requiredLevel(Collection<Capability> capabilities) {
        int required = AuthorizationLevels.MIN;
        for (Capability capability : capabilities) {
            for (LevelRequirement requirement : CapabilityMappings.requirementsFor(capability)) {
                required = Math.max(required, requirement.requiredLevel());
            }
        }
        return required;
    }

    /**
     * Overlays every requirement of the enabled capabilities onto {@code existing}, or onto the
     * default document with {@code baseline} as {@code users_default} when the room has none.
     * Colliding keys keep the larger level. Unset thresholds of {@code existing} are filled
     * from the defaults.
     */
    public LevelDocument generateLevelDocument(Collection<Capability> capabilities, int baseline, LevelDocument existing) {
        LevelDocument defaults = LevelDocument.defaults(baseline);
        LevelDocument document = existing == null ? defaults : existing.withMissingThresholdsFrom(defaults);

        // EnumSet iteration order keeps the output independent of the caller's collection order.
        for (Capability capability : toEnumSet(capabilities)) {
            for (LevelRequirement requirement : CapabilityMappings.requirementsFor(capability)) {
                String key = requirement.actionKey();
                int level = requirement.requiredLevel();
                int current = document.explicitActionLevel(key).orElse(level);
                document = document.withActionLevel(key, Math.max(current, level));
            }
        }
        return document;
    }

    /**
     * Capabilities a user at {@code userLevel} holds. A room-specific level for a requirement's
     * key replaces the mapped level; soft capabilities are always granted.
     */
    public Set<Capability> effectiveCapabilities(int userLevel, LevelDocument documentOverride) {
        EnumSet<Capability> granted = EnumSet.noneOf(Capability.class);
        for (Capability capability : Capability.values()) {
            if (isGranted(capability, userLevel, documentOverride)) {
                granted.add(capability);
            }
        }
        return granted;
    }

    public boolean isGranted(Capability capability, int userLevel, LevelDocument documentOverride) {
        for (LevelRequirement requirement : CapabilityMappings.requirementsFor(capability)) {
            int required = requirement.requiredLevel();
            if (documentOverride != null) {
                required = documentOverride.explicitActionLevel(requirement.actionKey()).orElse(required);
            }
            if (userLevel < required) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects every violation of the capability set at the given level instead of stopping at
     * the first one.
     */
    public ValidationResult validate(Collection<Capability> capabilities, int level) {
        Set<Capability> enabled = toEnumSet(capabilities);
        int required = requiredLevel(enabled);
        List<Violation> violations = new ArrayList<>();

        if (!AuthorizationLevels.isInRange(level)) {
            violations.add(new Violation(ViolationType.LEVEL_OUT_OF_RANGE,
                    "Level " + level + " is outside " + AuthorizationLevels.MIN + ".." + AuthorizationLevels.MAX));
        }
        if (level < required) {
            violations.add(new Violation(ViolationType.LEVEL_BELOW_REQUIRED,
                    "Level " + level + " is too low for selected capabilities. Minimum required: " + required));
        }
        if (enabled.contains(Capability.ADMINISTRATOR) && level != AuthorizationLevels.ADMIN) {
            violations.add(new Violation(ViolationType.ADMINISTRATOR_REQUIRES_FULL_LEVEL,
                    "administrator requires level " + AuthorizationLevels.ADMIN));
        }
        if (enabled.contains(Capability.MANAGE_ROLES) && level < AuthorizationLevels.MODERATOR) {
            violations.add(new Violation(ViolationType.MANAGE_ROLES_REQUIRES_MODERATOR,
                    "manage_roles requires at least level " + AuthorizationLevels.MODERATOR));
        }
        if (enabled.contains(Capability.SEND_MESSAGES) && !enabled.contains(Capability.VIEW_CHANNELS)) {
            violations.add(new Violation(ViolationType.SEND_WITHOUT_VIEW,
                    "send_messages requires view_channels"));
        }
        return ValidationResult.of(required, violations);
    }

    private static EnumSet<Capability> toEnumSet(Collection<Capability> capabilities) {
        return capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(capabilities);
    }
}
