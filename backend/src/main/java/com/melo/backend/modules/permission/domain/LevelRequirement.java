package com.melo.backend.modules.permission.domain;

/**
 * One protocol-level gate behind a capability: the action key, the level it needs, whether
 * the action is a state event and where it applies.
 */
public record LevelRequirement(String actionKey, int requiredLevel, boolean durableState, RequirementScope scope) {

    static LevelRequirement state(String actionKey, int level, RequirementScope scope) {
        return new LevelRequirement(actionKey, level, true, scope);
    }

    static LevelRequirement action(String actionKey, int level, RequirementScope scope) {
        return new LevelRequirement(actionKey, level, false, scope);
    }
}
