package com.melo.backend.modules.channel.domain;

/**
 * A server role a member holds, as seen by channel permission checks.
 */
public record HeldRole(String roleId, String roleName, int level) {
}
