package com.melo.backend.modules.permission.domain;

public final class AuthorizationLevels {

    public static final int MIN = 0;
    public static final int MEMBER = 0;
    public static final int HELPER = 25;
    public static final int MODERATOR = 50;
    public static final int ADMIN = 100;
    public static final int MAX = 100;

    private AuthorizationLevels() {
    }

    public static boolean isInRange(int level) {
        return level >= MIN && level <= MAX;
    }
}
