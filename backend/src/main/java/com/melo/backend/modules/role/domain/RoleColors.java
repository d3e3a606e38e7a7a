package com.melo.backend.modules.role.domain;

import java.util.regex.Pattern;

public final class RoleColors {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private RoleColors() {
    }

    public static String defaultForLevel(int level) {
        if (level >= 100) {
            return "#f04747";
        }
        if (level >= 50) {
            return "#7289da";
        }
        if (level >= 25) {
            return "#43b581";
        }
        return "#99aab5";
    }

    public static boolean isValid(String color) {
        return color != null && HEX_COLOR.matcher(color).matches();
    }
}
