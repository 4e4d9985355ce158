package com.planner.taskservice.domain;

import java.util.Locale;

/**
 * UI theme of a user's settings.
 */
public enum Theme {
    LIGHT,
    DARK;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Theme fromValue(String value) {
        if (value != null) {
            for (Theme theme : values()) {
                if (theme.value().equalsIgnoreCase(value.strip())) {
                    return theme;
                }
            }
        }
        throw new IllegalArgumentException("theme must be 'light' or 'dark', got '" + value + "'");
    }
}
