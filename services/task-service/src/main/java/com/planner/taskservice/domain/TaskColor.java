package com.planner.taskservice.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Colours a task can be tagged with. Stored and exchanged in lower case.
 */
public enum TaskColor {
    GREEN,
    PURPLE,
    ORANGE,
    CYAN,
    PINK,
    YELLOW;

    public static final TaskColor DEFAULT = GREEN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored or submitted colour.
     *
     * @throws IllegalArgumentException for an unknown colour
     */
    public static TaskColor fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("color must not be null");
        }
        for (TaskColor color : values()) {
            if (color.value().equals(value.strip().toLowerCase(Locale.ROOT))) {
                return color;
            }
        }
        throw new IllegalArgumentException("color must be one of "
                + Arrays.stream(values()).map(TaskColor::value).collect(Collectors.joining(", "))
                + ", got '" + value + "'");
    }
}
