package com.planner.taskservice.domain;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A tenant's preferences. One row per tenant, keyed by the database from the tenant claim.
 */
public record UserSettings(
        UUID id,
        String userId,
        String language,
        Theme theme,
        String accentColor,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static final String DEFAULT_LANGUAGE = "it";
    public static final Theme DEFAULT_THEME = Theme.LIGHT;
    public static final String DEFAULT_ACCENT_COLOR = "#7A5BFF";
}
