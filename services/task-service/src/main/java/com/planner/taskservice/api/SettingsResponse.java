package com.planner.taskservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planner.taskservice.domain.UserSettings;
import java.time.LocalDateTime;
import java.util.UUID;

public record SettingsResponse(
        UUID id,
        @JsonProperty("user_id") String userId,
        String language,
        String theme,
        @JsonProperty("accent_color") String accentColor,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {

    public static SettingsResponse from(UserSettings settings) {
        return new SettingsResponse(
                settings.id(),
                settings.userId(),
                settings.language(),
                settings.theme().value(),
                settings.accentColor(),
                settings.createdAt(),
                settings.updatedAt());
    }
}
