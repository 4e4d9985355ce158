package com.planner.taskservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planner.taskservice.domain.SettingsChanges;
import com.planner.taskservice.domain.Theme;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code PUT /api/v1/settings}. Every field is optional; omitted fields are unchanged.
 */
public record SettingsRequest(
        @Size(min = 2, max = 5) String language,
        @Pattern(regexp = "light|dark", message = "must be 'light' or 'dark'") String theme,
        @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "must look like #RRGGBB")
        @JsonProperty("accent_color") String accentColor
) {

    public SettingsChanges toChanges() {
        return new SettingsChanges(language, theme == null ? null : Theme.fromValue(theme), accentColor);
    }
}
