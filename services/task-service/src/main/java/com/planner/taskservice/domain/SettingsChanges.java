package com.planner.taskservice.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A partial settings update. Null fields keep their current value.
 */
public record SettingsChanges(String language, Theme theme, String accentColor) {

    private static final Pattern ACCENT_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    public static final SettingsChanges NONE = new SettingsChanges(null, null, null);

    public SettingsChanges {
        if (language != null) {
            language = language.strip();
            if (language.length() < 2 || language.length() > 5) {
                throw new IllegalArgumentException("language must be 2 to 5 characters");
            }
        }
        if (accentColor != null) {
            if (!ACCENT_COLOR.matcher(accentColor).matches()) {
                throw new IllegalArgumentException("accent_color must look like #RRGGBB");
            }
            accentColor = accentColor.toUpperCase(Locale.ROOT);
        }
    }

    public boolean isEmpty() {
        return language == null && theme == null && accentColor == null;
    }

    /**
     * Resolves these changes against the current settings, or the defaults when there are none.
     */
    public SettingsChanges mergedOnto(UserSettings current) {
        String baseLanguage = current != null ? current.language() : UserSettings.DEFAULT_LANGUAGE;
        Theme baseTheme = current != null ? current.theme() : UserSettings.DEFAULT_THEME;
        String baseAccent = current != null ? current.accentColor() : UserSettings.DEFAULT_ACCENT_COLOR;
        return new SettingsChanges(
                language != null ? language : baseLanguage,
                theme != null ? theme : baseTheme,
                accentColor != null ? accentColor : baseAccent);
    }
}
