package com.planner.taskservice.persistence;

import com.planner.database.scope.RequestScope;
import com.planner.database.session.Row;
import com.planner.taskservice.domain.SettingsChanges;
import com.planner.taskservice.domain.Theme;
import com.planner.taskservice.domain.UserSettings;
import com.planner.taskservice.domain.UserSettingsRepository;
import java.sql.SQLException;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * {@link UserSettingsRepository} over the {@code user_settings} table. The policy exposes only
 * the tenant's own row, and {@code user_id} defaults to the tenant claim.
 */
@Repository
public class JdbcUserSettingsRepository extends PolicyEnforcedRepository implements UserSettingsRepository {

    static final String COLUMNS = "id, user_id, language, theme, accent_color, created_at, updated_at";

    public static final String SELECT = "SELECT " + COLUMNS + " FROM user_settings";

    public static final String UPSERT = "INSERT INTO user_settings (language, theme, accent_color) "
            + "VALUES (?, ?, ?) ON CONFLICT (user_id) DO UPDATE SET language = EXCLUDED.language, "
            + "theme = EXCLUDED.theme, accent_color = EXCLUDED.accent_color, updated_at = now() "
            + "RETURNING " + COLUMNS;

    @Override
    public Optional<UserSettings> find(RequestScope scope) {
        return inScope(scope, "find", session -> session.queryOne(SELECT, JdbcUserSettingsRepository::map));
    }

    @Override
    public UserSettings upsert(RequestScope scope, SettingsChanges changes) {
        return inScope(scope, "upsert", session -> {
            UserSettings current = session.queryOne(SELECT, JdbcUserSettingsRepository::map).orElse(null);
            SettingsChanges merged = changes.mergedOnto(current);
            return session.queryOne(UPSERT, JdbcUserSettingsRepository::map,
                            merged.language(), merged.theme().value(), merged.accentColor())
                    .orElseThrow(() -> new SQLException("upsert into user_settings produced no row"));
        });
    }

    static UserSettings map(Row row) throws SQLException {
        return new UserSettings(
                row.getUuid("id"),
                row.getString("user_id"),
                row.getString("language"),
                Theme.fromValue(row.getString("theme")),
                row.getString("accent_color"),
                row.getTimestamp("created_at"),
                row.getTimestamp("updated_at"));
    }
}
