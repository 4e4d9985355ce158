package com.planner.taskservice.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.SessionContextBinder;
import com.planner.database.scope.RequestScopeManager;
import com.planner.database.testing.InMemoryPolicyDatabase;
import com.planner.security.testing.TestTokenFactory;
import com.planner.taskservice.domain.SettingsChanges;
import com.planner.taskservice.domain.Theme;
import com.planner.taskservice.domain.UserSettings;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcUserSettingsRepository")
class JdbcUserSettingsRepositoryTest {

    private PolicyTables tables;
    private ConnectionPool pool;
    private RequestScopeManager scopes;
    private final JdbcUserSettingsRepository repository = new JdbcUserSettingsRepository();

    @BeforeEach
    void setUp() {
        InMemoryPolicyDatabase database = new InMemoryPolicyDatabase();
        tables = PolicyTables.install(database);
        pool = new ConnectionPool(database, 1);
        scopes = new RequestScopeManager(TestTokenFactory.resolver(), pool, new SessionContextBinder(),
                Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("find is empty until the tenant has a row")
    void findMissing() {
        Optional<UserSettings> found = scopes.inScope(TestTokenFactory.tokenFor("alice"), repository::find);

        assertThat(found).isEmpty();
    }

    @Test
    @DisplayName("upsert creates the row from the defaults and the given changes")
    void createsWithDefaults() {
        UserSettings created = scopes.inScope(TestTokenFactory.tokenFor("alice"),
                scope -> repository.upsert(scope, new SettingsChanges(null, Theme.DARK, null)));

        assertThat(created.userId()).isEqualTo("alice");
        assertThat(created.language()).isEqualTo(UserSettings.DEFAULT_LANGUAGE);
        assertThat(created.theme()).isEqualTo(Theme.DARK);
        assertThat(created.accentColor()).isEqualTo(UserSettings.DEFAULT_ACCENT_COLOR);
    }

    @Test
    @DisplayName("upsert keeps fields that are not changed")
    void mergesOntoCurrent() {
        String alice = TestTokenFactory.tokenFor("alice");
        scopes.inScope(alice, scope -> repository.upsert(scope, new SettingsChanges("en", Theme.DARK, null)));

        UserSettings updated = scopes.inScope(alice,
                scope -> repository.upsert(scope, new SettingsChanges(null, null, "#00ff00")));

        assertThat(updated.language()).isEqualTo("en");
        assertThat(updated.theme()).isEqualTo(Theme.DARK);
        assertThat(updated.accentColor()).isEqualTo("#00FF00");
        assertThat(updated.updatedAt()).isNotNull();
    }

    @Test
    @DisplayName("each tenant reads and writes only its own row")
    void isolated() {
        scopes.inScope(TestTokenFactory.tokenFor("alice"),
                scope -> repository.upsert(scope, new SettingsChanges("en", null, null)));

        Optional<UserSettings> bobs = scopes.inScope(TestTokenFactory.tokenFor("bob"), repository::find);
        assertThat(bobs).isEmpty();

        scopes.inScope(TestTokenFactory.tokenFor("bob"),
                scope -> repository.upsert(scope, new SettingsChanges("fr", null, null)));

        assertThat(tables.settingsOf("alice")).containsEntry("language", "en");
        assertThat(tables.settingsOf("bob")).containsEntry("language", "fr");
    }
}
