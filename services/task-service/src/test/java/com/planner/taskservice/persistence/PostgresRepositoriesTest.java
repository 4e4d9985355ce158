package com.planner.taskservice.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.planner.database.connection.ConnectionHandle;
import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.SessionContextBinder;
import com.planner.database.scope.RequestScopeManager;
import com.planner.database.session.jdbc.JdbcDatabaseSessionFactory;
import com.planner.security.testing.TestTokenFactory;
import com.planner.taskservice.domain.SettingsChanges;
import com.planner.taskservice.domain.Task;
import com.planner.taskservice.domain.TaskColor;
import com.planner.taskservice.domain.TaskDraft;
import com.planner.taskservice.domain.Theme;
import com.planner.taskservice.domain.UserSettings;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * The repositories' SQL against PostgreSQL tables guarded by tenant policies. Skipped when
 * Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Repositories on PostgreSQL")
class PostgresRepositoriesTest {

    private static final LocalDateTime MONDAY = LocalDateTime.of(2025, 3, 3, 9, 0);

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = TaskSchemaPostgres.container();

    private ConnectionPool pool;
    private RequestScopeManager scopes;
    private final JdbcTaskRepository tasks = new JdbcTaskRepository();
    private final JdbcUserSettingsRepository settings = new JdbcUserSettingsRepository();

    @BeforeEach
    void setUp() throws Exception {
        TaskSchemaPostgres.asOwner(POSTGRES, "TRUNCATE tasks, user_settings");
        pool = new ConnectionPool(new JdbcDatabaseSessionFactory(
                TaskSchemaPostgres.appDataSource(POSTGRES), Duration.ofSeconds(10)), 2);
        scopes = new RequestScopeManager(TestTokenFactory.resolver(), pool, new SessionContextBinder(),
                Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static String token(String tenant) {
        return TestTokenFactory.tokenFor(tenant);
    }

    private static TaskDraft draft(String title, LocalDateTime startsAt) {
        return new TaskDraft(title, "<p>details</p>", TaskColor.CYAN, startsAt, null, 30, false);
    }

    @Nested
    @DisplayName("tasks")
    class Tasks {

        @Test
        @DisplayName("insert returns the stored row with the tenant taken from the claim")
        void create() {
            Task created = scopes.inScope(token("alice"), scope -> tasks.create(scope, draft("plan", MONDAY)));

            assertThat(created.id()).isNotNull();
            assertThat(created.tenantId()).isEqualTo("alice");
            assertThat(created.title()).isEqualTo("plan");
            assertThat(created.color()).isEqualTo(TaskColor.CYAN);
            assertThat(created.startsAt()).isEqualTo(MONDAY);
            assertThat(created.endsAt()).isNull();
            assertThat(created.durationMinutes()).isEqualTo(30);
            assertThat(created.createdAt()).isNotNull();
            assertThat(created.updatedAt()).isNull();
        }

        @Test
        @DisplayName("lists newest start first and reads, updates and deletes by id")
        void lifecycle() {
            String alice = token("alice");
            Task early = scopes.inScope(alice, scope -> tasks.create(scope, draft("early", MONDAY)));
            scopes.inScope(alice, scope -> tasks.create(scope, draft("late", MONDAY.plusDays(1))));

            List<Task> listed = scopes.inScope(alice, tasks::list);
            Optional<Task> found = scopes.inScope(alice, scope -> tasks.findById(scope, early.id()));
            Optional<Task> updated = scopes.inScope(alice, scope -> tasks.update(scope, early.id(),
                    new TaskDraft("early", "done", TaskColor.PINK, MONDAY, MONDAY.plusHours(2), null, true)));
            boolean deleted = scopes.inScope(alice, scope -> tasks.delete(scope, early.id()));
            Optional<Task> afterDelete = scopes.inScope(alice, scope -> tasks.findById(scope, early.id()));

            assertThat(listed).extracting(Task::title).containsExactly("late", "early");
            assertThat(found).map(Task::title).contains("early");
            assertThat(updated).hasValueSatisfying(task -> {
                assertThat(task.endsAt()).isEqualTo(MONDAY.plusHours(2));
                assertThat(task.durationMinutes()).isNull();
                assertThat(task.completed()).isTrue();
                assertThat(task.updatedAt()).isNotNull();
            });
            assertThat(deleted).isTrue();
            assertThat(afterDelete).isEmpty();
        }

        @Test
        @DisplayName("another tenant's task is invisible to list, read, update and delete")
        void foreignTaskIsInvisible() throws Exception {
            Task alices = scopes.inScope(token("alice"), scope -> tasks.create(scope, draft("private", MONDAY)));
            String bob = token("bob");

            List<Task> bobsList = scopes.inScope(bob, tasks::list);
            Optional<Task> found = scopes.inScope(bob, scope -> tasks.findById(scope, alices.id()));
            Optional<Task> updated = scopes.inScope(bob,
                    scope -> tasks.update(scope, alices.id(), draft("hijacked", MONDAY)));
            boolean deleted = scopes.inScope(bob, scope -> tasks.delete(scope, alices.id()));

            assertThat(bobsList).isEmpty();
            assertThat(found).isEmpty();
            assertThat(updated).isEmpty();
            assertThat(deleted).isFalse();
            assertThat(TaskSchemaPostgres.countAsOwner(POSTGRES,
                    "SELECT count(*) FROM tasks WHERE title = 'private' AND tenant_id = 'alice'")).isEqualTo(1);
        }

        @Test
        @DisplayName("a connection without tenant context sees no tasks")
        void unboundSeesNothing() throws Exception {
            scopes.inScope(token("alice"), scope -> tasks.create(scope, draft("private", MONDAY)));

            ConnectionHandle raw = pool.acquire(Duration.ofSeconds(1));
            try {
                List<UUID> ids = raw.session().query(JdbcTaskRepository.SELECT_ALL, row -> row.getUuid("id"));
                assertThat(ids).isEmpty();
            } finally {
                pool.release(raw);
            }
        }
    }

    @Nested
    @DisplayName("user settings")
    class Settings {

        @Test
        @DisplayName("upsert inserts from the defaults, then updates the same row")
        void upsert() {
            String alice = token("alice");

            UserSettings created = scopes.inScope(alice,
                    scope -> settings.upsert(scope, new SettingsChanges(null, Theme.DARK, null)));
            UserSettings updated = scopes.inScope(alice,
                    scope -> settings.upsert(scope, new SettingsChanges("en", null, "#00ff00")));

            assertThat(created.userId()).isEqualTo("alice");
            assertThat(created.language()).isEqualTo(UserSettings.DEFAULT_LANGUAGE);
            assertThat(created.theme()).isEqualTo(Theme.DARK);
            assertThat(updated.id()).isEqualTo(created.id());
            assertThat(updated.language()).isEqualTo("en");
            assertThat(updated.theme()).isEqualTo(Theme.DARK);
            assertThat(updated.accentColor()).isEqualTo("#00FF00");
            assertThat(updated.updatedAt()).isNotNull();
        }

        @Test
        @DisplayName("each tenant finds only its own row")
        void isolated() throws Exception {
            scopes.inScope(token("alice"), scope -> settings.upsert(scope, new SettingsChanges("en", null, null)));

            Optional<UserSettings> bobs = scopes.inScope(token("bob"), settings::find);
            UserSettings bobsCreated = scopes.inScope(token("bob"),
                    scope -> settings.upsert(scope, new SettingsChanges("fr", null, null)));
            Optional<UserSettings> alices = scopes.inScope(token("alice"), settings::find);

            assertThat(bobs).isEmpty();
            assertThat(bobsCreated.userId()).isEqualTo("bob");
            assertThat(alices).map(UserSettings::language).contains("en");
            assertThat(TaskSchemaPostgres.countAsOwner(POSTGRES, "SELECT count(*) FROM user_settings")).isEqualTo(2);
        }
    }
}
