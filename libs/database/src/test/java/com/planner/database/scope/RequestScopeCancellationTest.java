package com.planner.database.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.planner.database.NotesTable;
import com.planner.database.QueryException;
import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.SessionContextBinder;
import com.planner.database.testing.InMemoryPolicyDatabase;
import com.planner.security.testing.TestTokenFactory;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * A request abandoned mid-statement rolls back and hands a clean connection back to the pool.
 */
@DisplayName("RequestScope cancellation")
class RequestScopeCancellationTest {

    private InMemoryPolicyDatabase database;
    private NotesTable notes;
    private ConnectionPool pool;
    private SessionContextBinder binder;
    private RequestScopeManager manager;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        database = new InMemoryPolicyDatabase();
        notes = new NotesTable(database);
        pool = new ConnectionPool(database, 1);
        binder = new SessionContextBinder();
        manager = new RequestScopeManager(TestTokenFactory.resolver(), pool, binder, Duration.ofSeconds(5));
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        pool.close();
    }

    @Test
    @DisplayName("cancel() from another thread aborts the statement and rolls back")
    void cancelFromAnotherThread() throws Exception {
        InMemoryPolicyDatabase.BlockedStatement slow = database.blockOn(NotesTable.SELECT);
        AtomicReference<RequestScope> current = new AtomicReference<>();

        Future<?> request = executor.submit(() -> manager.inScope(TestTokenFactory.tokenFor("alice"), scope -> {
            current.set(scope);
            NotesTable.add(scope, "never committed");
            return NotesTable.bodies(scope);
        }));
        assertThat(slow.awaitEntered(Duration.ofSeconds(5))).isTrue();

        current.get().cancel();

        assertThatThrownBy(() -> request.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(QueryException.class, e -> assertThat(e.isCancellation()).isTrue());
        assertCleanAfterAbort();
        assertThat(current.get().isCancelled()).isTrue();
        assertThat(current.get().state()).isEqualTo(ScopeState.RELEASED);
    }

    @Test
    @DisplayName("interrupting the request thread mid-statement has the same outcome")
    void interruptRequestThread() throws Exception {
        InMemoryPolicyDatabase.BlockedStatement slow = database.blockOn(NotesTable.SELECT);

        Future<?> request = executor.submit(() -> manager.inScope(TestTokenFactory.tokenFor("alice"), scope -> {
            NotesTable.add(scope, "never committed");
            return NotesTable.bodies(scope);
        }));
        assertThat(slow.awaitEntered(Duration.ofSeconds(5))).isTrue();

        request.cancel(true);

        awaitReleased();
        assertCleanAfterAbort();
    }

    @Test
    @DisplayName("the next request reuses the connection with no residual context")
    void nextRequestIsClean() throws Exception {
        InMemoryPolicyDatabase.BlockedStatement slow = database.blockOn(NotesTable.SELECT);
        AtomicReference<RequestScope> current = new AtomicReference<>();
        Future<?> request = executor.submit(() -> manager.inScope(TestTokenFactory.tokenFor("alice"), scope -> {
            current.set(scope);
            return NotesTable.bodies(scope);
        }));
        assertThat(slow.awaitEntered(Duration.ofSeconds(5))).isTrue();
        current.get().cancel();
        assertThatThrownBy(() -> request.get(5, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);

        var seen = CompletableFuture.supplyAsync(() ->
                manager.inScope(TestTokenFactory.tokenFor("bob"), NotesTable::bodies)).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEmpty();
        assertThat(pool.stats().totalCreated()).isEqualTo(1);
    }

    private void awaitReleased() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pool.stats().leased() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    private void assertCleanAfterAbort() {
        assertThat(notes.all()).isEmpty();
        assertThat(pool.stats().leased()).isZero();
        assertThat(pool.stats().totalLeaks()).isZero();
        assertThat(pool.handles()).allMatch(handle -> handle.boundIdentity().isEmpty());
        assertThat(database.statementLog()).contains("ROLLBACK").doesNotContain("COMMIT");
        assertThat(binder.applyCount()).isEqualTo(binder.clearCount());
    }
}
