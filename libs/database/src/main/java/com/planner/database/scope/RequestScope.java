package com.planner.database.scope;

import com.planner.database.ContextBindException;
import com.planner.database.QueryException;
import com.planner.database.connection.ConnectionHandle;
import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.SessionContextBinder;
import com.planner.database.session.DatabaseSession;
import com.planner.observability.CorrelationContextHolder;
import com.planner.security.TenantIdentity;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One tenant's unit of work on one leased connection inside one transaction.
 * <p>
 * Created bound by {@link RequestScopeManager#begin(String)}. Repositories run their
 * statements through {@link #execute(SessionWork)}; {@link #end()} finishes the transaction,
 * clears the tenant context and gives the connection back, whatever happened before.
 * <p>
 * A scope belongs to the thread that began it. Only {@link #cancel()} may be called from
 * another thread.
 */
public final class RequestScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestScope.class);

    private final String id;
    private final TenantIdentity identity;
    private final ConnectionHandle handle;
    private final ConnectionPool pool;
    private final SessionContextBinder binder;
    private final Thread owner;
    private final CorrelationContextHolder.Restore logContext;

    private final AtomicBoolean ended = new AtomicBoolean();
    private volatile ScopeState state = ScopeState.BOUND;
    private volatile boolean rollbackOnly;
    private volatile boolean cancelled;
    private int operations;

    RequestScope(String id, TenantIdentity identity, ConnectionHandle handle, ConnectionPool pool,
                 SessionContextBinder binder, CorrelationContextHolder.Restore logContext) {
        this.id = id;
        this.identity = identity;
        this.handle = handle;
        this.pool = pool;
        this.binder = binder;
        this.logContext = logContext;
        this.owner = Thread.currentThread();
    }

    /**
     * Runs statements on this scope's session. A failure marks the scope rollback-only;
     * database errors surface as {@link QueryException}.
     *
     * @throws IllegalStateException the scope has ended or is already executing
     * @throws QueryException        the statements failed or the scope was cancelled
     */
    public <T> T execute(SessionWork<T> work) {
        if (ended.get()) {
            throw new IllegalStateException("request scope " + id + " has ended");
        }
        if (state != ScopeState.BOUND) {
            throw new IllegalStateException("request scope " + id + " is " + state + ", not BOUND");
        }
        if (cancelled) {
            throw new QueryException("request scope " + id + " was cancelled");
        }
        if (!handle.boundIdentity().map(identity::equals).orElse(false)) {
            rollbackOnly = true;
            throw new ContextBindException(handle.id(), "tenant " + identity + " is not bound");
        }
        state = ScopeState.EXECUTING;
        operations++;
        try {
            return work.apply(handle.session());
        } catch (SQLException e) {
            rollbackOnly = true;
            throw new QueryException(e);
        } catch (RuntimeException | Error e) {
            rollbackOnly = true;
            throw e;
        } finally {
            state = ScopeState.BOUND;
        }
    }

    /**
     * Makes {@link #end()} roll back instead of committing.
     */
    public void markRollbackOnly() {
        rollbackOnly = true;
    }

    /**
     * Cancels the scope from any thread: the statement in flight is aborted and the
     * transaction will be rolled back.
     */
    public void cancel() {
        if (ended.get()) {
            return;
        }
        cancelled = true;
        rollbackOnly = true;
        if (state == ScopeState.EXECUTING) {
            try {
                handle.session().cancel();
            } catch (SQLException e) {
                handle.taint();
                log.warn("Could not cancel statement on connection {} for scope {}", handle.id(), id, e);
            }
        }
        log.info("Request scope {} cancelled", id);
    }

    /**
     * Commits when every operation succeeded, the scope was neither marked rollback-only nor
     * cancelled and the calling thread is not interrupted; rolls back otherwise. Then clears the
     * tenant context and releases the connection, discarding it if anything about it is in
     * doubt. Calling it again does nothing.
     *
     * @throws QueryException                                   the commit or rollback failed
     * @throws ContextBindException                             the context could not be cleared
     * @throws com.planner.database.LeakageGuardViolationException the pool refused the connection
     */
    public void end() {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        // cleanup statements must not see the interrupt; it is restored before returning
        boolean interrupted = Thread.interrupted();
        RuntimeException failure = null;
        DatabaseSession session = handle.session();
        boolean commit = !rollbackOnly && !cancelled && !interrupted;
        try {
            if (commit) {
                session.commit();
                state = ScopeState.COMMITTED;
            } else {
                session.rollback();
                state = ScopeState.ROLLED_BACK;
            }
        } catch (SQLException e) {
            handle.taint();
            state = ScopeState.ROLLED_BACK;
            failure = new QueryException(commit ? "commit failed" : "rollback failed", e);
        }
        ScopeState outcome = state;
        try {
            binder.clear(handle);
        } catch (ContextBindException e) {
            failure = chain(failure, e);
        }
        try {
            if (handle.isTainted()) {
                pool.discard(handle);
            } else {
                pool.release(handle);
            }
        } catch (RuntimeException e) {
            failure = chain(failure, e);
        }
        state = ScopeState.RELEASED;
        log.debug("Request scope {} ended: {} after {} operation(s)", id, outcome, operations);
        if (Thread.currentThread() == owner) {
            logContext.close();
        }
        if (interrupted) {
            log.info("Request scope {} rolled back: thread was interrupted", id);
            Thread.currentThread().interrupt();
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() {
        end();
    }

    public String id() {
        return id;
    }

    public TenantIdentity identity() {
        return identity;
    }

    public ScopeState state() {
        return state;
    }

    public long handleId() {
        return handle.id();
    }

    public boolean isActive() {
        return !ended.get();
    }

    public boolean isRollbackOnly() {
        return rollbackOnly;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "RequestScope[" + id + ", tenant=" + identity + ", connection=" + handle.id() + ", " + state + "]";
    }

    private static RuntimeException chain(RuntimeException primary, RuntimeException next) {
        if (primary == null) {
            return next;
        }
        primary.addSuppressed(next);
        return primary;
    }
}
