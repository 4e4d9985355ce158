package com.planner.database.connection;

import com.planner.database.session.DatabaseSession;
import com.planner.security.TenantIdentity;
import java.util.Optional;

/**
 * A pooled physical connection plus the bookkeeping the pool and binder keep on it.
 * <p>
 * Lease state is changed only by {@link ConnectionPool}, the session context only by
 * {@link SessionContextBinder}. A handle is owned by one borrower at a time, so the fields are
 * volatile for visibility across the threads that borrow it in turn, not for concurrent writes.
 */
public final class ConnectionHandle {

    private final long id;
    private final DatabaseSession session;
    private volatile HandleState state = HandleState.IDLE;
    private volatile SessionContext sessionContext;
    private volatile boolean tainted;

    ConnectionHandle(long id, DatabaseSession session) {
        this.id = id;
        this.session = session;
    }

    public long id() {
        return id;
    }

    public DatabaseSession session() {
        return session;
    }

    public HandleState state() {
        return state;
    }

    public Optional<SessionContext> sessionContext() {
        return Optional.ofNullable(sessionContext);
    }

    /**
     * Tenant currently bound on this connection, if any.
     */
    public Optional<TenantIdentity> boundIdentity() {
        SessionContext current = sessionContext;
        return current == null ? Optional.empty() : Optional.of(current.identity());
    }

    /**
     * A tainted handle may hold session state nobody can vouch for; it is discarded instead of
     * going back to the free list.
     */
    public boolean isTainted() {
        return tainted;
    }

    public void taint() {
        tainted = true;
    }

    SessionContext currentContext() {
        return sessionContext;
    }

    void bind(SessionContext context) {
        this.sessionContext = context;
    }

    void unbind() {
        this.sessionContext = null;
    }

    void transition(HandleState next) {
        this.state = next;
    }

    @Override
    public String toString() {
        return "ConnectionHandle[id=" + id + ", state=" + state + ", tainted=" + tainted
                + ", bound=" + boundIdentity().map(TenantIdentity::value).orElse("none") + "]";
    }
}
