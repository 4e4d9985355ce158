package com.planner.database.scope;

import com.planner.database.ContextBindException;
import com.planner.database.connection.ConnectionHandle;
import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.SessionContextBinder;
import com.planner.observability.CorrelationContext;
import com.planner.observability.CorrelationContextHolder;
import com.planner.security.IdentityResolver;
import com.planner.security.TenantIdentity;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link RequestScope}s: resolve the caller, lease a connection, bind the tenant,
 * start a transaction. Nothing acquired along the way outlives a failure.
 */
public class RequestScopeManager {

    private static final Logger log = LoggerFactory.getLogger(RequestScopeManager.class);

    private final IdentityResolver identityResolver;
    private final ConnectionPool pool;
    private final SessionContextBinder binder;
    private final Duration acquireTimeout;

    public RequestScopeManager(IdentityResolver identityResolver, ConnectionPool pool,
                               SessionContextBinder binder, Duration acquireTimeout) {
        if (identityResolver == null || pool == null || binder == null) {
            throw new IllegalArgumentException("identityResolver, pool and binder must not be null");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must be zero or positive");
        }
        this.identityResolver = identityResolver;
        this.pool = pool;
        this.binder = binder;
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Begins a scope for the caller presenting {@code credential}.
     *
     * @throws com.planner.security.AuthenticationException       the credential was rejected; nothing was leased
     * @throws com.planner.database.PoolExhaustedException         no connection became free in time
     * @throws com.planner.database.ConnectionUnavailableException no connection could be opened
     * @throws ContextBindException                                the tenant could not be bound; the connection was discarded
     */
    public RequestScope begin(String credential) {
        TenantIdentity identity = identityResolver.resolve(credential);
        ConnectionHandle handle = pool.acquire(acquireTimeout);
        try {
            binder.apply(handle, identity);
            try {
                handle.session().beginTransaction();
            } catch (SQLException e) {
                handle.taint();
                throw new ContextBindException(handle.id(), "could not start transaction", e);
            }
        } catch (RuntimeException e) {
            abandon(handle, e);
            throw e;
        }
        String scopeId = UUID.randomUUID().toString();
        CorrelationContext current = CorrelationContextHolder.get()
                .orElseGet(() -> CorrelationContext.of(scopeId));
        CorrelationContextHolder.Restore restore =
                CorrelationContextHolder.enter(current.withTenant(identity.value(), scopeId));
        log.debug("Request scope {} began on connection {}", scopeId, handle.id());
        return new RequestScope(scopeId, identity, handle, pool, binder, restore);
    }

    /**
     * Runs {@code work} inside a scope that is always ended, rolling back when the work throws.
     * A failure while ending is attached to the work's own failure as suppressed.
     */
    public <T> T inScope(String credential, ScopedWork<T> work) {
        RequestScope scope = begin(credential);
        RuntimeException primary = null;
        try {
            return work.execute(scope);
        } catch (RuntimeException e) {
            primary = e;
            scope.markRollbackOnly();
            throw e;
        } catch (Error e) {
            scope.markRollbackOnly();
            throw e;
        } finally {
            try {
                scope.end();
            } catch (RuntimeException e) {
                if (primary == null) {
                    throw e;
                }
                primary.addSuppressed(e);
            }
        }
    }

    public Duration acquireTimeout() {
        return acquireTimeout;
    }

    private void abandon(ConnectionHandle handle, RuntimeException cause) {
        try {
            binder.clear(handle);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        try {
            if (handle.isTainted()) {
                pool.discard(handle);
            } else {
                pool.release(handle);
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        log.warn("Request scope not started, connection {} {}: {}", handle.id(),
                handle.isTainted() ? "discarded" : "released", cause.getMessage());
    }
}
