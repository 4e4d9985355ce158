package com.planner.database;

/**
 * A connection was found carrying a tenant context where none may exist: on its way back to
 * the pool, or when a different tenant was about to be bound on it. The connection is
 * discarded and the violation counted; the request fails.
 */
public class LeakageGuardViolationException extends TenantDataAccessException {

    private final long handleId;

    public LeakageGuardViolationException(long handleId, String message) {
        super("connection " + handleId + ": " + message);
        this.handleId = handleId;
    }

    public long handleId() {
        return handleId;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
