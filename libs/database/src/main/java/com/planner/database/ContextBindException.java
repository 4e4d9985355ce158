package com.planner.database;

/**
 * The tenant context could not be installed on, verified on, or removed from a connection.
 * The connection involved is always discarded.
 */
public class ContextBindException extends TenantDataAccessException {

    private final long handleId;

    public ContextBindException(long handleId, String message) {
        super("connection " + handleId + ": " + message);
        this.handleId = handleId;
    }

    public ContextBindException(long handleId, String message, Throwable cause) {
        super("connection " + handleId + ": " + message, cause);
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
