package com.planner.database;

/**
 * The database refused or failed to open a new physical connection.
 */
public class ConnectionUnavailableException extends TenantDataAccessException {

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
