package com.planner.database;

/**
 * Base type of every failure raised while a request touches tenant data.
 * <p>
 * Subtypes are unchecked so repository code stays free of plumbing. Each one says whether a
 * caller may retry the whole request; the HTTP layer uses that to choose between 5xx codes.
 */
public abstract class TenantDataAccessException extends RuntimeException {

    protected TenantDataAccessException(String message) {
        super(message);
    }

    protected TenantDataAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the request later can succeed without any change on the caller's side.
     */
    public abstract boolean retryable();
}
