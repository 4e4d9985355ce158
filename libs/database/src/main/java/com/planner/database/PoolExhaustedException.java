package com.planner.database;

import java.time.Duration;

/**
 * No connection became free within the acquire timeout.
 */
public class PoolExhaustedException extends TenantDataAccessException {

    private final int capacity;
    private final Duration waited;

    public PoolExhaustedException(int capacity, Duration waited) {
        super("all " + capacity + " connections in use after waiting " + waited.toMillis() + " ms");
        this.capacity = capacity;
        this.waited = waited;
    }

    public PoolExhaustedException(int capacity, Duration waited, InterruptedException cause) {
        super("interrupted while waiting for one of " + capacity + " connections", cause);
        this.capacity = capacity;
        this.waited = waited;
    }

    public int capacity() {
        return capacity;
    }

    public Duration waited() {
        return waited;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
