package com.planner.database.connection;

/**
 * Lease state of a {@link ConnectionHandle}.
 */
public enum HandleState {
    /** In the pool's free list. */
    IDLE,
    /** Exclusively owned by one borrower. */
    LEASED,
    /** Physical connection closed; the handle is never handed out again. */
    DISCARDED
}
