package com.planner.database.connection;

/**
 * Point-in-time view of a {@link ConnectionPool}.
 *
 * @param capacity       maximum number of physical connections
 * @param leased         handles currently owned by a borrower
 * @param idle           handles waiting in the free list
 * @param totalCreated   physical connections opened since start
 * @param totalDiscarded physical connections closed (broken, tainted, leaking or on shutdown)
 * @param totalLeaks     handles caught carrying a tenant context where none may exist
 * @param peakLeased     highest number of simultaneously leased handles
 */
public record PoolStats(
        int capacity,
        int leased,
        int idle,
        long totalCreated,
        long totalDiscarded,
        long totalLeaks,
        int peakLeased) {

    /**
     * Slots neither leased nor holding an idle connection.
     */
    public int unopened() {
        return capacity - leased - idle;
    }
}
