package com.planner.database.connection;

import com.planner.database.ConnectionUnavailableException;
import com.planner.database.LeakageGuardViolationException;
import com.planner.database.PoolExhaustedException;
import com.planner.database.session.DatabaseSession;
import com.planner.database.session.DatabaseSessionFactory;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of exclusive connection leases.
 * <p>
 * A fair {@link Semaphore} with one permit per slot bounds the number of borrowers; the free
 * list and the lease set are guarded by a {@link ReentrantLock}. Physical connections are
 * opened lazily, outside the lock, by the borrower that holds the permit for the slot.
 * <p>
 * The pool refuses to recycle any handle that still carries a tenant context: such a handle is
 * closed, counted as a leak and reported with {@link LeakageGuardViolationException}.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final DatabaseSessionFactory sessionFactory;
    private final int capacity;
    private final boolean validateOnAcquire;
    private final Duration validationTimeout;

    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ConnectionHandle> idle = new ArrayDeque<>();
    private final Set<ConnectionHandle> leased = new LinkedHashSet<>();
    private int peakLeased;

    private final AtomicLong nextHandleId = new AtomicLong();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicLong leaks = new AtomicLong();
    private volatile boolean closed;

    public ConnectionPool(DatabaseSessionFactory sessionFactory, int capacity) {
        this(sessionFactory, capacity, false, Duration.ofSeconds(2));
    }

    public ConnectionPool(DatabaseSessionFactory sessionFactory, int capacity,
                          boolean validateOnAcquire, Duration validationTimeout) {
        if (sessionFactory == null) {
            throw new IllegalArgumentException("sessionFactory must not be null");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        this.sessionFactory = sessionFactory;
        this.capacity = capacity;
        this.validateOnAcquire = validateOnAcquire;
        this.validationTimeout = validationTimeout;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Leases a handle, waiting up to {@code timeout} for one to become free.
     *
     * @throws PoolExhaustedException         no slot became free in time
     * @throws ConnectionUnavailableException a new physical connection could not be opened
     * @throws LeakageGuardViolationException an idle handle was found carrying a tenant context
     */
    public ConnectionHandle acquire(Duration timeout) {
        ensureOpen();
        boolean granted;
        try {
            granted = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException(capacity, timeout, e);
        }
        if (!granted) {
            log.warn("Connection pool exhausted: {} of {} leased after {} ms",
                    leasedCount(), capacity, timeout.toMillis());
            throw new PoolExhaustedException(capacity, timeout);
        }
        try {
            ensureOpen();
            ConnectionHandle handle = leaseOne();
            log.debug("Leased connection {}", handle.id());
            return handle;
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Returns a handle to the free list. Handles that are tainted, still inside a transaction,
     * or belong to a closed pool are discarded instead.
     *
     * @throws LeakageGuardViolationException the handle still carries a tenant context; it has
     *                                        been discarded and the leak counted
     */
    public void release(ConnectionHandle handle) {
        requireLeased(handle);
        SessionContext residual = handle.currentContext();
        if (residual != null) {
            leaks.incrementAndGet();
            log.error("Connection {} released while still bound to tenant {}; discarding it",
                    handle.id(), residual.identity());
            discard(handle);
            throw new LeakageGuardViolationException(handle.id(),
                    "released with residual tenant context for " + residual.identity());
        }
        if (handle.isTainted() || handle.session().inTransaction() || handle.session().isClosed()) {
            discard(handle);
            return;
        }
        boolean parked;
        lock.lock();
        try {
            parked = !closed;
            if (parked) {
                leased.remove(handle);
                handle.transition(HandleState.IDLE);
                idle.addFirst(handle);
            }
        } finally {
            lock.unlock();
        }
        if (!parked) {
            discard(handle);
            return;
        }
        permits.release();
        log.debug("Released connection {}", handle.id());
    }

    /**
     * Closes a leased handle's physical connection and frees its slot. A replacement is opened
     * eagerly unless the pool is closed; if that fails, the slot is refilled on a later acquire.
     */
    public void discard(ConnectionHandle handle) {
        requireLeased(handle);
        lock.lock();
        try {
            leased.remove(handle);
            handle.transition(HandleState.DISCARDED);
        } finally {
            lock.unlock();
        }
        try {
            destroy(handle, "discarded by borrower");
            if (!closed) {
                replenish();
            }
        } finally {
            permits.release();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(capacity, leased.size(), idle.size(),
                    created.get(), discarded.get(), leaks.get(), peakLeased);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of every live handle, idle ones first.
     */
    public List<ConnectionHandle> handles() {
        lock.lock();
        try {
            List<ConnectionHandle> all = new ArrayList<>(idle);
            all.addAll(leased);
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes idle connections now; leased ones are closed when their borrowers give them back.
     */
    @Override
    public void close() {
        List<ConnectionHandle> drained;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            drained = new ArrayList<>(idle);
            idle.clear();
        } finally {
            lock.unlock();
        }
        for (ConnectionHandle handle : drained) {
            handle.transition(HandleState.DISCARDED);
            destroy(handle, "pool closed");
        }
        log.info("Connection pool closed ({} idle connections closed)", drained.size());
    }

    private ConnectionHandle leaseOne() {
        while (true) {
            ConnectionHandle candidate;
            lock.lock();
            try {
                candidate = idle.pollFirst();
            } finally {
                lock.unlock();
            }
            if (candidate == null) {
                candidate = open();
            } else if (!usable(candidate)) {
                continue;
            }
            markLeased(candidate);
            return candidate;
        }
    }

    private boolean usable(ConnectionHandle candidate) {
        SessionContext residual = candidate.currentContext();
        if (residual != null) {
            leaks.incrementAndGet();
            candidate.transition(HandleState.DISCARDED);
            log.error("Idle connection {} found bound to tenant {}; discarding it",
                    candidate.id(), residual.identity());
            destroy(candidate, "residual context on hand-out");
            throw new LeakageGuardViolationException(candidate.id(),
                    "idle connection carried tenant context for " + residual.identity());
        }
        if (validateOnAcquire && !candidate.session().isValid(validationTimeout)) {
            candidate.transition(HandleState.DISCARDED);
            log.warn("Idle connection {} failed validation; discarding it", candidate.id());
            destroy(candidate, "failed validation");
            return false;
        }
        return true;
    }

    private void markLeased(ConnectionHandle handle) {
        lock.lock();
        try {
            handle.transition(HandleState.LEASED);
            leased.add(handle);
            peakLeased = Math.max(peakLeased, leased.size());
        } finally {
            lock.unlock();
        }
    }

    private ConnectionHandle open() {
        DatabaseSession session;
        try {
            session = sessionFactory.open();
        } catch (SQLException e) {
            log.warn("Could not open a database connection: {}", e.getMessage());
            throw new ConnectionUnavailableException("could not open a database connection", e);
        }
        ConnectionHandle handle = new ConnectionHandle(nextHandleId.incrementAndGet(), session);
        created.incrementAndGet();
        log.debug("Opened connection {} ({})", handle.id(), session.id());
        return handle;
    }

    private void replenish() {
        try {
            ConnectionHandle replacement = open();
            boolean parked;
            lock.lock();
            try {
                parked = !closed;
                if (parked) {
                    idle.addLast(replacement);
                }
            } finally {
                lock.unlock();
            }
            if (!parked) {
                replacement.transition(HandleState.DISCARDED);
                destroy(replacement, "pool closed while it was opened");
            }
        } catch (ConnectionUnavailableException e) {
            log.warn("Replacement connection not opened; slot will be refilled on demand", e);
        }
    }

    private void destroy(ConnectionHandle handle, String reason) {
        handle.unbind();
        discarded.incrementAndGet();
        try {
            handle.session().close();
            log.debug("Closed connection {}: {}", handle.id(), reason);
        } catch (SQLException e) {
            log.warn("Error closing connection {} ({})", handle.id(), reason, e);
        }
    }

    private void requireLeased(ConnectionHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle must not be null");
        }
        lock.lock();
        try {
            if (!leased.contains(handle)) {
                throw new IllegalStateException("connection " + handle.id() + " is not leased from this pool");
            }
        } finally {
            lock.unlock();
        }
    }

    private int leasedCount() {
        lock.lock();
        try {
            return leased.size();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("connection pool is closed");
        }
    }
}
