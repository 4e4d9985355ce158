package com.planner.database.session;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One physical database connection as seen by the pool, the context binder and repositories.
 * <p>
 * Parameters are positional ({@code ?}). A session is used by one thread at a time; only
 * {@link #cancel()} may be called from another thread.
 */
public interface DatabaseSession extends AutoCloseable {

    /**
     * Stable identifier for logs.
     */
    String id();

    /**
     * Runs a statement whose result, if any, is ignored.
     */
    void execute(String sql, Object... params) throws SQLException;

    /**
     * Runs a data-modifying statement.
     *
     * @return number of affected rows
     */
    int update(String sql, Object... params) throws SQLException;

    /**
     * Runs a query and maps every returned row.
     */
    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    /**
     * Runs a query and maps its first row, if any.
     */
    default <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    void beginTransaction() throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    boolean inTransaction();

    /**
     * Asks the database to abort the statement currently running on this session.
     * Safe to call from any thread; a no-op when nothing runs.
     */
    void cancel() throws SQLException;

    /**
     * Round-trips to the database to check the connection still works.
     */
    boolean isValid(Duration timeout);

    boolean isClosed();

    @Override
    void close() throws SQLException;
}
