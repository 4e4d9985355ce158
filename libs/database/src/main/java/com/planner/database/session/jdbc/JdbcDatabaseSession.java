package com.planner.database.session.jdbc;

import com.planner.database.QueryException;
import com.planner.database.session.DatabaseSession;
import com.planner.database.session.RowMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DatabaseSession} over a JDBC {@link Connection}.
 * <p>
 * The statement in flight is remembered so that {@link #cancel()} can abort it from another
 * thread. Every statement gets the configured timeout.
 * <p>
 * The driver does not react to {@link Thread#interrupt()}, so a statement that returns while
 * its thread is interrupted is reported as cancelled. The interrupt flag is left set.
 */
public class JdbcDatabaseSession implements DatabaseSession {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseSession.class);

    private final String id;
    private final Connection connection;
    private final int statementTimeoutSeconds;
    private volatile Statement running;
    private boolean transactional;

    public JdbcDatabaseSession(String id, Connection connection, Duration statementTimeout) throws SQLException {
        this.id = id;
        this.connection = connection;
        this.statementTimeoutSeconds = (int) Math.max(0, statementTimeout.toSeconds());
        connection.setAutoCommit(true);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void execute(String sql, Object... params) throws SQLException {
        try (PreparedStatement statement = prepare(sql, params)) {
            running = statement;
            statement.execute();
            failIfInterrupted(sql);
        } finally {
            running = null;
        }
    }

    @Override
    public int update(String sql, Object... params) throws SQLException {
        try (PreparedStatement statement = prepare(sql, params)) {
            running = statement;
            int updated = statement.executeUpdate();
            failIfInterrupted(sql);
            return updated;
        } finally {
            running = null;
        }
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        try (PreparedStatement statement = prepare(sql, params)) {
            running = statement;
            try (ResultSet resultSet = statement.executeQuery()) {
                List<T> rows = new ArrayList<>();
                ResultSetRow row = new ResultSetRow(resultSet);
                while (resultSet.next()) {
                    rows.add(mapper.map(row));
                }
                failIfInterrupted(sql);
                return rows;
            }
        } finally {
            running = null;
        }
    }

    @Override
    public void beginTransaction() throws SQLException {
        connection.setAutoCommit(false);
        transactional = true;
    }

    @Override
    public void commit() throws SQLException {
        try {
            connection.commit();
        } finally {
            endTransaction();
        }
    }

    @Override
    public void rollback() throws SQLException {
        try {
            connection.rollback();
        } finally {
            endTransaction();
        }
    }

    @Override
    public boolean inTransaction() {
        return transactional;
    }

    @Override
    public void cancel() throws SQLException {
        Statement statement = running;
        if (statement != null) {
            log.debug("Cancelling running statement on session {}", id);
            statement.cancel();
        }
    }

    @Override
    public boolean isValid(Duration timeout) {
        try {
            return connection.isValid((int) Math.max(1, timeout.toSeconds()));
        } catch (SQLException e) {
            log.warn("Validation of session {} failed", id, e);
            return false;
        }
    }

    @Override
    public boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            log.warn("Could not read closed state of session {}", id, e);
            return true;
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    @Override
    public String toString() {
        return "JdbcDatabaseSession[" + id + "]";
    }

    private PreparedStatement prepare(String sql, Object[] params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            statement.setQueryTimeout(statementTimeoutSeconds);
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private void failIfInterrupted(String sql) throws SQLException {
        if (Thread.currentThread().isInterrupted()) {
            log.debug("Thread interrupted during statement on session {}: {}", id, sql);
            throw new SQLException("canceling statement due to interrupt", QueryException.QUERY_CANCELED);
        }
    }

    private void endTransaction() throws SQLException {
        transactional = false;
        connection.setAutoCommit(true);
    }
}
