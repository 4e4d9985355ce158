package com.planner.database.session.jdbc;

import com.planner.database.session.DatabaseSession;
import com.planner.database.session.DatabaseSessionFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import javax.sql.DataSource;

/**
 * Opens {@link JdbcDatabaseSession}s from a non-pooling {@link DataSource}.
 */
public class JdbcDatabaseSessionFactory implements DatabaseSessionFactory {

    private final DataSource dataSource;
    private final Duration statementTimeout;
    private final AtomicLong sequence = new AtomicLong();

    public JdbcDatabaseSessionFactory(DataSource dataSource, Duration statementTimeout) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
        this.statementTimeout = statementTimeout == null ? Duration.ZERO : statementTimeout;
    }

    @Override
    public DatabaseSession open() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            return new JdbcDatabaseSession("jdbc-" + sequence.incrementAndGet(), connection, statementTimeout);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }
}
