package com.planner.database.session.jdbc;

import com.planner.database.session.Row;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * {@link Row} view over the current position of a {@link ResultSet}.
 */
final class ResultSetRow implements Row {

    private final ResultSet resultSet;

    ResultSetRow(ResultSet resultSet) {
        this.resultSet = resultSet;
    }

    @Override
    public String getString(String column) throws SQLException {
        return resultSet.getString(column);
    }

    @Override
    public UUID getUuid(String column) throws SQLException {
        return resultSet.getObject(column, UUID.class);
    }

    @Override
    public Integer getInteger(String column) throws SQLException {
        int value = resultSet.getInt(column);
        return resultSet.wasNull() ? null : value;
    }

    @Override
    public Long getLong(String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : value;
    }

    @Override
    public Boolean getBoolean(String column) throws SQLException {
        boolean value = resultSet.getBoolean(column);
        return resultSet.wasNull() ? null : value;
    }

    @Override
    public LocalDateTime getTimestamp(String column) throws SQLException {
        return resultSet.getObject(column, LocalDateTime.class);
    }
}
