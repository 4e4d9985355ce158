package com.planner.database.session;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row of a query result, read by column label. Nullable columns come back as {@code null}.
 */
public interface Row {

    String getString(String column) throws SQLException;

    UUID getUuid(String column) throws SQLException;

    Integer getInteger(String column) throws SQLException;

    Long getLong(String column) throws SQLException;

    Boolean getBoolean(String column) throws SQLException;

    LocalDateTime getTimestamp(String column) throws SQLException;
}
