package com.planner.database.session;

import java.sql.SQLException;

/**
 * Maps the current {@link Row} to a value.
 */
@FunctionalInterface
public interface RowMapper<T> {

    T map(Row row) throws SQLException;
}
