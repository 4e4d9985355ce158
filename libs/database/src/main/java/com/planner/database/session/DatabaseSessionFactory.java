package com.planner.database.session;

import java.sql.SQLException;

/**
 * Opens physical connections for the pool.
 */
@FunctionalInterface
public interface DatabaseSessionFactory {

    DatabaseSession open() throws SQLException;
}
