package com.planner.database.scope;

import com.planner.database.session.DatabaseSession;
import java.sql.SQLException;

/**
 * Statements run on a scope's session by {@link RequestScope#execute(SessionWork)}.
 */
@FunctionalInterface
public interface SessionWork<T> {

    T apply(DatabaseSession session) throws SQLException;
}
