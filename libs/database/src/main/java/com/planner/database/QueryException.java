package com.planner.database;

import java.sql.SQLException;

/**
 * A business statement failed. Carries the database's SQLSTATE when there is one.
 */
public class QueryException extends TenantDataAccessException {

    /** SQLSTATE Postgres reports for a row rejected by a row-level security policy. */
    public static final String INSUFFICIENT_PRIVILEGE = "42501";

    /** SQLSTATE Postgres reports for a cancelled statement. */
    public static final String QUERY_CANCELED = "57014";

    private final String sqlState;

    public QueryException(SQLException cause) {
        super(cause.getMessage(), cause);
        this.sqlState = cause.getSQLState();
    }

    public QueryException(String message, SQLException cause) {
        super(message, cause);
        this.sqlState = cause == null ? null : cause.getSQLState();
    }

    public QueryException(String message) {
        super(message);
        this.sqlState = null;
    }

    /**
     * SQLSTATE reported by the database, or {@code null} when the failure did not come from it.
     */
    public String sqlState() {
        return sqlState;
    }

    /**
     * True for integrity violations (class 23) and policy rejections (42501): the request
     * conflicts with existing data or with what the tenant may see.
     */
    public boolean isConflict() {
        return sqlState != null && (sqlState.startsWith("23") || INSUFFICIENT_PRIVILEGE.equals(sqlState));
    }

    public boolean isCancellation() {
        return QUERY_CANCELED.equals(sqlState);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
