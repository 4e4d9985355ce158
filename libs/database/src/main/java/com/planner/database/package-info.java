/**
 * Tenant-isolated data access on top of Postgres row-level security.
 * <p>
 * A {@link com.planner.database.connection.ConnectionPool} leases connections, a
 * {@link com.planner.database.connection.SessionContextBinder} installs the tenant claims the
 * policies read, and a {@link com.planner.database.scope.RequestScope} ties both to one unit of
 * work so that the context is always removed before the connection is reused.
 */
package com.planner.database;
