/**
 * Minimal connection abstraction the pool and request scopes are written against, with a
 * JDBC implementation in {@code session.jdbc}.
 */
package com.planner.database.session;
