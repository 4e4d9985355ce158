/**
 * Pooled connections and the tenant context bound on them.
 */
package com.planner.database.connection;
