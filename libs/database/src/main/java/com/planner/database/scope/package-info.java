/**
 * Request-scoped units of work: one tenant, one connection, one transaction.
 */
package com.planner.database.scope;
