/**
 * JDBC repositories for the row-level-security protected tables. They run inside a request
 * scope and leave tenant filtering to the database.
 */
package com.planner.taskservice.persistence;
