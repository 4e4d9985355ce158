/**
 * Spring Boot wiring for the tenant data access layer.
 */
package com.planner.database.config;
