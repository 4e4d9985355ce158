/**
 * Service-level Spring configuration.
 */
package com.planner.taskservice.config;
