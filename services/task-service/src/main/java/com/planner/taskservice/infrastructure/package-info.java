/**
 * HTTP plumbing and operational endpoints: correlation ids, error mapping and pool health.
 */
package com.planner.taskservice.infrastructure;
