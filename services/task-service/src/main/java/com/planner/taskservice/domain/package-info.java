/**
 * Task and settings model with the business rules they carry, plus the repository ports the
 * services use. Nothing here knows which tenant it runs for.
 */
package com.planner.taskservice.domain;
