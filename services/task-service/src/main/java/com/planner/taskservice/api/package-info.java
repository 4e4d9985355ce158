/**
 * REST controllers and their request and response bodies.
 */
package com.planner.taskservice.api;
