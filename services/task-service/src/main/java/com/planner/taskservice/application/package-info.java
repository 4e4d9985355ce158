/**
 * Use cases exposed over HTTP, one request scope per call.
 */
package com.planner.taskservice.application;
