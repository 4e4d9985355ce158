/**
 * Request correlation for the Planner services.
 *
 * <p>{@link com.planner.observability.CorrelationContextHolder} keeps the correlation, tenant and
 * request-scope ids of the current thread and mirrors them into the SLF4J MDC;
 * {@link com.planner.observability.SpanHelper} copies the same ids onto OpenTelemetry spans.
 */
package com.planner.observability;
