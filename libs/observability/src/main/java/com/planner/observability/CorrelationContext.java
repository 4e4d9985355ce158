package com.planner.observability;

/**
 * Immutable correlation data for one inbound request.
 * <p>
 * The HTTP layer establishes the correlation id. The tenant id and scope id are filled in
 * once a request scope has bound a tenant to a database connection, so that every log line
 * written while the scope is active names the tenant it runs for.
 *
 * @param correlationId id of the business flow, propagated from {@code X-Correlation-ID} or generated
 * @param tenantId      tenant the request acts for (null until a request scope is bound)
 * @param scopeId       id of the request scope currently holding a connection (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String scopeId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for request scope ID. */
    public static final String MDC_SCOPE_ID = "scopeId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that only carries a correlation id.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /**
     * Returns a copy bound to the given tenant and request scope.
     */
    public CorrelationContext withTenant(String tenantId, String scopeId) {
        return new CorrelationContext(correlationId, tenantId, scopeId);
    }
}
