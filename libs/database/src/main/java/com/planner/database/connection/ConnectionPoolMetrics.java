package com.planner.database.connection;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes {@link ConnectionPool} and {@link SessionContextBinder} state as
 * {@code planner.pool.*} meters, tagged with the service name.
 */
public class ConnectionPoolMetrics implements MeterBinder {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final ConnectionPool pool;
    private final SessionContextBinder binder;
    private final Tags tags;

    public ConnectionPoolMetrics(ConnectionPool pool, SessionContextBinder binder, String serviceName) {
        if (pool == null || binder == null) {
            throw new IllegalArgumentException("pool and binder must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.pool = pool;
        this.binder = binder;
        this.tags = Tags.of(TAG_SERVICE, serviceName);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("planner.pool.capacity", pool, p -> p.capacity())
                .description("Maximum number of database connections")
                .tags(tags)
                .register(registry);
        Gauge.builder("planner.pool.leased", pool, p -> p.stats().leased())
                .description("Connections currently leased by request scopes")
                .tags(tags)
                .register(registry);
        Gauge.builder("planner.pool.idle", pool, p -> p.stats().idle())
                .description("Open connections waiting in the free list")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.pool.created", pool, p -> p.stats().totalCreated())
                .description("Physical connections opened")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.pool.discarded", pool, p -> p.stats().totalDiscarded())
                .description("Physical connections closed")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.pool.leaks", pool, p -> p.stats().totalLeaks())
                .description("Connections caught carrying a tenant context back to the pool")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.context.applied", binder, b -> b.applyCount())
                .description("Tenant contexts bound to connections")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.context.cleared", binder, b -> b.clearCount())
                .description("Tenant contexts removed from connections")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("planner.context.failures", binder, b -> b.failureCount())
                .description("Failed attempts to bind or clear a tenant context")
                .tags(tags)
                .register(registry);
    }
}
