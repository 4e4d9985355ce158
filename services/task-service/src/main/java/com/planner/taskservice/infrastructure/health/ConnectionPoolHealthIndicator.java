package com.planner.taskservice.infrastructure.health;

import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.PoolStats;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

/**
 * Reports the tenant connection pool under {@code /actuator/health}. A closed pool is DOWN;
 * a pool that has ever detected a tenant context leak is reported OUT_OF_SERVICE.
 */
@Component
public class ConnectionPoolHealthIndicator extends AbstractHealthIndicator {

    private final ConnectionPool pool;

    public ConnectionPoolHealthIndicator(ConnectionPool pool) {
        super("Connection pool health check failed");
        this.pool = pool;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        PoolStats stats = pool.stats();
        if (pool.isClosed()) {
            builder.down();
        } else if (stats.totalLeaks() > 0) {
            builder.outOfService();
        } else {
            builder.up();
        }
        builder.withDetail("capacity", stats.capacity())
                .withDetail("leased", stats.leased())
                .withDetail("idle", stats.idle())
                .withDetail("peakLeased", stats.peakLeased())
                .withDetail("discarded", stats.totalDiscarded())
                .withDetail("leaks", stats.totalLeaks());
    }
}
