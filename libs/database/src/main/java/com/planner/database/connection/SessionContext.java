package com.planner.database.connection;

import com.planner.security.TenantIdentity;
import java.time.Instant;

/**
 * The tenant context currently installed on a connection.
 *
 * @param handleId  connection the context lives on
 * @param identity  tenant the row-level security policies see
 * @param appliedAt when the binding was verified
 */
public record SessionContext(long handleId, TenantIdentity identity, Instant appliedAt) {

    public SessionContext {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (appliedAt == null) {
            throw new IllegalArgumentException("appliedAt must not be null");
        }
    }
}
