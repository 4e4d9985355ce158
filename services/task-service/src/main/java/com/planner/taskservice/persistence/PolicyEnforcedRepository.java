package com.planner.taskservice.persistence;

import com.planner.database.scope.RequestScope;
import com.planner.database.scope.SessionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for repositories whose tables are protected by row-level security policies.
 * <p>
 * Statements only run through an active {@link RequestScope}, so they execute on a connection
 * that carries the caller's tenant context. Subclasses never filter by tenant and never
 * commit or roll back; the scope owns the transaction.
 */
public abstract class PolicyEnforcedRepository {

    private static final Logger log = LoggerFactory.getLogger(PolicyEnforcedRepository.class);

    /**
     * Runs statements on the scope's connection. Database failures surface as
     * {@link com.planner.database.QueryException} and mark the scope rollback-only.
     *
     * @throws IllegalStateException when there is no active scope
     */
    protected <T> T inScope(RequestScope scope, String operation, SessionWork<T> work) {
        if (scope == null || !scope.isActive()) {
            throw new IllegalStateException(getClass().getSimpleName() + "." + operation
                    + " requires an active request scope");
        }
        log.debug("{}.{} on scope {}", getClass().getSimpleName(), operation, scope.id());
        return scope.execute(work);
    }
}
