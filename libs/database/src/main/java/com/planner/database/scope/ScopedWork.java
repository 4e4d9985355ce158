package com.planner.database.scope;

/**
 * Work performed inside {@link RequestScopeManager#inScope(String, ScopedWork)}.
 */
@FunctionalInterface
public interface ScopedWork<T> {

    T execute(RequestScope scope);
}
