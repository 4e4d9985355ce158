package com.planner.database.scope;

/**
 * Lifecycle of a {@link RequestScope}.
 */
public enum ScopeState {
    IDLE,
    BOUND,
    EXECUTING,
    COMMITTED,
    ROLLED_BACK,
    RELEASED
}
