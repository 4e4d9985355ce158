/**
 * Bearer credential verification for the Planner services.
 *
 * <p>{@link com.planner.security.IdentityResolver} turns an HS256 credential into a
 * {@link com.planner.security.TenantIdentity}; nothing in this package touches the database.
 * Tenant isolation itself is enforced by the database once the identity is bound to a session,
 * see {@code com.planner.database}.
 */
package com.planner.security;
