package com.planner.security;

/**
 * Verifies a caller's signed credential and extracts the tenant it speaks for.
 * <p>
 * Implementations are pure: no database or pool access, no side effects.
 */
@FunctionalInterface
public interface IdentityResolver {

    /**
     * Resolves the tenant identity carried by a bearer credential.
     *
     * @param credential compact credential ({@code header.payload.signature}), without the
     *                   {@code Bearer} prefix
     * @return the verified tenant identity
     * @throws AuthenticationException if the credential is malformed, badly signed or expired
     */
    TenantIdentity resolve(String credential);
}
