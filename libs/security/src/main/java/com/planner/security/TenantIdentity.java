package com.planner.security;

/**
 * Opaque identity of the tenant a request acts for.
 * <p>
 * Extracted from the {@code sub} claim of a verified credential and compared by value. The
 * database policies receive exactly this string as the session's subject claim.
 *
 * @param value the subject claim, never blank
 */
public record TenantIdentity(String value) implements Comparable<TenantIdentity> {

    public TenantIdentity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tenant identity must not be null or blank");
        }
    }

    /**
     * Shorthand for {@code new TenantIdentity(value)}.
     */
    public static TenantIdentity of(String value) {
        return new TenantIdentity(value);
    }

    @Override
    public int compareTo(TenantIdentity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
