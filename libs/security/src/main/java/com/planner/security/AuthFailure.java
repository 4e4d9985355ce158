package com.planner.security;

/**
 * Reason a bearer credential was rejected.
 */
public enum AuthFailure {

    /** The signature does not verify against the shared secret, or the algorithm is not HS256. */
    INVALID_SIGNATURE,

    /** The credential verified but its {@code exp} claim is in the past. */
    EXPIRED,

    /** The credential is not a compact JWS, or lacks the {@code sub} or {@code exp} claim. */
    MALFORMED
}
