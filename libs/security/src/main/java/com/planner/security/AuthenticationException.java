package com.planner.security;

/**
 * Thrown when a caller's credential cannot be turned into a {@link TenantIdentity}.
 * <p>
 * Caller-facing and never retried: the request is answered as unauthorized. The message never
 * contains the credential itself.
 */
public class AuthenticationException extends RuntimeException {

    private final AuthFailure failure;

    public AuthenticationException(AuthFailure failure, String message) {
        this(failure, message, null);
    }

    public AuthenticationException(AuthFailure failure, String message, Throwable cause) {
        super("%s: %s".formatted(failure, message), cause);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
