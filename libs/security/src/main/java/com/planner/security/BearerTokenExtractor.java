package com.planner.security;

import java.util.Optional;

/**
 * Extracts the credential from an HTTP {@code Authorization} header.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the credential from a header value of the form {@code "Bearer <credential>"}.
     * The scheme is matched case-insensitively and must be followed by whitespace.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the credential, or empty if the header is missing or uses another scheme
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String credential = trimmed.substring(SCHEME.length()).strip();
        return credential.isEmpty() ? Optional.empty() : Optional.of(credential);
    }

    /**
     * Like {@link #extract(String)} but fails with {@link AuthFailure#MALFORMED} when no
     * credential is present.
     */
    public static String require(String authorizationHeader) {
        return extract(authorizationHeader).orElseThrow(() -> new AuthenticationException(
                AuthFailure.MALFORMED, "missing bearer credential"));
    }
}
