package com.planner.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * {@link IdentityResolver} for HS256-signed JWTs sharing one process-wide secret.
 * <p>
 * Checks, in order: compact JWS structure, algorithm, signature, then the {@code sub} and
 * {@code exp} claims. Expiry is evaluated against the injected {@link Clock}; a credential is
 * expired once {@code now >= exp + clockSkew}.
 */
public final class HmacIdentityResolver implements IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(HmacIdentityResolver.class);

    /** HS256 needs a key of at least 256 bits. */
    public static final int MIN_SECRET_BYTES = 32;

    private final MACVerifier verifier;
    private final Clock clock;
    private final Duration clockSkew;

    /**
     * Creates a resolver using the system UTC clock and no clock skew.
     *
     * @param secret shared HMAC secret (at least {@value #MIN_SECRET_BYTES} bytes in UTF-8)
     */
    public HmacIdentityResolver(String secret) {
        this(secret, Clock.systemUTC(), Duration.ZERO);
    }

    /**
     * Creates a resolver.
     *
     * @param secret    shared HMAC secret (at least {@value #MIN_SECRET_BYTES} bytes in UTF-8)
     * @param clock     clock used for the expiry check
     * @param clockSkew tolerance added to {@code exp}, must not be negative
     */
    public HmacIdentityResolver(String secret, Clock clock, Duration clockSkew) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be null or negative");
        }
        try {
            this.verifier = new MACVerifier(secretBytes(secret));
        } catch (JOSEException e) {
            throw new IllegalArgumentException("secret is not usable as an HS256 key", e);
        }
        this.clock = clock;
        this.clockSkew = clockSkew;
    }

    @Override
    public TenantIdentity resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException(AuthFailure.MALFORMED, "credential is empty");
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(credential.strip());
        } catch (ParseException e) {
            throw new AuthenticationException(AuthFailure.MALFORMED, "credential is not a signed JWT", e);
        }

        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        if (!JWSAlgorithm.HS256.equals(algorithm)) {
            log.debug("Rejected credential signed with {}", algorithm);
            throw new AuthenticationException(AuthFailure.INVALID_SIGNATURE,
                    "unsupported signature algorithm " + algorithm);
        }

        try {
            if (!jwt.verify(verifier)) {
                throw new AuthenticationException(AuthFailure.INVALID_SIGNATURE, "signature mismatch");
            }
        } catch (JOSEException e) {
            throw new AuthenticationException(AuthFailure.INVALID_SIGNATURE, "signature could not be verified", e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthenticationException(AuthFailure.MALFORMED, "payload is not a JSON claims set", e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException(AuthFailure.MALFORMED, "missing 'sub' claim");
        }
        Date expiration = claims.getExpirationTime();
        if (expiration == null) {
            throw new AuthenticationException(AuthFailure.MALFORMED, "missing 'exp' claim");
        }

        Instant now = clock.instant();
        if (!now.isBefore(expiration.toInstant().plus(clockSkew))) {
            throw new AuthenticationException(AuthFailure.EXPIRED,
                    "credential expired at " + expiration.toInstant());
        }
        return TenantIdentity.of(subject);
    }

    static byte[] secretBytes(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret must not be null");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "secret must be at least %d bytes, got %d".formatted(MIN_SECRET_BYTES, bytes.length));
        }
        return bytes;
    }
}
