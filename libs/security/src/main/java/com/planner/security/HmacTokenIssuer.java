package com.planner.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Mints HS256 credentials that {@link HmacIdentityResolver} accepts when both share a secret.
 * <p>
 * Issuance policy (who may obtain a credential) lives outside this library; this class only
 * knows how to sign a subject with an expiry.
 */
public final class HmacTokenIssuer {

    private final MACSigner signer;
    private final Clock clock;

    public HmacTokenIssuer(String secret) {
        this(secret, Clock.systemUTC());
    }

    public HmacTokenIssuer(String secret, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        try {
            this.signer = new MACSigner(HmacIdentityResolver.secretBytes(secret));
        } catch (JOSEException e) {
            throw new IllegalArgumentException("secret is not usable as an HS256 key", e);
        }
        this.clock = clock;
    }

    /**
     * Issues a credential for {@code identity} valid for {@code ttl} from now.
     *
     * @param identity the tenant identity written to {@code sub}
     * @param ttl      lifetime; zero or negative yields an already expired credential
     * @return the compact serialized JWS
     */
    public String issue(TenantIdentity identity, Duration ttl) {
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(identity.value())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)))
                .build();
        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
                claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign credential", e);
        }
        return jwt.serialize();
    }
}
