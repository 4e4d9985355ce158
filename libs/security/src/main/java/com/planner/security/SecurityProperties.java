package com.planner.security;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credential verification settings, bound from {@code planner.security.*}.
 *
 * <pre>
 * planner:
 *   security:
 *     secret: ${PLANNER_SECRET}
 *     clock-skew: 0s
 * </pre>
 *
 * @param secret    shared HS256 secret, at least 32 bytes. Required.
 * @param clockSkew tolerance applied to the {@code exp} claim (default 0s)
 */
@Validated
@ConfigurationProperties(prefix = "planner.security")
public record SecurityProperties(
        @NotBlank @Size(min = HmacIdentityResolver.MIN_SECRET_BYTES) String secret,
        Duration clockSkew) {

    public SecurityProperties {
        if (clockSkew == null) {
            clockSkew = Duration.ZERO;
        }
    }

    /**
     * Builds the resolver described by these settings.
     */
    public IdentityResolver identityResolver(Clock clock) {
        return new HmacIdentityResolver(secret, clock, clockSkew);
    }
}
