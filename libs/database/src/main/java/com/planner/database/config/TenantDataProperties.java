package com.planner.database.config;

import com.planner.database.connection.SessionContextBinder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Database connection, pool and row-level security settings, bound from
 * {@code planner.datasource.*}.
 *
 * <pre>{@code
 * planner:
 *   datasource:
 *     url: jdbc:postgresql://localhost:5432/planner
 *     username: planner_app
 *     password: ${PLANNER_DB_PASSWORD}
 *     pool:
 *       size: 10
 *       acquire-timeout: 5s
 *     rls:
 *       execution-role: authenticated
 * }</pre>
 *
 * @param url      JDBC URL; required unless another {@code DatabaseSessionFactory} is provided
 * @param username login role
 * @param password login password
 * @param pool     pool sizing and timeouts
 * @param rls      role and claim names the policies read
 */
@Validated
@ConfigurationProperties(prefix = "planner.datasource")
public record TenantDataProperties(
        String url,
        String username,
        String password,
        @Valid Pool pool,
        @Valid Rls rls) {

    public TenantDataProperties {
        if (pool == null) {
            pool = new Pool(0, null, null, null, null);
        }
        if (rls == null) {
            rls = new Rls(null, null, null, null);
        }
    }

    /**
     * @param size               maximum number of connections (default 10)
     * @param acquireTimeout     how long a request waits for a free connection (default 5s)
     * @param validateOnAcquire  check idle connections before handing them out (default true)
     * @param validationTimeout  limit for that check (default 2s)
     * @param statementTimeout   per-statement timeout (default 30s)
     */
    public record Pool(
            @Min(1) @Max(500) int size,
            Duration acquireTimeout,
            Boolean validateOnAcquire,
            Duration validationTimeout,
            Duration statementTimeout) {

        public Pool {
            if (size == 0) {
                size = 10;
            }
            if (acquireTimeout == null) {
                acquireTimeout = Duration.ofSeconds(5);
            }
            if (validateOnAcquire == null) {
                validateOnAcquire = Boolean.TRUE;
            }
            if (validationTimeout == null) {
                validationTimeout = Duration.ofSeconds(2);
            }
            if (statementTimeout == null) {
                statementTimeout = Duration.ofSeconds(30);
            }
        }
    }

    /**
     * @param executionRole role business statements run as (default {@code authenticated})
     * @param subjectClaim  setting carrying the tenant (default {@code request.jwt.claim.sub})
     * @param roleClaim     setting carrying the role (default {@code request.jwt.claim.role})
     * @param verifyBinding read the subject claim back after binding (default true)
     */
    public record Rls(
            @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_$]*") String executionRole,
            String subjectClaim,
            String roleClaim,
            Boolean verifyBinding) {

        public Rls {
            SessionContextBinder.Settings defaults = SessionContextBinder.Settings.DEFAULTS;
            if (executionRole == null || executionRole.isBlank()) {
                executionRole = defaults.executionRole();
            }
            if (subjectClaim == null || subjectClaim.isBlank()) {
                subjectClaim = defaults.subjectClaim();
            }
            if (roleClaim == null || roleClaim.isBlank()) {
                roleClaim = defaults.roleClaim();
            }
            if (verifyBinding == null) {
                verifyBinding = Boolean.TRUE;
            }
        }

        public SessionContextBinder.Settings toSettings() {
            return new SessionContextBinder.Settings(executionRole, subjectClaim, roleClaim, verifyBinding);
        }
    }
}
