package com.planner.database.connection;

import com.planner.database.ContextBindException;
import com.planner.database.LeakageGuardViolationException;
import com.planner.database.session.DatabaseSession;
import com.planner.security.TenantIdentity;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs and removes the session settings that Postgres row-level security policies read.
 * <p>
 * {@link #apply} switches the session to the execution role and publishes the tenant as a
 * session-level claim, then reads the claim back before anything else may run on the
 * connection. {@link #clear} undoes both. A failure in either leaves the handle tainted so the
 * pool closes it instead of handing it out again.
 */
public class SessionContextBinder {

    private static final Logger log = LoggerFactory.getLogger(SessionContextBinder.class);

    /** Statement that drops back to the login role. */
    public static final String RESET_ROLE = "RESET ROLE";

    /** Session-level (not transaction-local) claim assignment. */
    public static final String SET_CONFIG = "SELECT set_config(?, ?, false)";

    /** Reads a claim back; yields null when it was never set. */
    public static final String CURRENT_SETTING = "SELECT current_setting(?, true) AS claim";

    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]{0,62}");

    private final Settings settings;
    private final Clock clock;
    private final String setRole;
    private final AtomicLong applies = new AtomicLong();
    private final AtomicLong clears = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    /**
     * Role and claim names used when binding.
     *
     * @param executionRole role business statements run as; must be a plain SQL identifier
     * @param subjectClaim  setting carrying the tenant identity
     * @param roleClaim     setting carrying the role name
     * @param verifyBinding read the subject claim back after binding
     */
    public record Settings(String executionRole, String subjectClaim, String roleClaim, boolean verifyBinding) {

        public static final Settings DEFAULTS =
                new Settings("authenticated", "request.jwt.claim.sub", "request.jwt.claim.role", true);

        public Settings {
            if (executionRole == null || !SQL_IDENTIFIER.matcher(executionRole).matches()) {
                throw new IllegalArgumentException("executionRole must be a plain SQL identifier, was " + executionRole);
            }
            if (subjectClaim == null || subjectClaim.isBlank()) {
                throw new IllegalArgumentException("subjectClaim must not be blank");
            }
            if (roleClaim == null || roleClaim.isBlank()) {
                throw new IllegalArgumentException("roleClaim must not be blank");
            }
        }
    }

    public SessionContextBinder() {
        this(Settings.DEFAULTS, Clock.systemUTC());
    }

    public SessionContextBinder(Settings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.setRole = "SET ROLE \"" + settings.executionRole() + "\"";
    }

    /**
     * Binds {@code identity} to the handle's session.
     * <p>
     * Binding the tenant already bound is a no-op. Binding another tenant on a bound handle is
     * refused without touching the session.
     *
     * @throws ContextBindException           a statement failed or the claim read back differs
     * @throws LeakageGuardViolationException the handle is bound to a different tenant
     */
    public SessionContext apply(ConnectionHandle handle, TenantIdentity identity) {
        SessionContext existing = handle.currentContext();
        if (existing != null) {
            if (existing.identity().equals(identity)) {
                return existing;
            }
            log.error("Connection {} is bound to tenant {}; refusing to bind {}",
                    handle.id(), existing.identity(), identity);
            throw new LeakageGuardViolationException(handle.id(),
                    "already bound to another tenant, refusing to bind " + identity);
        }
        DatabaseSession session = handle.session();
        try {
            session.execute(setRole);
            session.execute(SET_CONFIG, settings.subjectClaim(), identity.value());
            session.execute(SET_CONFIG, settings.roleClaim(), settings.executionRole());
            if (settings.verifyBinding()) {
                verify(handle, identity);
            }
        } catch (SQLException e) {
            handle.taint();
            failures.incrementAndGet();
            throw new ContextBindException(handle.id(), "could not bind tenant context", e);
        } catch (ContextBindException e) {
            handle.taint();
            failures.incrementAndGet();
            throw e;
        }
        SessionContext context = new SessionContext(handle.id(), identity, clock.instant());
        handle.bind(context);
        applies.incrementAndGet();
        log.debug("Bound tenant {} to connection {}", identity, handle.id());
        return context;
    }

    /**
     * Removes any tenant context from the handle's session. Safe to call after a failed
     * {@link #apply}: the reset statements are issued regardless of what was bound.
     *
     * @throws ContextBindException a reset statement failed; the handle is tainted
     */
    public void clear(ConnectionHandle handle) {
        SessionContext context = handle.currentContext();
        DatabaseSession session = handle.session();
        try {
            session.execute(RESET_ROLE);
            session.execute(SET_CONFIG, settings.subjectClaim(), "");
            session.execute(SET_CONFIG, settings.roleClaim(), "");
        } catch (SQLException e) {
            handle.taint();
            failures.incrementAndGet();
            throw new ContextBindException(handle.id(), "could not clear tenant context", e);
        } finally {
            if (context != null) {
                handle.unbind();
                clears.incrementAndGet();
            }
        }
        log.debug("Cleared tenant context on connection {}", handle.id());
    }

    /** Successful bindings since start. */
    public long applyCount() {
        return applies.get();
    }

    /** Bindings removed since start. */
    public long clearCount() {
        return clears.get();
    }

    /** Apply or clear attempts that failed since start. */
    public long failureCount() {
        return failures.get();
    }

    public Settings settings() {
        return settings;
    }

    private void verify(ConnectionHandle handle, TenantIdentity identity) throws SQLException {
        Optional<String> bound = handle.session()
                .queryOne(CURRENT_SETTING, row -> row.getString("claim"), settings.subjectClaim());
        if (bound.isEmpty() || !identity.value().equals(bound.get())) {
            throw new ContextBindException(handle.id(),
                    "claim " + settings.subjectClaim() + " reads back as '" + bound.orElse("") + "'");
        }
    }
}
