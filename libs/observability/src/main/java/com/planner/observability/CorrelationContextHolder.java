package com.planner.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys (correlationId, tenantId, scopeId); clearing it
 * removes them. Code that narrows the context for a while (a request scope binding a tenant)
 * uses {@link #enter(CorrelationContext)} and closes the returned handle to restore whatever
 * was there before.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Replaces the current context until the returned handle is closed.
     *
     * @param context the context to install
     * @return handle restoring the previous context (or clearing, if there was none) on close
     */
    public static Restore enter(CorrelationContext context) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        return () -> {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        };
    }

    /**
     * Restores the context that was active before {@link #enter(CorrelationContext)}.
     */
    @FunctionalInterface
    public interface Restore extends AutoCloseable {

        @Override
        void close();
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_SCOPE_ID, ctx.scopeId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_SCOPE_ID);
    }
}
