package com.recyclesystems.config;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;

/**
 * Timeout configuration shared by all services.
 *
 * <p>Every call to a service waits at most a bounded time, once to enqueue
 * the message and once for the reply. The bound is, in order of precedence:
 * <ol>
 *   <li>the ambient override, while one is open (see {@link #override(long)})</li>
 *   <li>the service's own {@code timeoutMillis}</li>
 *   <li>{@link #DEFAULT_TIMEOUT_MILLIS}</li>
 * </ol>
 *
 * <p>The override is process wide and read at call time. Open scopes form a
 * stack; the most recently opened scope that is still open wins, whatever
 * order scopes are closed in. It is meant for tests and tooling, scoped with
 * try-with-resources:
 * <pre>{@code
 * try (ServiceTimeouts.Scope ignored = ServiceTimeouts.override(100)) {
 *     service.start(config); // waits at most 100ms per phase
 * }
 * }</pre>
 */
public final class ServiceTimeouts {

    public static final long DEFAULT_TIMEOUT_MILLIS = 60_000;

    // guarded by itself; newest scope first
    private static final Deque<Scope> OPEN_SCOPES = new ArrayDeque<>();

    private ServiceTimeouts() {
    }

    /**
     * Opens an ambient override. Overrides nest: closing the innermost one
     * restores the value of the scope opened before it.
     *
     * @param timeoutMillis the bound every call uses while the override is open
     * @return the scope to close
     */
    public static Scope override(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutMillis);
        }
        Scope scope = new Scope(timeoutMillis);
        synchronized (OPEN_SCOPES) {
            OPEN_SCOPES.push(scope);
        }
        return scope;
    }

    /**
     * @return the active ambient override, if any
     */
    public static OptionalLong currentOverride() {
        synchronized (OPEN_SCOPES) {
            Scope top = OPEN_SCOPES.peek();
            return top == null ? OptionalLong.empty() : OptionalLong.of(top.timeoutMillis);
        }
    }

    /**
     * Resolves the timeout a call should use.
     *
     * @param configuredMillis the service's own timeout, or a non-positive value if unset
     * @return the effective timeout in milliseconds
     */
    public static long effective(long configuredMillis) {
        OptionalLong ambient = currentOverride();
        if (ambient.isPresent()) {
            return ambient.getAsLong();
        }
        return configuredMillis > 0 ? configuredMillis : DEFAULT_TIMEOUT_MILLIS;
    }

    /**
     * An open ambient override.
     */
    public static final class Scope implements AutoCloseable {
        private final long timeoutMillis;

        private Scope(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }

        public long timeoutMillis() {
            return timeoutMillis;
        }

        @Override
        public void close() {
            synchronized (OPEN_SCOPES) {
                // identity removal; closing twice is a no-op
                OPEN_SCOPES.removeFirstOccurrence(this);
            }
        }
    }
}
