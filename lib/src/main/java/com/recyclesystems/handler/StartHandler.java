package com.recyclesystems.handler;

/**
 * Starts a service from its (already mapped) configuration and returns the
 * instance the service will hold while running.
 *
 * @param <C> the configuration type
 * @param <I> the instance type
 */
@FunctionalInterface
public interface StartHandler<C, I> {

    I start(C config) throws Exception;

    /**
     * @return a handler that ignores the configuration and returns null
     */
    static <C, I> StartHandler<C, I> noop() {
        return config -> null;
    }
}
