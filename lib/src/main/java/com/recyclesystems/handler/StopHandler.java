package com.recyclesystems.handler;

/**
 * Releases whatever a running service instance holds.
 *
 * @param <I> the instance type
 */
@FunctionalInterface
public interface StopHandler<I> {

    void stop(I instance) throws Exception;

    static <I> StopHandler<I> noop() {
        return instance -> {
        };
    }
}
