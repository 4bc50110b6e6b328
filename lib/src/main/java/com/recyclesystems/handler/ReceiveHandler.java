package com.recyclesystems.handler;

/**
 * Handles a request sent to a running service through {@code ask}.
 * The arguments are exactly the ones passed by the caller.
 *
 * <p>Example:
 * <pre>{@code
 * ReceiveHandler<AtomicInteger> counter = (instance, args) -> instance.addAndGet((Integer) args[0]);
 * }</pre>
 *
 * @param <I> the instance type
 */
@FunctionalInterface
public interface ReceiveHandler<I> {

    Object receive(I instance, Object... args) throws Exception;
}
