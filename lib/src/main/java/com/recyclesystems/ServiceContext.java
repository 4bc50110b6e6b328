package com.recyclesystems;

import java.util.Optional;

/**
 * Gives user functions access to the service they are running in.
 *
 * <p>Each service runs its start, stop and receive functions on its own loop
 * thread; that thread is bound to the service's key for its whole life.
 */
public final class ServiceContext {

    private static final ThreadLocal<String> currentKey = new ThreadLocal<>();

    private ServiceContext() {
    }

    /**
     * @return the key of the service whose loop is running on this thread,
     *         empty when called from any other thread
     */
    public static Optional<String> currentKey() {
        return Optional.ofNullable(currentKey.get());
    }

    static void bind(String key) {
        currentKey.set(key);
    }

    static void unbind() {
        currentKey.remove();
    }
}
