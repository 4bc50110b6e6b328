package com.recyclesystems;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a service: the only way to reach its state.
 *
 * <p>Every operation is a message to the service's processing loop followed by
 * a bounded wait for the reply (see {@link com.recyclesystems.config.ServiceTimeouts}).
 * A handle holds no state of its own and can be shared freely between threads.
 * Failures surface as {@link ServiceException}.
 *
 * @param <C> the configuration type accepted by {@link #start}
 */
public interface Service<C> extends AutoCloseable {

    /**
     * @return the key identifying this service
     */
    String key();

    /**
     * Starts the service with the given configuration. Starting a running
     * service has no effect.
     *
     * @param config the configuration, passed through {@code mapConfig} first
     * @throws ServiceException if the service could not start or did not answer in time
     */
    void start(C config);

    /**
     * Stops the service. Stopping a stopped service has no effect.
     *
     * @throws ServiceException if the service could not stop or did not answer in time
     */
    void stop();

    /**
     * Non-blocking snapshot; may briefly lag a transition in progress.
     */
    boolean isStarted();

    /**
     * Non-blocking snapshot; may briefly lag a transition in progress.
     */
    boolean isStopped();

    /**
     * Sends the arguments to the service's receive function and returns its result.
     *
     * @param args the request arguments
     * @param <R> the expected result type
     * @return what the receive function returned
     * @throws ServiceException with {@link ErrorKind#NOT_RUNNING} if the service is stopped
     */
    <R> R ask(Object... args);

    /**
     * Asynchronous {@link #start}. The future completes exceptionally with the
     * same {@link ServiceException} the blocking call would throw.
     */
    CompletableFuture<Void> startAsync(C config);

    /**
     * Asynchronous {@link #stop}.
     */
    CompletableFuture<Void> stopAsync();

    /**
     * Asynchronous {@link #ask}.
     */
    <R> CompletableFuture<R> askAsync(Object... args);

    /**
     * Stops the service if it is running, then terminates its processing loop.
     * Every call made once closing has begun fails with {@link ErrorKind#DISPOSED},
     * and a queued start is refused. A start already running when close is
     * called (for example one the caller gave up on after a timeout) is
     * stopped by the loop once it completes. Closing twice has no effect.
     */
    @Override
    void close();
}
