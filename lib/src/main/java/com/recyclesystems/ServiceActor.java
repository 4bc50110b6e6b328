package com.recyclesystems;

import com.recyclesystems.builder.ServiceKeys;
import com.recyclesystems.config.ServiceTimeouts;
import com.recyclesystems.handler.ReceiveHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A service: one piece of lifecycle state owned by one processing loop.
 *
 * <p>The {@link LifecycleState} is written only by the loop thread, one
 * message at a time, in inbox order. Callers interact exclusively through
 * messages and reply slots; {@link #isStarted()} and {@link #isStopped()}
 * read a volatile snapshot.
 *
 * <p>The loop starts when the actor is constructed and runs until
 * {@link #close()}.
 *
 * @param <C> the configuration type
 * @param <I> the instance type
 */
public class ServiceActor<C, I> implements Service<C> {

    private static final Logger logger = LoggerFactory.getLogger(ServiceActor.class);

    private final String key;
    private final ServiceSpec<C, I> spec;
    private final ReceiveHandler<I> receive;
    private final ServiceProcessor<ServiceMessage<C>> processor;

    private final AtomicBoolean closing = new AtomicBoolean(false);
    private volatile boolean closed = false;

    // written only by the loop thread
    private volatile LifecycleState<I> state = LifecycleState.stopped(null);

    /**
     * Creates the service and starts its processing loop.
     *
     * @param spec the blueprint
     */
    public ServiceActor(ServiceSpec<C, I> spec) {
        this.spec = spec;
        this.key = spec.key().orElseGet(() -> ServiceKeys.generate(ServiceKeys.SERVICE_PREFIX));
        this.receive = spec.receive().orElseGet(() -> (instance, args) -> {
            throw new ServiceException(ErrorKind.NO_RECEIVE_HANDLER,
                    "service does not implement receive", key);
        });
        this.processor = new ServiceProcessor<>(
                key,
                spec.mailboxType().create(spec.inboxCapacity()),
                this::dispatch,
                this::handleDispatchFailure,
                this::discard,
                this::stopOnExit,
                spec.threadPoolFactory());
        processor.start();
        logger.info("Service {} created (timeout={}ms, inbox={} x {})",
                key, spec.timeoutMillis(), spec.mailboxType(), spec.inboxCapacity());
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public void start(C config) {
        request(reply -> new ServiceMessage.Start<>(config, reply), false);
    }

    @Override
    public void stop() {
        request(ServiceMessage.Stop::new, false);
    }

    @Override
    public boolean isStarted() {
        return state.isStarted();
    }

    @Override
    public boolean isStopped() {
        return state.isStopped();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R ask(Object... args) {
        return (R) request(reply -> new ServiceMessage.Receive<>(args, reply), false);
    }

    @Override
    public CompletableFuture<Void> startAsync(C config) {
        return async(() -> {
            start(config);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> stopAsync() {
        return async(() -> {
            stop();
            return null;
        });
    }

    @Override
    public <R> CompletableFuture<R> askAsync(Object... args) {
        Object[] snapshot = args == null ? new Object[0] : args.clone();
        return async(() -> ask(snapshot));
    }

    /**
     * @return the current lifecycle snapshot, including the running instance
     */
    public LifecycleState<I> state() {
        return state;
    }

    /**
     * @return the number of messages waiting in the inbox
     */
    public int pendingMessages() {
        return processor.getCurrentSize();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        if (isStarted()) {
            if (processor.isLoopThread()) {
                logger.warn("Service {} closed from its own loop while running; stopping when the loop exits", key);
            } else {
                try {
                    request(ServiceMessage.Stop::new, true);
                } catch (ServiceException e) {
                    logger.warn("Service {} failed to stop while closing", key, e);
                }
            }
        }
        closed = true;
        processor.stop();
        logger.info("Service {} disposed", key);
    }

    @Override
    public String toString() {
        return "Service[" + key + ", " + state.status() + "]";
    }

    // ---- caller side -------------------------------------------------------

    /**
     * Runs one call. Once {@link #close()} has begun only close's own stop
     * ({@code closingStop}) is still accepted.
     */
    private Object request(Function<ReplySlot<Object>, ServiceMessage<C>> messageFactory, boolean closingStop) {
        if (closed || (closing.get() && !closingStop)) {
            throw disposed();
        }
        long timeoutMillis = ServiceTimeouts.effective(spec.timeoutMillis());
        try (ReplySlot<Object> reply = new ReplySlot<>()) {
            ServiceMessage<C> message = messageFactory.apply(reply);
            try {
                if (!processor.offer(message, timeoutMillis, TimeUnit.MILLISECONDS)) {
                    throw new ServiceException(ErrorKind.PUT_TIMEOUT,
                            "put message to service timed out after " + timeoutMillis + "ms", key);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ServiceException(ErrorKind.PUT_TIMEOUT,
                        "interrupted while putting message to service", key, e);
            }
            if (closed) {
                // the loop may already be gone; nobody else would answer
                reply.deliver(Result.failure(disposed()));
            }

            Result<Object> result;
            try {
                result = reply.await(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ServiceException(ErrorKind.TAKE_TIMEOUT,
                        "interrupted while taking message result from service", key, e);
            }
            if (result == null) {
                throw new ServiceException(ErrorKind.TAKE_TIMEOUT,
                        "take message result from service timed out after " + timeoutMillis + "ms", key);
            }
            return result.getOrThrow();
        }
    }

    private <R> CompletableFuture<R> async(Supplier<R> call) {
        CompletableFuture<R> future = new CompletableFuture<>();
        try {
            spec.threadPoolFactory().getWorkerExecutor().execute(() -> {
                try {
                    future.complete(call.get());
                } catch (Throwable e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private ServiceException disposed() {
        return new ServiceException(ErrorKind.DISPOSED, "service has been closed", key);
    }

    // ---- loop side ---------------------------------------------------------

    private void dispatch(ServiceMessage<C> message) {
        Result<Object> result;
        if (message instanceof ServiceMessage.Start<C> start) {
            result = handleStart(start.config());
        } else if (message instanceof ServiceMessage.Stop<C>) {
            result = handleStop();
        } else if (message instanceof ServiceMessage.Receive<C> receive) {
            result = handleReceive(receive.args());
        } else {
            throw new IllegalStateException("unrecognized message received by service " + key + ": " + message);
        }
        if (!message.reply().deliver(result)) {
            logger.debug("Service {} reply abandoned by caller for {}", key, message);
        }
    }

    private Result<Object> handleStart(C config) {
        LifecycleState<I> current = state;
        if (current.isStarted()) {
            return Result.success(current.instance());
        }
        if (closing.get()) {
            return Result.failure(disposed());
        }
        try {
            I instance = spec.start().start(spec.mapConfig().apply(config));
            state = LifecycleState.started(instance);
            logger.debug("Service {} started", key);
            return Result.success(instance);
        } catch (Exception e) {
            logger.debug("Service {} failed to start", key, e);
            return Result.failure(userFunctionFailure("start", e));
        }
    }

    private Result<Object> handleStop() {
        LifecycleState<I> current = state;
        if (current.isStopped()) {
            return Result.success(current.instance());
        }
        try {
            spec.stop().stop(current.instance());
            state = LifecycleState.stopped(current.instance());
            logger.debug("Service {} stopped", key);
            return Result.success(current.instance());
        } catch (Exception e) {
            logger.debug("Service {} failed to stop", key, e);
            return Result.failure(userFunctionFailure("stop", e));
        }
    }

    private Result<Object> handleReceive(Object[] args) {
        LifecycleState<I> current = state;
        if (!current.isStarted()) {
            return Result.failure(new ServiceException(ErrorKind.NOT_RUNNING,
                    "called a service that isn't running", key));
        }
        try {
            return Result.success(receive.receive(current.instance(), args));
        } catch (Exception e) {
            return Result.failure(userFunctionFailure("receive", e));
        }
    }

    private ServiceException userFunctionFailure(String phase, Exception e) {
        if (e instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (e instanceof CompletionException && e.getCause() instanceof ServiceException serviceException) {
            return serviceException;
        }
        return new ServiceException(ErrorKind.USER_FUNCTION,
                "service " + phase + " function failed: " + e, key, e);
    }

    private void handleDispatchFailure(ServiceMessage<C> message, Throwable error) {
        if (message == null || message.reply() == null) {
            logger.warn("unrecognized message received by service {} {}", key, message);
            return;
        }
        message.reply().deliver(Result.failure(new ServiceException(ErrorKind.INTERNAL,
                "service failed to process message: " + error, key, error)));
    }

    private void discard(ServiceMessage<C> message) {
        message.reply().deliver(Result.failure(disposed()));
    }

    /**
     * Last action of the loop: an instance still running at this point (a
     * start that completed after close looked at the state, or a close from
     * inside the loop) is stopped here so it does not outlive the service.
     */
    private void stopOnExit() {
        LifecycleState<I> current = state;
        if (!current.isStarted()) {
            return;
        }
        try {
            spec.stop().stop(current.instance());
            state = LifecycleState.stopped(current.instance());
            logger.info("Service {} stopped while being disposed", key);
        } catch (Exception e) {
            logger.warn("Service {} failed to stop while being disposed", key, e);
        }
    }
}
