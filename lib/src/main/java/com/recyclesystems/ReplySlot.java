package com.recyclesystems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use channel that carries exactly one {@link Result} from a service's
 * processing loop back to the caller that sent the message.
 *
 * <p>A slot is created per call and closed when the call returns, whether it
 * succeeded, failed or timed out. Anything delivered after that is dropped.
 *
 * @param <T> the type of the carried value
 */
public final class ReplySlot<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ReplySlot.class);

    private final CompletableFuture<Result<T>> future = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Delivers the result. Only the first delivery to an open slot is kept.
     *
     * @param result the outcome to hand to the caller
     * @return true if the caller can still observe the result
     */
    public boolean deliver(Result<T> result) {
        if (closed.get()) {
            logger.debug("Dropping reply delivered to a closed slot: {}", result);
            return false;
        }
        return future.complete(result);
    }

    /**
     * Waits for the result.
     *
     * @param timeout maximum time to wait
     * @param unit unit of {@code timeout}
     * @return the result, or null if none arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Result<T> await(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            return future.get(timeout, unit);
        } catch (TimeoutException e) {
            return null;
        } catch (ExecutionException e) {
            // the future is only ever completed normally
            throw new IllegalStateException("Reply slot completed exceptionally", e.getCause());
        }
    }

    /**
     * @return true once a result has been delivered
     */
    public boolean isDelivered() {
        return future.isDone();
    }

    /**
     * @return true once the slot has been closed
     */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
