package com.recyclesystems;

import com.recyclesystems.config.ThreadPoolFactory;
import com.recyclesystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Runs the single-consumer loop of one service: polls its inbox on a dedicated
 * thread and hands each message to the dispatcher, in arrival order.
 *
 * <p>A failure thrown by the dispatcher is routed to the exception handler and
 * the loop moves on to the next message; only {@link #stop()} ends it. When
 * the loop ends, messages still queued are handed to the discard handler,
 * then the exit handler runs, still on the loop thread.
 *
 * @param <T> The type of messages in the inbox
 */
public class ServiceProcessor<T> {
    private static final Logger logger = LoggerFactory.getLogger(ServiceActor.class);

    private final String serviceKey;
    private final Mailbox<T> mailbox;
    private final Consumer<T> dispatcher;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final Consumer<T> discardHandler;
    private final Runnable exitHandler;
    private final ThreadPoolFactory threadPoolFactory;

    private volatile boolean running = false;
    private volatile Thread thread;

    /**
     * Creates a new processor.
     *
     * @param serviceKey        The key of the service, for logging and thread naming
     * @param mailbox           The inbox to poll
     * @param dispatcher        Applies one message to the service
     * @param exceptionHandler  Receives any failure escaping the dispatcher
     * @param discardHandler    Receives messages left in the inbox when the loop ends
     * @param exitHandler       Runs on the loop thread as its last action
     * @param threadPoolFactory Creates the loop thread
     */
    public ServiceProcessor(
            String serviceKey,
            Mailbox<T> mailbox,
            Consumer<T> dispatcher,
            BiConsumer<T, Throwable> exceptionHandler,
            Consumer<T> discardHandler,
            Runnable exitHandler,
            ThreadPoolFactory threadPoolFactory) {
        this.serviceKey = serviceKey;
        this.mailbox = mailbox;
        this.dispatcher = dispatcher;
        this.exceptionHandler = exceptionHandler;
        this.discardHandler = discardHandler;
        this.exitHandler = exitHandler;
        this.threadPoolFactory = threadPoolFactory;
    }

    /**
     * Starts the loop thread. Blocks until the thread is running.
     */
    public synchronized void start() {
        if (running) {
            logger.debug("Service {} loop already running", serviceKey);
            return;
        }
        running = true;
        CountDownLatch readyLatch = new CountDownLatch(1);
        thread = threadPoolFactory.createLoopThreadFactory(serviceKey).newThread(() -> {
            readyLatch.countDown();
            processLoop();
        });
        thread.start();

        try {
            if (!readyLatch.await(5, TimeUnit.SECONDS)) {
                logger.warn("Service {} loop did not start within timeout", serviceKey);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for service {} loop to start", serviceKey);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ends the loop. A message being dispatched is allowed to finish; the loop
     * thread is interrupted to wake it from a blocking user function.
     */
    public void stop() {
        Thread loopThread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            loopThread = thread;
        }
        logger.debug("Stopping service {} loop", serviceKey);
        // Only interrupt and join from outside the loop thread
        if (loopThread != null && Thread.currentThread() != loopThread) {
            loopThread.interrupt();
            try {
                loopThread.join(threadPoolFactory.getLoopShutdownTimeoutMillis());
                if (loopThread.isAlive()) {
                    logger.warn("Service {} loop did not exit within {}ms",
                            serviceKey, threadPoolFactory.getLoopShutdownTimeoutMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Enqueues a message, waiting up to the timeout for space.
     *
     * @return false if the inbox stayed full for the whole timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        return mailbox.offer(message, timeout, unit);
    }

    /**
     * @return true when called from this processor's loop thread
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == thread;
    }

    public int getCurrentSize() {
        return mailbox.size();
    }

    private void processLoop() {
        ServiceContext.bind(serviceKey);
        try {
            while (running) {
                T message;
                try {
                    message = mailbox.poll(threadPoolFactory.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    logger.debug("Service {} loop interrupted", serviceKey);
                    continue;
                }
                if (message == null) {
                    continue;
                }
                try {
                    dispatcher.accept(message);
                } catch (Throwable e) {
                    logger.error("Service {} error processing message: {}", serviceKey, message, e);
                    try {
                        exceptionHandler.accept(message, e);
                    } catch (RuntimeException handlerFailure) {
                        logger.warn("Service {} exception handler failed for message {}",
                                serviceKey, message, handlerFailure);
                    }
                }
                // An interrupt aimed at a user function must not leak into the next poll
                if (Thread.interrupted() && running) {
                    logger.debug("Service {} cleared a stray interrupt", serviceKey);
                }
            }
        } finally {
            discardRemaining();
            try {
                exitHandler.run();
            } catch (RuntimeException e) {
                logger.warn("Service {} exit handler failed", serviceKey, e);
            }
            ServiceContext.unbind();
        }
    }

    private void discardRemaining() {
        List<T> remaining = new ArrayList<>();
        mailbox.drainTo(remaining);
        if (!remaining.isEmpty()) {
            logger.debug("Service {} discarding {} queued messages", serviceKey, remaining.size());
        }
        for (T message : remaining) {
            try {
                discardHandler.accept(message);
            } catch (RuntimeException e) {
                logger.warn("Service {} failed to discard message {}", serviceKey, message, e);
            }
        }
    }
}
