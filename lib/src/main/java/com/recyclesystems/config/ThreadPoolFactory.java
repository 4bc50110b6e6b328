package com.recyclesystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the threads used by services.
 *
 * <p>Two kinds of threads exist: one dedicated loop thread per service, and a
 * shared worker executor that runs service-map fan-out and the asynchronous
 * call variants. All threads are daemon threads by default so an application
 * that forgets to close its services can still exit.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_LOOP_SHUTDOWN_TIMEOUT_MILLIS = 1000;
    private static final long DEFAULT_POLL_INTERVAL_MILLIS = 100;

    private static final ThreadPoolFactory DEFAULT = new ThreadPoolFactory();

    private boolean useNamedThreads = true;
    private boolean daemon = true;
    private String threadNamePrefix = "service";
    private int loopShutdownTimeoutMillis = DEFAULT_LOOP_SHUTDOWN_TIMEOUT_MILLIS;
    private long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;

    private ExecutorService workerExecutor;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * @return the factory used by services that do not configure one
     */
    public static ThreadPoolFactory getDefault() {
        return DEFAULT;
    }

    /**
     * Creates the thread factory for the processing loop of one service.
     *
     * @param serviceKey the key of the service, used in the thread name
     * @return a thread factory producing unstarted loop threads
     */
    public ThreadFactory createLoopThreadFactory(String serviceKey) {
        return runnable -> {
            Thread thread = useNamedThreads
                    ? new Thread(runnable, threadNamePrefix + "-" + serviceKey)
                    : new Thread(runnable);
            thread.setDaemon(daemon);
            return thread;
        };
    }

    /**
     * Returns the shared worker executor, creating it on first use.
     * Workers are cached: nested service maps block workers while waiting on
     * their own children, so the pool must grow rather than queue.
     *
     * @return the worker executor
     */
    public synchronized ExecutorService getWorkerExecutor() {
        if (workerExecutor == null || workerExecutor.isShutdown()) {
            workerExecutor = Executors.newCachedThreadPool(createNamedThreadFactory(threadNamePrefix + "-worker"));
        }
        return workerExecutor;
    }

    /**
     * Shuts the worker executor down. Running tasks are allowed to finish.
     */
    public synchronized void shutdown() {
        if (workerExecutor != null) {
            workerExecutor.shutdown();
            workerExecutor = null;
        }
    }

    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = useNamedThreads
                        ? new Thread(r, prefix + "-" + threadNumber.getAndIncrement())
                        : new Thread(r);
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    // Getters and setters

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public ThreadPoolFactory setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public int getLoopShutdownTimeoutMillis() {
        return loopShutdownTimeoutMillis;
    }

    public ThreadPoolFactory setLoopShutdownTimeoutMillis(int loopShutdownTimeoutMillis) {
        this.loopShutdownTimeoutMillis = loopShutdownTimeoutMillis;
        return this;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public ThreadPoolFactory setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
        return this;
    }
}
