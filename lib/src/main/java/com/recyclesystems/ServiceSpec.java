package com.recyclesystems;

import com.recyclesystems.config.MailboxType;
import com.recyclesystems.config.ServiceTimeouts;
import com.recyclesystems.config.ThreadPoolFactory;
import com.recyclesystems.handler.ReceiveHandler;
import com.recyclesystems.handler.StartHandler;
import com.recyclesystems.handler.StopHandler;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Blueprint for a service. Every field is optional:
 *
 * <ul>
 *   <li>{@code key} - identifies the service, generated when absent</li>
 *   <li>{@code mapConfig} - transforms the config passed to {@code start}, identity by default</li>
 *   <li>{@code start} - builds the instance from the mapped config, returns null by default</li>
 *   <li>{@code stop} - releases the instance, no-op by default</li>
 *   <li>{@code receive} - answers {@code ask}; without one every ask fails with
 *       {@link ErrorKind#NO_RECEIVE_HANDLER}</li>
 *   <li>{@code timeoutMillis} - bound on each wait of a call, 60000 by default</li>
 *   <li>{@code inboxCapacity} - maximum queued messages, 1024 by default</li>
 * </ul>
 *
 * <pre>{@code
 * ServiceSpec<Config, Pool> spec = ServiceSpec.<Config, Pool>builder()
 *         .key("db")
 *         .start(Pool::open)
 *         .stop(Pool::close)
 *         .receive((pool, args) -> pool.query((String) args[0]))
 *         .build();
 * }</pre>
 *
 * @param <C> the configuration type
 * @param <I> the instance type
 */
public final class ServiceSpec<C, I> {

    public static final int DEFAULT_INBOX_CAPACITY = 1024;

    private final String key;
    private final UnaryOperator<C> mapConfig;
    private final StartHandler<C, I> start;
    private final StopHandler<I> stop;
    private final ReceiveHandler<I> receive;
    private final long timeoutMillis;
    private final int inboxCapacity;
    private final MailboxType mailboxType;
    private final ThreadPoolFactory threadPoolFactory;

    private ServiceSpec(Builder<C, I> builder) {
        this.key = builder.key;
        this.mapConfig = builder.mapConfig;
        this.start = builder.start;
        this.stop = builder.stop;
        this.receive = builder.receive;
        this.timeoutMillis = builder.timeoutMillis;
        this.inboxCapacity = builder.inboxCapacity;
        this.mailboxType = builder.mailboxType;
        this.threadPoolFactory = builder.threadPoolFactory;
    }

    public static <C, I> Builder<C, I> builder() {
        return new Builder<>();
    }

    /**
     * @return a builder pre-populated with this spec's values
     */
    public Builder<C, I> toBuilder() {
        Builder<C, I> builder = new Builder<>();
        builder.key = key;
        builder.mapConfig = mapConfig;
        builder.start = start;
        builder.stop = stop;
        builder.receive = receive;
        builder.timeoutMillis = timeoutMillis;
        builder.inboxCapacity = inboxCapacity;
        builder.mailboxType = mailboxType;
        builder.threadPoolFactory = threadPoolFactory;
        return builder;
    }

    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    public UnaryOperator<C> mapConfig() {
        return mapConfig;
    }

    public StartHandler<C, I> start() {
        return start;
    }

    public StopHandler<I> stop() {
        return stop;
    }

    /**
     * @return the receive handler, empty if the service does not accept requests
     */
    public Optional<ReceiveHandler<I>> receive() {
        return Optional.ofNullable(receive);
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }

    public int inboxCapacity() {
        return inboxCapacity;
    }

    public MailboxType mailboxType() {
        return mailboxType;
    }

    public ThreadPoolFactory threadPoolFactory() {
        return threadPoolFactory;
    }

    @Override
    public String toString() {
        return "ServiceSpec{key=" + key + ", timeoutMillis=" + timeoutMillis
                + ", inboxCapacity=" + inboxCapacity + ", mailboxType=" + mailboxType + "}";
    }

    /**
     * Fluent builder for {@link ServiceSpec}.
     */
    public static final class Builder<C, I> {
        private String key;
        private UnaryOperator<C> mapConfig = UnaryOperator.identity();
        private StartHandler<C, I> start = StartHandler.noop();
        private StopHandler<I> stop = StopHandler.noop();
        private ReceiveHandler<I> receive;
        private long timeoutMillis = ServiceTimeouts.DEFAULT_TIMEOUT_MILLIS;
        private int inboxCapacity = DEFAULT_INBOX_CAPACITY;
        private MailboxType mailboxType = MailboxType.LINKED;
        private ThreadPoolFactory threadPoolFactory = ThreadPoolFactory.getDefault();

        private Builder() {
        }

        public Builder<C, I> key(String key) {
            if (key != null && key.isBlank()) {
                throw new IllegalArgumentException("Service key cannot be blank");
            }
            this.key = key;
            return this;
        }

        public Builder<C, I> mapConfig(UnaryOperator<C> mapConfig) {
            this.mapConfig = Objects.requireNonNull(mapConfig, "mapConfig cannot be null");
            return this;
        }

        public Builder<C, I> start(StartHandler<C, I> start) {
            this.start = Objects.requireNonNull(start, "start cannot be null");
            return this;
        }

        public Builder<C, I> stop(StopHandler<I> stop) {
            this.stop = Objects.requireNonNull(stop, "stop cannot be null");
            return this;
        }

        public Builder<C, I> receive(ReceiveHandler<I> receive) {
            this.receive = receive;
            return this;
        }

        public Builder<C, I> timeoutMillis(long timeoutMillis) {
            if (timeoutMillis <= 0) {
                throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder<C, I> inboxCapacity(int inboxCapacity) {
            if (inboxCapacity <= 0) {
                throw new IllegalArgumentException("inboxCapacity must be positive: " + inboxCapacity);
            }
            this.inboxCapacity = inboxCapacity;
            return this;
        }

        public Builder<C, I> mailboxType(MailboxType mailboxType) {
            this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType cannot be null");
            return this;
        }

        public Builder<C, I> threadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
            return this;
        }

        public ServiceSpec<C, I> build() {
            return new ServiceSpec<>(this);
        }
    }
}
