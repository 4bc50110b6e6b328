package com.recyclesystems;

import com.recyclesystems.config.MailboxType;
import com.recyclesystems.config.ServiceTimeouts;
import com.recyclesystems.config.ThreadPoolFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Blueprint for a service map: named child services that start, stop and
 * receive requests as one service.
 *
 * <p>All children receive the same configuration, after the map's own
 * {@code mapConfig} has been applied. Each child then applies its own.
 *
 * <pre>{@code
 * Service<Config> system = Services.serviceMap(ServiceMapSpec.<Config>builder()
 *         .service("db", dbSpec)
 *         .service("http", httpSpec)
 *         .build());
 * system.start(config);
 * system.ask("db", "select 1");
 * }</pre>
 *
 * @param <C> the configuration type shared by the children
 */
public final class ServiceMapSpec<C> {

    private final String key;
    private final UnaryOperator<C> mapConfig;
    private final Map<String, ServiceSpec<C, ?>> services;
    private final long timeoutMillis;
    private final int inboxCapacity;
    private final MailboxType mailboxType;
    private final ThreadPoolFactory threadPoolFactory;

    private ServiceMapSpec(Builder<C> builder) {
        this.key = builder.key;
        this.mapConfig = builder.mapConfig;
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(builder.services));
        this.timeoutMillis = builder.timeoutMillis;
        this.inboxCapacity = builder.inboxCapacity;
        this.mailboxType = builder.mailboxType;
        this.threadPoolFactory = builder.threadPoolFactory;
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    public UnaryOperator<C> mapConfig() {
        return mapConfig;
    }

    /**
     * @return the children in declaration order
     */
    public Map<String, ServiceSpec<C, ?>> services() {
        return services;
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

    /**
     * Converts this map into a plain service spec, so it can be nested inside
     * another service map or created with {@link Services#service}.
     *
     * @return the equivalent service spec
     */
    public ServiceSpec<C, Map<String, Service<C>>> asServiceSpec() {
        return ServiceMap.toServiceSpec(this);
    }

    /**
     * Fluent builder for {@link ServiceMapSpec}.
     */
    public static final class Builder<C> {
        private String key;
        private UnaryOperator<C> mapConfig = UnaryOperator.identity();
        private final Map<String, ServiceSpec<C, ?>> services = new LinkedHashMap<>();
        private long timeoutMillis = ServiceTimeouts.DEFAULT_TIMEOUT_MILLIS;
        private int inboxCapacity = ServiceSpec.DEFAULT_INBOX_CAPACITY;
        private MailboxType mailboxType = MailboxType.LINKED;
        private ThreadPoolFactory threadPoolFactory = ThreadPoolFactory.getDefault();

        private Builder() {
        }

        public Builder<C> key(String key) {
            if (key != null && key.isBlank()) {
                throw new IllegalArgumentException("Service key cannot be blank");
            }
            this.key = key;
            return this;
        }

        public Builder<C> mapConfig(UnaryOperator<C> mapConfig) {
            this.mapConfig = Objects.requireNonNull(mapConfig, "mapConfig cannot be null");
            return this;
        }

        /**
         * Adds a child service.
         *
         * @param name the name used to route requests to the child
         * @param spec the child's blueprint
         * @return this builder
         */
        public Builder<C> service(String name, ServiceSpec<C, ?> spec) {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(spec, "spec cannot be null");
            if (services.putIfAbsent(name, spec) != null) {
                throw new IllegalArgumentException("Duplicate service name in map: " + name);
            }
            return this;
        }

        /**
         * Adds a nested service map as a child.
         */
        public Builder<C> serviceMap(String name, ServiceMapSpec<C> spec) {
            Objects.requireNonNull(spec, "spec cannot be null");
            return service(name, spec.asServiceSpec());
        }

        public Builder<C> services(Map<String, ? extends ServiceSpec<C, ?>> specs) {
            specs.forEach(this::service);
            return this;
        }

        public Builder<C> timeoutMillis(long timeoutMillis) {
            if (timeoutMillis <= 0) {
                throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder<C> inboxCapacity(int inboxCapacity) {
            if (inboxCapacity <= 0) {
                throw new IllegalArgumentException("inboxCapacity must be positive: " + inboxCapacity);
            }
            this.inboxCapacity = inboxCapacity;
            return this;
        }

        public Builder<C> mailboxType(MailboxType mailboxType) {
            this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType cannot be null");
            return this;
        }

        public Builder<C> threadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
            return this;
        }

        public ServiceMapSpec<C> build() {
            return new ServiceMapSpec<>(this);
        }
    }
}
