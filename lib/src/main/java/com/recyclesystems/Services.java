package com.recyclesystems;

import com.recyclesystems.builder.ServiceKeys;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point for creating services.
 *
 * <pre>{@code
 * Service<Config> counter = Services.service(ServiceSpec.<Config, AtomicInteger>builder()
 *         .start(config -> new AtomicInteger())
 *         .receive((count, args) -> count.incrementAndGet())
 *         .build());
 *
 * counter.start(config);
 * int value = counter.ask();
 * counter.stop();
 * }</pre>
 */
public final class Services {

    private Services() {
    }

    /**
     * Creates a service from its blueprint. The service starts out stopped;
     * its processing loop is already running.
     *
     * @param spec the blueprint
     * @return the handle to the new service
     */
    public static <C, I> Service<C> service(ServiceSpec<C, I> spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        return new ServiceActor<>(spec);
    }

    /**
     * Creates a service map. The result is an ordinary service: starting it
     * starts every child, and {@code ask(name, args...)} routes to the named child.
     *
     * @param spec the blueprint of the map
     * @return the handle to the new service map
     */
    public static <C> Service<C> serviceMap(ServiceMapSpec<C> spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        ServiceSpec<C, Map<String, Service<C>>> serviceSpec = spec.asServiceSpec();
        if (serviceSpec.key().isEmpty()) {
            serviceSpec = serviceSpec.toBuilder()
                    .key(ServiceKeys.generate(ServiceKeys.SERVICE_MAP_PREFIX))
                    .build();
        }
        return service(serviceSpec);
    }
}
