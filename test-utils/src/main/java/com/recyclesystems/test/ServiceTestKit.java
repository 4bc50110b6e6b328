package com.recyclesystems.test;

import com.recyclesystems.Service;
import com.recyclesystems.ServiceMapSpec;
import com.recyclesystems.ServiceSpec;
import com.recyclesystems.Services;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates services for a test and closes all of them afterwards.
 *
 * <pre>{@code
 * try (ServiceTestKit testKit = ServiceTestKit.create()) {
 *     Service<String> service = testKit.service(spec);
 *     service.start("cfg");
 * } // every service is stopped and disposed here
 * }</pre>
 */
public class ServiceTestKit implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServiceTestKit.class);

    private final List<Service<?>> services = new ArrayList<>();

    private ServiceTestKit() {
    }

    public static ServiceTestKit create() {
        return new ServiceTestKit();
    }

    public synchronized <C, I> Service<C> service(ServiceSpec<C, I> spec) {
        Service<C> service = Services.service(spec);
        services.add(service);
        return service;
    }

    public synchronized <C> Service<C> serviceMap(ServiceMapSpec<C> spec) {
        Service<C> service = Services.serviceMap(spec);
        services.add(service);
        return service;
    }

    /**
     * Creates a service wired to the probe.
     */
    public <C> Service<C> probe(ServiceProbe<C> probe) {
        return service(probe.spec());
    }

    /**
     * @return the services created so far, in creation order
     */
    public synchronized List<Service<?>> services() {
        return List.copyOf(services);
    }

    /**
     * Closes every service, most recently created first.
     */
    @Override
    public synchronized void close() {
        for (int i = services.size() - 1; i >= 0; i--) {
            Service<?> service = services.get(i);
            try {
                service.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close service {}", service.key(), e);
            }
        }
        services.clear();
    }
}
