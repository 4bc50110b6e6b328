package com.recyclesystems.test;

import com.recyclesystems.ServiceSpec;
import com.recyclesystems.handler.ReceiveHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds service specs whose callbacks record every invocation, so tests can
 * assert on what the service actually did.
 *
 * <pre>{@code
 * ServiceProbe<String> probe = ServiceProbe.create();
 * Service<String> service = Services.service(probe.spec());
 * service.start("cfg");
 * service.start("cfg");
 * assertEquals(1, probe.startCount());
 * assertEquals(List.of("cfg"), probe.startConfigs());
 * }</pre>
 *
 * <p>The probe's instance is the config it was started with; receive echoes
 * the argument list unless a handler is supplied.
 *
 * @param <C> the configuration type
 */
public class ServiceProbe<C> {

    private static final Logger logger = LoggerFactory.getLogger(ServiceProbe.class);

    private final List<C> startConfigs = new CopyOnWriteArrayList<>();
    private final List<C> stoppedInstances = new CopyOnWriteArrayList<>();
    private final List<List<Object>> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger starts = new AtomicInteger();
    private final AtomicInteger stops = new AtomicInteger();
    private final ReceiveHandler<C> receiveHandler;

    private ServiceProbe(ReceiveHandler<C> receiveHandler) {
        this.receiveHandler = receiveHandler;
    }

    /**
     * Creates a probe whose receive returns its arguments as a list.
     */
    public static <C> ServiceProbe<C> create() {
        return new ServiceProbe<>((instance, args) -> Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))));
    }

    /**
     * Creates a probe that delegates receive to the given handler after recording it.
     */
    public static <C> ServiceProbe<C> create(ReceiveHandler<C> receiveHandler) {
        return new ServiceProbe<>(receiveHandler);
    }

    /**
     * @return a builder for a spec wired to this probe; callers may still set key, timeouts and so on
     */
    public ServiceSpec.Builder<C, C> specBuilder() {
        return ServiceSpec.<C, C>builder()
                .start(config -> {
                    starts.incrementAndGet();
                    startConfigs.add(config);
                    logger.debug("Probe started with {}", config);
                    return config;
                })
                .stop(instance -> {
                    stops.incrementAndGet();
                    stoppedInstances.add(instance);
                    logger.debug("Probe stopped {}", instance);
                })
                .receive((instance, args) -> {
                    received.add(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))));
                    return receiveHandler.receive(instance, args);
                });
    }

    public ServiceSpec<C, C> spec() {
        return specBuilder().build();
    }

    public int startCount() {
        return starts.get();
    }

    public int stopCount() {
        return stops.get();
    }

    public List<C> startConfigs() {
        return List.copyOf(startConfigs);
    }

    public List<C> stoppedInstances() {
        return List.copyOf(stoppedInstances);
    }

    /**
     * @return the argument lists of every receive call, in processing order
     */
    public List<List<Object>> received() {
        return List.copyOf(received);
    }
}
