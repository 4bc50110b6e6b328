package com.recyclesystems;

import com.recyclesystems.builder.ServiceKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * The start, stop and receive functions of a service map.
 *
 * <p>The map's instance is the ordered mapping of child names to child
 * services. Children are created fresh on every start, started and stopped
 * concurrently (one worker task each), and disposed when the map stops.
 *
 * <p>Start is all-or-nothing: if any child fails, the children that did
 * start are stopped again, all children are disposed, and the first failure
 * in declaration order is thrown with the others attached as suppressed.
 *
 * @param <C> the configuration type shared by the children
 */
final class ServiceMap<C> {

    private static final Logger logger = LoggerFactory.getLogger(ServiceMap.class);

    private final ServiceMapSpec<C> spec;

    private ServiceMap(ServiceMapSpec<C> spec) {
        this.spec = spec;
    }

    static <C> ServiceSpec<C, Map<String, Service<C>>> toServiceSpec(ServiceMapSpec<C> spec) {
        ServiceMap<C> serviceMap = new ServiceMap<>(spec);
        ServiceSpec.Builder<C, Map<String, Service<C>>> builder = ServiceSpec.<C, Map<String, Service<C>>>builder()
                .mapConfig(spec.mapConfig())
                .start(serviceMap::start)
                .stop(serviceMap::stop)
                .receive(serviceMap::receive)
                .timeoutMillis(spec.timeoutMillis())
                .inboxCapacity(spec.inboxCapacity())
                .mailboxType(spec.mailboxType())
                .threadPoolFactory(spec.threadPoolFactory());
        spec.key().ifPresent(builder::key);
        return builder.build();
    }

    Map<String, Service<C>> start(C config) {
        String mapKey = currentKey();
        Map<String, Service<C>> children = new LinkedHashMap<>();
        for (Map.Entry<String, ServiceSpec<C, ?>> entry : spec.services().entrySet()) {
            children.put(entry.getKey(), createChild(mapKey, entry.getKey(), entry.getValue()));
        }

        Map<String, Throwable> failures = concurrently(children, child -> child.start(config));
        if (failures.isEmpty()) {
            logger.debug("Service map {} started {} children", mapKey, children.size());
            return Collections.unmodifiableMap(children);
        }

        logger.warn("Service map {} failed to start children {}; rolling back", mapKey, failures.keySet());
        Map<String, Service<C>> started = new LinkedHashMap<>();
        children.forEach((name, child) -> {
            if (!failures.containsKey(name)) {
                started.put(name, child);
            }
        });
        concurrently(started, Service::stop).forEach((name, error) ->
                logger.warn("Service map {} could not roll back child {}", mapKey, name, error));
        children.values().forEach(Service::close);

        List<Throwable> errors = new ArrayList<>(failures.values());
        Throwable first = errors.get(0);
        ServiceException thrown = first instanceof ServiceException serviceException
                ? serviceException
                : new ServiceException(ErrorKind.USER_FUNCTION, "child service failed to start", mapKey, first);
        for (Throwable other : errors.subList(1, errors.size())) {
            if (other != thrown) {
                thrown.addSuppressed(other);
            }
        }
        throw thrown;
    }

    void stop(Map<String, Service<C>> children) {
        String mapKey = currentKey();
        concurrently(children, Service::stop).forEach((name, error) ->
                logger.warn("Service map {} could not stop child {}", mapKey, name, error));
        children.values().forEach(Service::close);
        logger.debug("Service map {} stopped {} children", mapKey, children.size());
    }

    Object receive(Map<String, Service<C>> children, Object... args) {
        String mapKey = currentKey();
        Object childKey = args.length > 0 ? args[0] : null;
        Service<C> child = childKey instanceof String ? children.get(childKey) : null;
        if (child == null) {
            throw new ServiceException(ErrorKind.SERVICE_NOT_FOUND,
                    "message sent to service not found in map: " + childKey, mapKey);
        }
        Object[] rest = new Object[args.length - 1];
        System.arraycopy(args, 1, rest, 0, rest.length);
        return child.ask(rest);
    }

    private Service<C> createChild(String mapKey, String name, ServiceSpec<C, ?> childSpec) {
        if (childSpec.key().isPresent()) {
            return Services.service(childSpec);
        }
        return Services.service(withKey(childSpec, ServiceKeys.child(mapKey, name)));
    }

    private static <C, I> ServiceSpec<C, I> withKey(ServiceSpec<C, I> childSpec, String key) {
        return childSpec.toBuilder().key(key).build();
    }

    /**
     * Runs the operation on every child in its own worker task and waits for all
     * of them, whatever their outcome.
     *
     * @return failures by child name, in declaration order
     */
    private Map<String, Throwable> concurrently(Map<String, Service<C>> children, Consumer<Service<C>> operation) {
        ExecutorService executor = spec.threadPoolFactory().getWorkerExecutor();
        Map<String, CompletableFuture<Void>> tasks = new LinkedHashMap<>();
        children.forEach((name, child) ->
                tasks.put(name, CompletableFuture.runAsync(() -> operation.accept(child), executor)));

        CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0]))
                .exceptionally(error -> null)
                .join();

        Map<String, Throwable> failures = new LinkedHashMap<>();
        tasks.forEach((name, task) -> {
            if (task.isCompletedExceptionally()) {
                failures.put(name, unwrap(task));
            }
        });
        return failures;
    }

    private static Throwable unwrap(CompletableFuture<Void> task) {
        try {
            task.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    private static String currentKey() {
        return ServiceContext.currentKey().orElse(ServiceKeys.SERVICE_MAP_PREFIX);
    }
}
