package com.recyclesystems.builder;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates keys for services created without one.
 * <p>
 * Keys are a prefix plus a per-prefix sequential counter, e.g. {@code "service-1"},
 * {@code "service-map-1"}. Children of a service map get hierarchical keys,
 * e.g. {@code "service-map-1/db"}.
 */
public final class ServiceKeys {

    public static final String SERVICE_PREFIX = "service";
    public static final String SERVICE_MAP_PREFIX = "service-map";

    private static final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    private ServiceKeys() {
    }

    /**
     * Generates the next key for the given prefix.
     *
     * @param prefix the key prefix
     * @return a key unique within this process
     */
    public static String generate(String prefix) {
        long seq = counters.computeIfAbsent(prefix, k -> new AtomicLong(0)).incrementAndGet();
        return prefix + "-" + seq;
    }

    /**
     * Builds the key of a child of a service map.
     *
     * @param parentKey the service map key
     * @param name the name of the child within the map
     * @return the hierarchical key
     */
    public static String child(String parentKey, String name) {
        return parentKey + "/" + name;
    }
}
