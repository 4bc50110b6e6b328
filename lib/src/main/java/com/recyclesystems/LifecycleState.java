package com.recyclesystems;

/**
 * Snapshot of a service's lifecycle: its status and the instance returned by
 * the start function. A stopped service keeps the last instance it ran with
 * (null before the first start).
 *
 * @param status whether the service is running
 * @param instance the service instance, may be null
 * @param <I> the instance type
 */
public record LifecycleState<I>(Status status, I instance) {

    public enum Status {
        STOPPED,
        STARTED
    }

    public LifecycleState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static <I> LifecycleState<I> stopped(I instance) {
        return new LifecycleState<>(Status.STOPPED, instance);
    }

    public static <I> LifecycleState<I> started(I instance) {
        return new LifecycleState<>(Status.STARTED, instance);
    }

    public boolean isStarted() {
        return status == Status.STARTED;
    }

    public boolean isStopped() {
        return status == Status.STOPPED;
    }
}
