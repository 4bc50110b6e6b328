package com.recyclesystems.test;

import com.recyclesystems.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for service tests.
 *
 * <p>Status queries on a service are snapshots, and a call that timed out may
 * still complete inside the service later. These helpers wait for such
 * effects instead of sleeping a fixed time.
 *
 * <pre>{@code
 * assertThrows(ServiceException.class, () -> service.start(config)); // timed out
 * AsyncAssertion.awaitStarted(service, Duration.ofSeconds(2));       // but started later
 * }</pre>
 */
public class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 20;

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long endTime = System.currentTimeMillis() + timeout.toMillis();
        Throwable lastError = null;

        while (System.currentTimeMillis() < endTime) {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            pause();
        }

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    /**
     * Waits until the supplier returns the expected value or timeout is reached.
     *
     * @return the actual value (which equals expected)
     * @throws AssertionError if value doesn't match within timeout, listing the values seen
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long endTime = System.currentTimeMillis() + timeout.toMillis();
        T lastValue = null;
        List<T> valueHistory = new ArrayList<>();

        while (System.currentTimeMillis() < endTime) {
            lastValue = supplier.get();
            if (valueHistory.isEmpty() || !Objects.equals(lastValue, valueHistory.get(valueHistory.size() - 1))) {
                valueHistory.add(lastValue);
            }
            if (Objects.equals(expected, lastValue)) {
                return lastValue;
            }
            pause();
        }

        throw new AssertionError(String.format(
                "Value did not become %s within %s. Value history: %s. Final value: %s",
                expected, timeout, valueHistory, lastValue));
    }

    /**
     * Waits until the assertion runs without throwing.
     *
     * @throws AssertionError carrying the last failure if the assertion keeps failing
     */
    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long endTime = System.currentTimeMillis() + timeout.toMillis();
        Throwable lastError = null;

        while (System.currentTimeMillis() < endTime) {
            try {
                assertion.run();
                return;
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            pause();
        }

        if (lastError != null) {
            throw new AssertionError(
                    "Assertion did not succeed within " + timeout + ". Last error: " + lastError.getMessage(),
                    lastError);
        }
        throw new AssertionError("Assertion did not succeed within " + timeout);
    }

    /**
     * Waits until the service reports started.
     */
    public static void awaitStarted(Service<?> service, Duration timeout) {
        Objects.requireNonNull(service, "service cannot be null");
        try {
            eventually(service::isStarted, timeout);
        } catch (AssertionError e) {
            throw new AssertionError("Service " + service.key() + " did not start within " + timeout, e);
        }
    }

    /**
     * Waits until the service reports stopped.
     */
    public static void awaitStopped(Service<?> service, Duration timeout) {
        Objects.requireNonNull(service, "service cannot be null");
        try {
            eventually(service::isStopped, timeout);
        } catch (AssertionError e) {
            throw new AssertionError("Service " + service.key() + " did not stop within " + timeout, e);
        }
    }

    private static void pause() {
        try {
            Thread.sleep(DEFAULT_POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for condition", e);
        }
    }
}
