package com.recyclesystems.mailbox;

import org.jctools.queues.MpscArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) array queue.
 *
 * Enqueue and dequeue are lock-free on the fast path. Blocking waits (a full
 * mailbox for producers, an empty one for the consumer) park on a lock that is
 * only touched when somebody is actually waiting.
 *
 * The capacity is rounded up to the next power of two, as required by JCTools.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    /**
     * Largest capacity that can be requested; anything above would round up past {@code int}.
     */
    public static final int MAX_CAPACITY = 1 << 30;

    // Upper bound on a single park, so a signal raced past the waiter count only costs latency
    private static final long MAX_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final MpscArrayQueue<T> queue;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private volatile int waitingConsumers;
    private volatile int waitingProducers;

    /**
     * Creates a bounded MPSC mailbox.
     *
     * @param requestedCapacity minimum capacity, rounded up to a power of two
     * @throws IllegalArgumentException if the capacity is not positive or above {@link #MAX_CAPACITY}
     */
    public MpscMailbox(int requestedCapacity) {
        if (requestedCapacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + requestedCapacity);
        }
        if (requestedCapacity > MAX_CAPACITY) {
            throw new IllegalArgumentException(
                    "Mailbox capacity must be at most " + MAX_CAPACITY + ": " + requestedCapacity);
        }
        // JCTools requires at least 2
        this.capacity = nextPowerOfTwo(Math.max(2, requestedCapacity));
        this.queue = new MpscArrayQueue<>(capacity);
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added) {
            signal(notEmpty, waitingConsumers);
        }
        return added;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (offer(message)) {
            return true;
        }
        long nanos = unit.toNanos(timeout);
        if (nanos <= 0) {
            return false;
        }

        lock.lockInterruptibly();
        try {
            waitingProducers++;
            long deadline = System.nanoTime() + nanos;
            while (true) {
                if (queue.offer(message)) {
                    break;
                }
                nanos = deadline - System.nanoTime();
                if (nanos <= 0) {
                    return false;
                }
                notFull.awaitNanos(Math.min(nanos, MAX_PARK_NANOS));
            }
        } finally {
            waitingProducers--;
            lock.unlock();
        }
        signal(notEmpty, waitingConsumers);
        return true;
    }

    @Override
    public T poll() {
        T message = queue.poll();
        if (message != null) {
            signal(notFull, waitingProducers);
        }
        return message;
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = poll();
        if (message != null) {
            return message;
        }
        long nanos = unit.toNanos(timeout);
        if (nanos <= 0) {
            return null;
        }

        lock.lockInterruptibly();
        try {
            waitingConsumers++;
            long deadline = System.nanoTime() + nanos;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    break;
                }
                nanos = deadline - System.nanoTime();
                if (nanos <= 0) {
                    return null;
                }
                notEmpty.awaitNanos(Math.min(nanos, MAX_PARK_NANOS));
            }
        } finally {
            waitingConsumers--;
            lock.unlock();
        }
        signal(notFull, waitingProducers);
        return message;
    }

    @Override
    public int drainTo(Collection<? super T> collection) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = queue.drain(collection::add);
        if (count > 0) {
            signal(notFull, waitingProducers);
        }
        return count;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, capacity - queue.size());
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Wakes waiters on the given condition. The lock is only acquired when the
     * volatile waiter count says somebody may be parked.
     */
    private void signal(Condition condition, int waiters) {
        if (waiters > 0) {
            lock.lock();
            try {
                condition.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        int highest = Integer.highestOneBit(value);
        return highest == value ? value : highest << 1;
    }
}
