package com.recyclesystems.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Bounded inbox of a service actor.
 * Many callers enqueue, exactly one processing loop dequeues; implementations
 * must preserve FIFO order for that single consumer.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message if it is possible to do so immediately
     * without exceeding capacity.
     *
     * @param message the message to add
     * @return true if the message was added, false if the mailbox is full
     */
    boolean offer(T message);

    /**
     * Inserts the specified message, waiting up to the specified wait time
     * for space to become available.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if successful, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes all available messages and adds them to the given collection.
     *
     * @param collection the collection to transfer messages into
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection);

    /**
     * @return the number of messages currently queued
     */
    int size();

    /**
     * @return true if no messages are queued
     */
    boolean isEmpty();

    /**
     * @return the number of additional messages this mailbox accepts without blocking
     */
    int remainingCapacity();

    /**
     * @return the total capacity of this mailbox
     */
    int capacity();
}
