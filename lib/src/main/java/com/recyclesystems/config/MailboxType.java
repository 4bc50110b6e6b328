package com.recyclesystems.config;

import com.recyclesystems.mailbox.LinkedMailbox;
import com.recyclesystems.mailbox.Mailbox;
import com.recyclesystems.mailbox.MpscMailbox;

/**
 * Defines the inbox implementation used by a service.
 *
 * <ul>
 *   <li>{@link #LINKED} - LinkedBlockingQueue, exact capacity (default)</li>
 *   <li>{@link #MPSC} - JCTools MpscArrayQueue, capacity rounded up to a power of two</li>
 * </ul>
 */
public enum MailboxType {
    LINKED {
        @Override
        public <T> Mailbox<T> create(int capacity) {
            return new LinkedMailbox<>(capacity);
        }
    },

    /**
     * Lock-free enqueue for services with many concurrent callers.
     */
    MPSC {
        @Override
        public <T> Mailbox<T> create(int capacity) {
            return new MpscMailbox<>(capacity);
        }
    };

    /**
     * Creates a new inbox of this type.
     *
     * @param capacity requested capacity
     * @return a new, empty mailbox
     */
    public abstract <T> Mailbox<T> create(int capacity);
}
