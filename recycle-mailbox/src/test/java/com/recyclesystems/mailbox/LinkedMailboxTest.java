package com.recyclesystems.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LinkedMailbox: null handling, capacity limits, timeouts and FIFO order.
 */
class LinkedMailboxTest {

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedMailbox<String>(0));
    }

    @Test
    void testOfferRejectsNull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(4);
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
        assertThrows(NullPointerException.class, () -> mailbox.offer(null, 1, TimeUnit.SECONDS));
    }

    @Test
    void testFifoOrder() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(4);

        assertTrue(mailbox.offer("message1"));
        assertTrue(mailbox.offer("message2"));

        assertEquals("message1", mailbox.poll());
        assertEquals("message2", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void testBoundedCapacity() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(2);

        assertTrue(mailbox.offer("msg1"));
        assertTrue(mailbox.offer("msg2"));
        assertFalse(mailbox.offer("msg3"));
        assertEquals(2, mailbox.capacity());
        assertEquals(0, mailbox.remainingCapacity());
    }

    @Test
    @Timeout(5)
    void testOfferTimesOutWhenFull() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.offer("msg1");

        long start = System.nanoTime();
        assertFalse(mailbox.offer("msg2", 100, TimeUnit.MILLISECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 90, "Should have waited for the timeout, waited " + elapsedMs + "ms");
    }

    @Test
    @Timeout(5)
    void testBlockedOfferSucceedsOnceSpaceFrees() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(1);
        mailbox.offer("msg1");
        AtomicBoolean offered = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                offered.set(mailbox.offer("msg2", 2, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        producer.start();

        Thread.sleep(50);
        assertEquals("msg1", mailbox.poll());
        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(offered.get());
        assertEquals("msg2", mailbox.poll());
    }

    @Test
    void testDrainTo() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(8);
        mailbox.offer("a");
        mailbox.offer("b");
        mailbox.offer("c");

        List<String> drained = new ArrayList<>();
        assertEquals(3, mailbox.drainTo(drained));
        assertEquals(List.of("a", "b", "c"), drained);
        assertTrue(mailbox.isEmpty());
    }
}
