package com.recyclesystems;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReplySlotTest {

    @Test
    void testOnlyFirstDeliveryIsKept() throws InterruptedException {
        try (ReplySlot<String> slot = new ReplySlot<>()) {
            assertTrue(slot.deliver(Result.success("first")));
            assertFalse(slot.deliver(Result.success("second")));

            assertEquals("first", slot.await(1, TimeUnit.SECONDS).getOrThrow());
        }
    }

    @Test
    @Timeout(5)
    void testAwaitReturnsNullOnTimeout() throws InterruptedException {
        try (ReplySlot<String> slot = new ReplySlot<>()) {
            assertNull(slot.await(50, TimeUnit.MILLISECONDS));
            assertFalse(slot.isDelivered());
        }
    }

    @Test
    void testDeliveryAfterCloseIsDropped() {
        ReplySlot<String> slot = new ReplySlot<>();
        slot.close();

        assertTrue(slot.isClosed());
        assertFalse(slot.deliver(Result.success("late")));
        assertFalse(slot.isDelivered());
    }

    @Test
    @Timeout(5)
    void testDeliveryFromAnotherThread() throws InterruptedException {
        try (ReplySlot<Integer> slot = new ReplySlot<>()) {
            Thread producer = new Thread(() -> slot.deliver(Result.success(7)));
            producer.start();

            assertEquals(7, slot.await(2, TimeUnit.SECONDS).getOrThrow());
        }
    }
}
