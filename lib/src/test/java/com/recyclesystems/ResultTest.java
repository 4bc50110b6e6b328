package com.recyclesystems;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    private final ServiceException error = new ServiceException(ErrorKind.NOT_RUNNING, "stopped", "svc");

    @Test
    void testSuccess() {
        Result<String> result = Result.success("value");

        assertTrue(result.isSuccess());
        assertEquals("value", result.getOrThrow());
        assertEquals("value", result.getOrElse("default"));
        assertEquals(5, result.map(String::length).getOrThrow());
    }

    @Test
    void testSuccessMayCarryNull() {
        Result<String> result = Result.success(null);
        assertTrue(result.isSuccess());
        assertNull(result.getOrThrow());
    }

    @Test
    void testFailureThrowsCarriedException() {
        Result<String> result = Result.failure(error);

        assertFalse(result.isSuccess());
        assertSame(error, assertThrows(ServiceException.class, result::getOrThrow));
        assertEquals("default", result.getOrElse("default"));
        assertSame(error, assertThrows(ServiceException.class, () -> result.map(String::length).getOrThrow()));
    }

    @Test
    void testFailureRequiresError() {
        assertThrows(IllegalArgumentException.class, () -> Result.failure(null));
    }

    @Test
    void testCallbacks() {
        AtomicReference<Object> seen = new AtomicReference<>();

        Result.success("v").ifSuccess(seen::set);
        assertEquals("v", seen.get());

        Result.<String>failure(error).ifSuccess(seen::set);
        assertEquals("v", seen.get());

        Result.<String>failure(error).ifFailure(seen::set);
        assertSame(error, seen.get());
    }
}
