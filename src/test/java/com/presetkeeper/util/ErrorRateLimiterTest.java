package com.presetkeeper.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testFirstErrorPassesAndBurstIsSuppressed() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 60_000);
        assertTrue(limiter.log("first", new RuntimeException("a")));
        assertFalse(limiter.log("second", new RuntimeException("b")));
        assertFalse(limiter.log("third", new RuntimeException("c")));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testSuppressedCountResetsWhenAnErrorGetsThrough() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 20);
        assertTrue(limiter.log("first", null));
        assertFalse(limiter.log("second", null));
        Thread.sleep(50);
        assertTrue(limiter.log("third", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
