package org.consultation.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TimeUtilTest {

    @Test
    public void testAddDays() {
        assertEquals(1_000L + 7 * 86_400L, TimeUtil.addDays(1_000L, 7));
        assertEquals(1_000L, TimeUtil.addDays(1_000L, 0));
    }

    @Test
    public void testAddDaysOverflow() {
        assertThrows(ArithmeticException.class, () -> TimeUtil.addDays(Long.MAX_VALUE - 10, 1));
    }

    @Test
    public void testWindowIsHalfOpen() {
        assertTrue(TimeUtil.isWithinWindow(100, 100, 200));
        assertTrue(TimeUtil.isWithinWindow(199, 100, 200));
        assertFalse(TimeUtil.isWithinWindow(200, 100, 200));
        assertFalse(TimeUtil.isWithinWindow(99, 100, 200));
    }

    @Test
    public void testValidityIsStrict() {
        assertTrue(TimeUtil.isStillValid(101, 100));
        assertFalse(TimeUtil.isStillValid(100, 100));
    }
}
