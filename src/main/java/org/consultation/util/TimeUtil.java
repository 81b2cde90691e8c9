package org.consultation.util;


import java.time.Instant;

/**
 * Utility class for working with Unix timestamps in seconds.
 * Ballot windows and delegation validity are all expressed in this unit.
 */
public class TimeUtil {

    public static final long SECONDS_PER_DAY = 86_400L;

    /**
     * Returns the current Unix timestamp in seconds.
     *
     * @return current Unix time in seconds
     */
    public static long getCurrentUnixTime() {
        return Instant.now().getEpochSecond();
    }

    /**
     * Returns the timestamp that lies the given number of whole days after {@code timestamp}.
     *
     * @param timestamp Unix timestamp in seconds.
     * @param days      non-negative day count.
     * @return {@code timestamp + days * 86400}
     * @throws ArithmeticException on overflow
     */
    public static long addDays(long timestamp, int days) {
        return Math.addExact(timestamp, Math.multiplyExact(days, SECONDS_PER_DAY));
    }

    /**
     * Checks whether {@code now} falls inside the half-open window {@code [start, deadline)}.
     *
     * @param now      The current Unix timestamp in seconds.
     * @param start    First second at which the window is open.
     * @param deadline First second at which the window is closed again.
     * @return true if {@code start <= now < deadline}
     */
    public static boolean isWithinWindow(long now, long start, long deadline) {
        return now >= start && now < deadline;
    }

    /**
     * A validity bound is still in force while it lies strictly after {@code now}.
     */
    public static boolean isStillValid(long validUntil, long now) {
        return validUntil > now;
    }
}
