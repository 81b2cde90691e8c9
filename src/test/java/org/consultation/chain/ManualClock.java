package org.consultation.chain;

import org.consultation.util.TimeUtil;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when told to.
 */
public class ManualClock implements Clock {

    private final AtomicLong now;

    public ManualClock(long start) {
        this.now = new AtomicLong(start);
    }

    @Override
    public long now() {
        return now.get();
    }

    public void set(long timestamp) {
        now.set(timestamp);
    }

    public void advance(long seconds) {
        now.addAndGet(seconds);
    }

    public void advanceDays(int days) {
        advance(days * TimeUtil.SECONDS_PER_DAY);
    }
}
