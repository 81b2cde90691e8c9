package org.consultation.chain;

import org.consultation.util.TimeUtil;

/**
 * Wall-clock time rounded down to whole seconds.
 */
public class SystemClock implements Clock {

    @Override
    public long now() {
        return TimeUtil.getCurrentUnixTime();
    }
}
