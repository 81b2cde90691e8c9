package org.consultation.util;

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-key mutual exclusion.
 * <p>
 * Operations on the same key run one at a time; operations on keys that map to
 * different stripes proceed in parallel. Multiple keys are always acquired in
 * ascending stripe order, so callers holding several keys cannot deadlock.
 */
public class KeyedLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public KeyedLocks() {
        this(DEFAULT_STRIPES);
    }

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be > 0");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    /**
     * Runs {@code body} while holding the locks of every given key.
     */
    public <T> T withLocks(Supplier<T> body, String... keys) {
        int[] order = Arrays.stream(keys)
                .mapToInt(this::stripeOf)
                .distinct()
                .sorted()
                .toArray();

        int acquired = 0;
        try {
            for (int index : order) {
                stripes[index].lock();
                acquired++;
            }
            return body.get();
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                stripes[order[i]].unlock();
            }
        }
    }

    public void runWithLocks(Runnable body, String... keys) {
        withLocks(() -> {
            body.run();
            return null;
        }, keys);
    }

    int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }
}
