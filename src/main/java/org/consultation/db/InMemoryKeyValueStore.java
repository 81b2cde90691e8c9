package org.consultation.db;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Simple in-memory implementation of {@link KeyValueStore}.
 * <p>
 * Committed entries live in a sorted map guarded by a fair read/write lock.
 * A transaction buffers its writes (a {@code null} value marks a delete) and
 * applies them under the write lock when the body returns normally.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<String, String> committed = new TreeMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    @Override
    public <T> T read(Function<StoreTransaction, T> body) {
        return body.apply(new BufferedTransaction(true));
    }

    @Override
    public <T> T inTransaction(Function<StoreTransaction, T> body) {
        BufferedTransaction tx = new BufferedTransaction(false);
        T result = body.apply(tx);
        tx.commit();
        return result;
    }

    @Override
    public void close() {
        // nothing to release
    }

    /**
     * Number of committed entries.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return committed.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String upperBound(String prefix) {
        return prefix + Character.MAX_VALUE;
    }

    private class BufferedTransaction implements StoreTransaction {

        private final boolean readOnly;
        private final NavigableMap<String, String> pending = new TreeMap<>();

        BufferedTransaction(boolean readOnly) {
            this.readOnly = readOnly;
        }

        @Override
        public String get(String key) {
            if (pending.containsKey(key)) {
                return pending.get(key);
            }
            lock.readLock().lock();
            try {
                return committed.get(key);
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public void put(String key, String value) {
            checkWritable();
            pending.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        }

        @Override
        public void delete(String key) {
            checkWritable();
            pending.put(Objects.requireNonNull(key), null);
        }

        @Override
        public SortedMap<String, String> scan(String prefix) {
            SortedMap<String, String> out;
            lock.readLock().lock();
            try {
                out = new TreeMap<>(committed.subMap(prefix, true, upperBound(prefix), false));
            } finally {
                lock.readLock().unlock();
            }
            for (Map.Entry<String, String> e : pending.subMap(prefix, true, upperBound(prefix), false).entrySet()) {
                if (e.getValue() == null) {
                    out.remove(e.getKey());
                } else {
                    out.put(e.getKey(), e.getValue());
                }
            }
            return out;
        }

        void commit() {
            if (pending.isEmpty()) return;
            lock.writeLock().lock();
            try {
                for (Map.Entry<String, String> e : pending.entrySet()) {
                    if (e.getValue() == null) {
                        committed.remove(e.getKey());
                    } else {
                        committed.put(e.getKey(), e.getValue());
                    }
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        private void checkWritable() {
            if (readOnly) {
                throw new IllegalStateException("Store opened read-only for this unit of work");
            }
        }
    }
}
