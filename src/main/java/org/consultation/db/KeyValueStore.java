package org.consultation.db;

import java.util.function.Function;

/**
 * Pluggable transactional key-value store holding JSON encoded records.
 * <p>
 * {@link #inTransaction(Function)} is all-or-nothing: if the body throws, none of
 * its writes are applied and the exception propagates to the caller.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Runs a read-only body against committed state. Writes through the given
     * view fail with {@link IllegalStateException}.
     */
    <T> T read(Function<StoreTransaction, T> body);

    /**
     * Runs {@code body} as one atomic unit of work and commits its writes.
     */
    <T> T inTransaction(Function<StoreTransaction, T> body);

    @Override
    void close();
}
