package org.consultation.chain;

/**
 * Source of the current ledger time, in Unix seconds.
 */
public interface Clock {

    long now();
}
