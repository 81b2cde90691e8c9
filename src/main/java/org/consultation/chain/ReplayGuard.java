package org.consultation.chain;

import org.consultation.bc.Transaction;
import org.consultation.constants.ConfigKey;
import org.consultation.db.StoreTransaction;
import org.consultation.errors.NotAuthorizedException;

/**
 * Makes a signed transaction usable once per store. The consumed hash is written
 * in the same store transaction as the operation it authorized, so a rejected
 * operation leaves the transaction unused.
 */
public final class ReplayGuard {

    private ReplayGuard() {
    }

    /**
     * Key to lock alongside the entity key, so two concurrent uses of the same
     * transaction cannot both pass {@link #consume}.
     */
    public static String lockKey(Transaction transaction) {
        return ConfigKey.CONSUMED_TRANSACTION.key(transaction.getHash());
    }

    /**
     * @throws NotAuthorizedException if the transaction was already used in this store
     */
    public static void consume(StoreTransaction tx, Transaction transaction) {
        String key = lockKey(transaction);
        if (tx.get(key) != null) {
            throw new NotAuthorizedException("Transaction " + transaction.getHash() + " has already been used");
        }
        tx.put(key, transaction.getType().name());
    }
}
