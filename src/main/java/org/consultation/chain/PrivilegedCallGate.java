package org.consultation.chain;

import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.errors.NotAuthorizedException;

/**
 * Restricts owner-only operations to a single designated principal.
 */
public interface PrivilegedCallGate {

    /**
     * @throws NotAuthorizedException if {@code transaction} was not issued by the designated principal
     *                                for {@code expectedType}
     */
    void requirePrivileged(Transaction transaction, TransactionType expectedType);
}
