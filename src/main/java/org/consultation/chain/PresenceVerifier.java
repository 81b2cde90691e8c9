package org.consultation.chain;

import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.errors.NotAuthorizedException;

/**
 * Confirms that an invocation genuinely acts on behalf of a claimed account.
 */
public interface PresenceVerifier {

    /**
     * @param expectedType the operation being invoked; a transaction signed for another operation is no proof
     * @throws NotAuthorizedException if {@code transaction} does not prove the presence of {@code account}
     */
    void requirePresence(Transaction transaction, Account account, TransactionType expectedType);
}
