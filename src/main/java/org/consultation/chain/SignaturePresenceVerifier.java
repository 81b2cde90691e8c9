package org.consultation.chain;

import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.errors.NotAuthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts a transaction as presence proof when it was built for the invoked
 * operation, carries a valid signature and its sender key derives the claimed
 * account address. Single use is enforced by the component, see {@link ReplayGuard}.
 */
public class SignaturePresenceVerifier implements PresenceVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignaturePresenceVerifier.class);

    @Override
    public void requirePresence(Transaction transaction, Account account, TransactionType expectedType) {
        if (transaction == null || account == null) {
            throw new NotAuthorizedException("Presence proof missing");
        }
        if (transaction.getType() != expectedType) {
            log.warn("[PresenceVerifier] {} transaction offered for {}", transaction.getType(), expectedType);
            throw new NotAuthorizedException("Transaction was signed for " + transaction.getType()
                    + ", not " + expectedType);
        }
        if (!transaction.verifySignature()) {
            log.warn("[PresenceVerifier] Invalid signature on transaction {}", transaction.getHash());
            throw new NotAuthorizedException("Invalid transaction signature");
        }
        Account signer = Account.of(transaction.getSenderPublicKey());
        if (!signer.equals(account)) {
            log.warn("[PresenceVerifier] {} signed for {}", signer, account);
            throw new NotAuthorizedException("Transaction is not signed by " + account);
        }
    }
}
