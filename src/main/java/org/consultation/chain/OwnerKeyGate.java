package org.consultation.chain;

import org.consultation.bc.SignatureUtil;
import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.errors.NotAuthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.util.Objects;

/**
 * Grants privileged calls to transactions validly signed by the owner key.
 */
public class OwnerKeyGate implements PrivilegedCallGate {

    private static final Logger log = LoggerFactory.getLogger(OwnerKeyGate.class);

    private final PublicKey ownerKey;

    public OwnerKeyGate(PublicKey ownerKey) {
        this.ownerKey = Objects.requireNonNull(ownerKey, "ownerKey must not be null");
    }

    @Override
    public void requirePrivileged(Transaction transaction, TransactionType expectedType) {
        if (transaction == null) {
            throw new NotAuthorizedException("Owner proof missing");
        }
        if (transaction.getType() != expectedType) {
            log.warn("[OwnerKeyGate] {} transaction offered for {}", transaction.getType(), expectedType);
            throw new NotAuthorizedException("Transaction was signed for " + transaction.getType()
                    + ", not " + expectedType);
        }
        if (!SignatureUtil.sameKey(ownerKey, transaction.getSenderPublicKey())) {
            log.warn("[OwnerKeyGate] {} rejected: sender is not the owner", transaction.getType());
            throw new NotAuthorizedException("Only the owner may invoke " + transaction.getType());
        }
        if (!transaction.verifySignature()) {
            log.warn("[OwnerKeyGate] {} rejected: invalid signature", transaction.getType());
            throw new NotAuthorizedException("Invalid owner signature");
        }
    }
}
