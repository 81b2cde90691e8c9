package org.consultation.chain;

import org.consultation.bc.SignatureUtil;
import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;

import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Map;

/**
 * Holds an account's key pair and signs the transactions it submits.
 */
public class Wallet {
    private final KeyPair keyPair;
    private final Account account;

    public Wallet() {
        this(SignatureUtil.generateKeyPair());
    }

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.account = Account.of(keyPair.getPublic());
    }

    public Account getAccount() {
        return account;
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    /**
     * Builds and signs a transaction of the given type.
     *
     * @param timestamp Unix seconds recorded in the transaction.
     */
    public Transaction sign(TransactionType type, Map<String, String> payload, long timestamp) {
        return new Transaction(keyPair.getPublic(), type, payload, timestamp).sign(keyPair.getPrivate());
    }
}
