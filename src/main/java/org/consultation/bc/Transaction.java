package org.consultation.bc;

import org.consultation.util.ConversionUtil;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.Map;
import java.util.TreeMap;

/**
 * A signed invocation of the governance or delegation components.
 * <p>
 * The signature over {@link #getHash()} is the presence proof for the account
 * derived from the sender key. The random nonce makes every built transaction
 * hash differently, so a hash can be consumed once.
 */
public class Transaction {

    private static final SecureRandom NONCES = new SecureRandom();

    private final String hash;
    private final PublicKey senderPublicKey;
    private final TransactionType type;
    private final Map<String, String> payload; // operation arguments, informational
    private final long timestamp;
    private final long nonce;
    private byte[] signature;


    /**
     * @param senderPublicKey The public key of the invoking account.
     * @param type            The operation being invoked.
     * @param payload         String form of the operation arguments, e.g. {"ballot": "3", "vote": "FOR"}.
     * @param timestamp       Unix seconds at which the transaction was built.
     */
    public Transaction(PublicKey senderPublicKey, TransactionType type, Map<String, String> payload, long timestamp) {
        this(senderPublicKey, type, payload, timestamp, NONCES.nextLong());
    }

    public Transaction(PublicKey senderPublicKey, TransactionType type, Map<String, String> payload, long timestamp,
                       long nonce) {
        this.senderPublicKey = senderPublicKey;
        this.type = type;
        this.payload = payload == null ? Map.of() : Map.copyOf(payload);
        this.timestamp = timestamp;
        this.nonce = nonce;
        this.hash = calculateHash();
    }

    /**
     * SHA-256 over sender key, type, payload, timestamp and nonce. The payload is hashed
     * in key order so the result does not depend on insertion order.
     */
    public String calculateHash() {
        String payloadJson = ConversionUtil.toJson(new TreeMap<>(payload));
        return SignatureUtil.applySha256(
                SignatureUtil.getStringFromKey(senderPublicKey) +
                        type.toString() +
                        payloadJson +
                        timestamp +
                        ":" + nonce
        );
    }

    /**
     * Signs the transaction using the sender's private key.
     */
    public Transaction sign(PrivateKey privateKey) {
        this.signature = SignatureUtil.sign(privateKey, this.hash);
        return this;
    }

    /**
     * @return true if the transaction is signed and the signature matches the sender key.
     */
    public boolean verifySignature() {
        return signature != null && SignatureUtil.verify(senderPublicKey, signature, calculateHash());
    }

    public String getHash() {
        return hash;
    }

    public PublicKey getSenderPublicKey() {
        return senderPublicKey;
    }

    public TransactionType getType() {
        return type;
    }

    public Map<String, String> getPayload() {
        return payload;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getNonce() {
        return nonce;
    }

    public byte[] getSignature() {
        return signature == null ? null : signature.clone();
    }
}
