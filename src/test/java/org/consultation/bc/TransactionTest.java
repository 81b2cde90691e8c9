package org.consultation.bc;

import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionTest {

    private final KeyPair keyPair = SignatureUtil.generateKeyPair();

    @Test
    public void testHashIgnoresPayloadInsertionOrder() {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put("delegatee", "account_b");
        forward.put("fraction", "0.4");
        Map<String, String> backward = new LinkedHashMap<>();
        backward.put("fraction", "0.4");
        backward.put("delegatee", "account_b");

        Transaction a = new Transaction(keyPair.getPublic(), TransactionType.MAKE_DELEGATION, forward, 10L, 7L);
        Transaction b = new Transaction(keyPair.getPublic(), TransactionType.MAKE_DELEGATION, backward, 10L, 7L);

        assertEquals(a.getHash(), b.getHash());
    }

    @Test
    public void testHashCoversTypeAndTimestamp() {
        Transaction base = new Transaction(keyPair.getPublic(), TransactionType.MAKE_DELEGATION, Map.of(), 10L, 1L);
        Transaction otherType = new Transaction(keyPair.getPublic(), TransactionType.REMOVE_DELEGATION, Map.of(), 10L, 1L);
        Transaction otherTime = new Transaction(keyPair.getPublic(), TransactionType.MAKE_DELEGATION, Map.of(), 11L, 1L);
        Transaction otherNonce = new Transaction(keyPair.getPublic(), TransactionType.MAKE_DELEGATION, Map.of(), 10L, 2L);

        assertNotEquals(base.getHash(), otherType.getHash());
        assertNotEquals(base.getHash(), otherTime.getHash());
        assertNotEquals(base.getHash(), otherNonce.getHash());
    }

    @Test
    public void testIdenticalRequestsGetDistinctHashes() {
        Transaction first = new Transaction(keyPair.getPublic(), TransactionType.VOTE_ON_PROPOSAL, Map.of("proposal", "1"), 10L);
        Transaction second = new Transaction(keyPair.getPublic(), TransactionType.VOTE_ON_PROPOSAL, Map.of("proposal", "1"), 10L);

        assertNotEquals(first.getHash(), second.getHash());
    }

    @Test
    public void testSignAndVerify() {
        Transaction tx = new Transaction(keyPair.getPublic(), TransactionType.VOTE_ON_PROPOSAL, Map.of("proposal", "1"), 10L);
        assertFalse(tx.verifySignature());

        tx.sign(keyPair.getPrivate());
        assertTrue(tx.verifySignature());
        assertNotNull(tx.getSignature());
    }

    @Test
    public void testSignatureFromOtherKeyFails() {
        Transaction tx = new Transaction(keyPair.getPublic(), TransactionType.VOTE_ON_PROPOSAL, Map.of(), 10L)
                .sign(SignatureUtil.generateKeyPair().getPrivate());
        assertFalse(tx.verifySignature());
    }

    @Test
    public void testPublicKeyStringRoundTrip() throws Exception {
        String encoded = SignatureUtil.getStringFromKey(keyPair.getPublic());
        assertTrue(SignatureUtil.sameKey(keyPair.getPublic(), SignatureUtil.getPublicKeyFromString(encoded)));
    }
}
