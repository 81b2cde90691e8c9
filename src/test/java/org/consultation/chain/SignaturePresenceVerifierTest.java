package org.consultation.chain;

import org.consultation.bc.SignatureUtil;
import org.consultation.bc.Transaction;
import org.consultation.bc.TransactionType;
import org.consultation.errors.NotAuthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SignaturePresenceVerifierTest {

    private SignaturePresenceVerifier verifier;
    private Wallet alice;
    private Wallet bob;

    @BeforeEach
    public void setup() {
        verifier = new SignaturePresenceVerifier();
        alice = new Wallet();
        bob = new Wallet();
    }

    @Test
    public void testSignerIsPresent() {
        Transaction tx = alice.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of("ballot", "0"), 100L);
        assertDoesNotThrow(() -> verifier.requirePresence(tx, alice.getAccount(),
                TransactionType.VOTE_ON_TEMPERATURE_CHECK));
    }

    @Test
    public void testOtherAccountIsNotPresent() {
        Transaction tx = alice.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of(), 100L);
        assertThrows(NotAuthorizedException.class, () -> verifier.requirePresence(tx, bob.getAccount(),
                TransactionType.VOTE_ON_TEMPERATURE_CHECK));
    }

    @Test
    public void testMissingProofRejected() {
        assertThrows(NotAuthorizedException.class, () -> verifier.requirePresence(null, alice.getAccount(),
                TransactionType.MAKE_DELEGATION));
    }

    @Test
    public void testUnsignedTransactionRejected() {
        Transaction tx = new Transaction(alice.getPublicKey(), TransactionType.MAKE_DELEGATION, Map.of(), 100L);
        assertThrows(NotAuthorizedException.class, () -> verifier.requirePresence(tx, alice.getAccount(),
                TransactionType.MAKE_DELEGATION));
    }

    @Test
    public void testForgedSenderKeyRejected() {
        KeyPair mallory = SignatureUtil.generateKeyPair();
        // claims alice's key but is signed with mallory's private key
        Transaction forged = new Transaction(alice.getPublicKey(), TransactionType.MAKE_DELEGATION, Map.of(), 100L)
                .sign(mallory.getPrivate());

        assertFalse(forged.verifySignature());
        assertThrows(NotAuthorizedException.class, () -> verifier.requirePresence(forged, alice.getAccount(),
                TransactionType.MAKE_DELEGATION));
    }

    @Test
    public void testTransactionForAnotherOperationRejected() {
        Transaction vote = alice.sign(TransactionType.VOTE_ON_TEMPERATURE_CHECK, Map.of("ballot", "3"), 1L);

        NotAuthorizedException e = assertThrows(NotAuthorizedException.class,
                () -> verifier.requirePresence(vote, alice.getAccount(), TransactionType.MAKE_DELEGATION));
        assertTrue(e.getMessage().contains("VOTE_ON_TEMPERATURE_CHECK"));
    }
}
