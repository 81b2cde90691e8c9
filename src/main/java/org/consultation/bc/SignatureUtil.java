package org.consultation.bc;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * SHA-256 hashing, EC key generation and ECDSA signing/verification.
 * Registers the Bouncy Castle provider on first use.
 */
public class SignatureUtil {

    private static final String ALGORITHM = "SHA256withECDSA";
    private static final String PROVIDER = "BC";
    private static final String CURVE = "prime256v1";

    static {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    /**
     * Applies the SHA-256 hash algorithm to a given string.
     * @param input The string to be hashed.
     * @return The calculated SHA-256 hash as a lower-case hex string.
     */
    public static String applySha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Generates a new P-256 key pair.
     */
    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("ECDSA", PROVIDER);
            keyGen.initialize(new ECGenParameterSpec(CURVE), new SecureRandom());
            return keyGen.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation unavailable", e);
        }
    }

    /**
     * Signs a string of data using a private key.
     * @param privateKey The private key to sign with.
     * @param data The data to be signed.
     * @return the DER encoded signature.
     */
    public static byte[] sign(PrivateKey privateKey, String data) {
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initSign(privateKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /**
     * Verifies a digital signature.
     * @return true if the signature is valid, false if it is not or cannot be parsed.
     */
    public static boolean verify(PublicKey publicKey, byte[] signature, String data) {
        if (publicKey == null || signature == null || data == null) {
            return false;
        }
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initVerify(publicKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.verify(signature);
        } catch (GeneralSecurityException e) {
            // malformed signature bytes
            return false;
        }
    }

    /**
     * Base64 encoding of a key's encoded form.
     */
    public static String getStringFromKey(Key key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    /**
     * Decodes a Base64 X.509 public key produced by {@link #getStringFromKey(Key)}.
     */
    public static PublicKey getPublicKeyFromString(String key) throws GeneralSecurityException {
        byte[] keyBytes = Base64.getDecoder().decode(key);
        KeyFactory keyFactory = KeyFactory.getInstance("ECDSA", PROVIDER);
        return keyFactory.generatePublic(new X509EncodedKeySpec(keyBytes));
    }

    /**
     * Two keys are the same when their encoded forms are equal.
     */
    public static boolean sameKey(PublicKey a, PublicKey b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getEncoded(), b.getEncoded());
    }
}
