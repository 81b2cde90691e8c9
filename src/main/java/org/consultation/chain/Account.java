package org.consultation.chain;

import org.consultation.bc.SignatureUtil;
import org.consultation.errors.ValidationException;

import java.security.PublicKey;
import java.util.Objects;

/**
 * An on-ledger account, identified by its address.
 * <p>
 * Accounts controlled by a key pair get their address from {@link #of(PublicKey)};
 * any other well-formed address can be referenced with {@link #of(String)}.
 */
public final class Account implements Comparable<Account> {

    public static final String ADDRESS_PREFIX = "account_";
    private static final int ADDRESS_HASH_LENGTH = 40;

    private final String address;

    private Account(String address) {
        this.address = address;
    }

    public static Account of(String address) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Account address must not be blank");
        }
        if (address.indexOf(':') >= 0 || !address.equals(address.trim())) {
            throw new ValidationException("Malformed account address: '" + address + "'");
        }
        return new Account(address);
    }

    public static Account of(PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        String digest = SignatureUtil.applySha256(SignatureUtil.getStringFromKey(publicKey));
        return new Account(ADDRESS_PREFIX + digest.substring(0, ADDRESS_HASH_LENGTH));
    }

    public String getAddress() {
        return address;
    }

    @Override
    public int compareTo(Account other) {
        return address.compareTo(other.address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return address.equals(((Account) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return address;
    }
}
