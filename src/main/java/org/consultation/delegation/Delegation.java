package org.consultation.delegation;

import org.consultation.chain.Account;
import org.consultation.util.TimeUtil;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A delegator's assignment of {@code fraction} of its voting weight to
 * {@code delegatee}, in force while {@code validUntil} lies after the current time.
 */
public class Delegation {
    private Account delegatee;
    private BigDecimal fraction;
    private long validUntil;

    public Delegation(Account delegatee, BigDecimal fraction, long validUntil) {
        this.delegatee = delegatee;
        this.fraction = fraction;
        this.validUntil = validUntil;
    }

    public Account getDelegatee() {
        return delegatee;
    }

    public BigDecimal getFraction() {
        return fraction;
    }

    public long getValidUntil() {
        return validUntil;
    }

    public boolean isValidAt(long now) {
        return TimeUtil.isStillValid(validUntil, now);
    }

    @Override
    public String toString() {
        return "Delegation{" +
                "delegatee=" + delegatee +
                ", fraction=" + fraction +
                ", validUntil=" + validUntil +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Delegation that = (Delegation) o;
        return validUntil == that.validUntil &&
                Objects.equals(delegatee, that.delegatee) &&
                fraction != null && that.fraction != null && fraction.compareTo(that.fraction) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(delegatee, validUntil, fraction == null ? null : fraction.stripTrailingZeros());
    }
}
