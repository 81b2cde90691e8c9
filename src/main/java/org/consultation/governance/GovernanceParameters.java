package org.consultation.governance;

import org.consultation.constants.Limits;
import org.consultation.errors.ValidationException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Knobs used when a ballot is created. Each ballot copies the values of its tier,
 * so later updates never reach ballots already created.
 */
public class GovernanceParameters {
    private int temperatureCheckDays;
    private BigDecimal temperatureCheckQuorum;
    private BigDecimal temperatureCheckApprovalThreshold;
    private BigDecimal temperatureCheckProposeThreshold;
    private int proposalLengthDays;
    private BigDecimal proposalQuorum;
    private BigDecimal proposalApprovalThreshold;

    public GovernanceParameters(int temperatureCheckDays,
                                BigDecimal temperatureCheckQuorum,
                                BigDecimal temperatureCheckApprovalThreshold,
                                BigDecimal temperatureCheckProposeThreshold,
                                int proposalLengthDays,
                                BigDecimal proposalQuorum,
                                BigDecimal proposalApprovalThreshold) {
        this.temperatureCheckDays = temperatureCheckDays;
        this.temperatureCheckQuorum = temperatureCheckQuorum;
        this.temperatureCheckApprovalThreshold = temperatureCheckApprovalThreshold;
        this.temperatureCheckProposeThreshold = temperatureCheckProposeThreshold;
        this.proposalLengthDays = proposalLengthDays;
        this.proposalQuorum = proposalQuorum;
        this.proposalApprovalThreshold = proposalApprovalThreshold;
    }

    public static GovernanceParameters defaults() {
        return new GovernanceParameters(
                7,
                new BigDecimal("1000"),
                new BigDecimal("0.5"),
                new BigDecimal("100"),
                14,
                new BigDecimal("5000"),
                new BigDecimal("0.5"));
    }

    /**
     * @throws ValidationException if a day count is outside 0..65535 or a decimal is missing or negative
     */
    public void validate() {
        checkDays("temperatureCheckDays", temperatureCheckDays);
        checkDays("proposalLengthDays", proposalLengthDays);
        checkDecimal("temperatureCheckQuorum", temperatureCheckQuorum);
        checkDecimal("temperatureCheckApprovalThreshold", temperatureCheckApprovalThreshold);
        checkDecimal("temperatureCheckProposeThreshold", temperatureCheckProposeThreshold);
        checkDecimal("proposalQuorum", proposalQuorum);
        checkDecimal("proposalApprovalThreshold", proposalApprovalThreshold);
    }

    private static void checkDays(String name, int days) {
        if (days < 0 || days > Limits.MAX_DAYS) {
            throw new ValidationException(name + " must be between 0 and " + Limits.MAX_DAYS);
        }
    }

    private static void checkDecimal(String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new ValidationException(name + " must be a non-negative decimal");
        }
    }

    public int getTemperatureCheckDays() {
        return temperatureCheckDays;
    }

    public BigDecimal getTemperatureCheckQuorum() {
        return temperatureCheckQuorum;
    }

    public BigDecimal getTemperatureCheckApprovalThreshold() {
        return temperatureCheckApprovalThreshold;
    }

    public BigDecimal getTemperatureCheckProposeThreshold() {
        return temperatureCheckProposeThreshold;
    }

    public int getProposalLengthDays() {
        return proposalLengthDays;
    }

    public BigDecimal getProposalQuorum() {
        return proposalQuorum;
    }

    public BigDecimal getProposalApprovalThreshold() {
        return proposalApprovalThreshold;
    }

    @Override
    public String toString() {
        return "GovernanceParameters{" +
                "temperatureCheckDays=" + temperatureCheckDays +
                ", temperatureCheckQuorum=" + temperatureCheckQuorum +
                ", temperatureCheckApprovalThreshold=" + temperatureCheckApprovalThreshold +
                ", temperatureCheckProposeThreshold=" + temperatureCheckProposeThreshold +
                ", proposalLengthDays=" + proposalLengthDays +
                ", proposalQuorum=" + proposalQuorum +
                ", proposalApprovalThreshold=" + proposalApprovalThreshold +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GovernanceParameters that = (GovernanceParameters) o;
        return temperatureCheckDays == that.temperatureCheckDays &&
                proposalLengthDays == that.proposalLengthDays &&
                sameValue(temperatureCheckQuorum, that.temperatureCheckQuorum) &&
                sameValue(temperatureCheckApprovalThreshold, that.temperatureCheckApprovalThreshold) &&
                sameValue(temperatureCheckProposeThreshold, that.temperatureCheckProposeThreshold) &&
                sameValue(proposalQuorum, that.proposalQuorum) &&
                sameValue(proposalApprovalThreshold, that.proposalApprovalThreshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(temperatureCheckDays, proposalLengthDays,
                strip(temperatureCheckQuorum), strip(temperatureCheckApprovalThreshold),
                strip(temperatureCheckProposeThreshold), strip(proposalQuorum), strip(proposalApprovalThreshold));
    }

    // 0.5 and 0.50 are the same parameter value
    private static boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }

    private static BigDecimal strip(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros();
    }
}
