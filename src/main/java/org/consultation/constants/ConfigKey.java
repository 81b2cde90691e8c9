package org.consultation.constants;

/**
 * Keys of the keyed state store. Per-entity keys are built with {@link #key(Object...)}.
 */
public enum ConfigKey {

    GOVERNANCE_PARAMETERS,
    TEMPERATURE_CHECK_COUNT,
    PROPOSAL_COUNT,

//    Ballots

    TEMPERATURE_CHECK,
    TEMPERATURE_CHECK_VOTE,
    PROPOSAL,
    PROPOSAL_VOTE,

//    Delegation

    DELEGATIONS,
    DELEGATEE,

//    Presence proofs already used, by transaction hash

    CONSUMED_TRANSACTION;

    private static final char SEPARATOR = ':';

    public String key() {
        return this.name();
    }

    /**
     * Builds {@code NAME:part1:part2...}. Numeric parts are zero-padded so that
     * lexicographic order matches numeric order.
     */
    public String key(Object... parts) {
        StringBuilder sb = new StringBuilder(name());
        for (Object part : parts) {
            sb.append(SEPARATOR);
            if (part instanceof Long || part instanceof Integer) {
                sb.append(String.format("%020d", ((Number) part).longValue()));
            } else {
                sb.append(part);
            }
        }
        return sb.toString();
    }

    /**
     * Prefix of every key built with {@code key(parts..., x)}.
     */
    public String prefix(Object... parts) {
        return key(parts) + SEPARATOR;
    }

    @Override
    public String toString() {
        return name();
    }
}
