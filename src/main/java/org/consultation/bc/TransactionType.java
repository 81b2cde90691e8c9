package org.consultation.bc;

/**
 * Defines the kinds of invocation a signed transaction can carry.
 * Each type corresponds to one mutating governance or delegation operation.
 */
public enum TransactionType {
    // Governance
    VOTE_ON_TEMPERATURE_CHECK,
    VOTE_ON_PROPOSAL,
    ELEVATE_TEMPERATURE_CHECK,
    UPDATE_GOVERNANCE_PARAMETERS,

    // Delegation
    MAKE_DELEGATION,
    REMOVE_DELEGATION
}
