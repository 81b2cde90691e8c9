package org.consultation.event;

/**
 * Kinds of notification emitted after a successful mutating operation.
 */
public enum EventType {
    TEMPERATURE_CHECK_CREATED,
    TEMPERATURE_CHECK_VOTED,
    PROPOSAL_CREATED,
    PROPOSAL_VOTED,
    GOVERNANCE_PARAMETERS_UPDATED,
    DELEGATION_CREATED,
    DELEGATION_REMOVED
}
