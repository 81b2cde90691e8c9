package org.consultation.governance;

/**
 * Choice recorded on a temperature check.
 */
public enum TemperatureCheckVote {
    FOR,
    AGAINST
}
