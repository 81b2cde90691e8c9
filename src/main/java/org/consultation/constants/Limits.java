package org.consultation.constants;

/**
 * Hard bounds on ballot and delegation inputs.
 */
public final class Limits {

    private Limits() {
    }

    /** Maximum number of vote options per temperature check / proposal. */
    public static final int MAX_VOTE_OPTIONS = 10;

    /** Vote option ids are unsigned 32-bit values. */
    public static final long MAX_VOTE_OPTION_ID = 0xFFFFFFFFL;

    /** Maximum number of attachments per temperature check / proposal. */
    public static final int MAX_ATTACHMENTS = 10;

    /** Maximum number of stored delegations per delegator, expired ones included. */
    public static final int MAX_DELEGATIONS = 50;

    /** Day counts are unsigned 16-bit values. */
    public static final int MAX_DAYS = 65535;
}
