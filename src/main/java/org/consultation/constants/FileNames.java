package org.consultation.constants;

public class FileNames {
    public static final String GOVERNANCE_DB = "governance.db";
    public static final String DELEGATION_DB = "delegation.db";
    public static final String EVENT_LOG_DB = "events.db";
}
