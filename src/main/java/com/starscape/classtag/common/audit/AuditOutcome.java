package com.starscape.classtag.common.audit;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
