package com.starscape.classtag.common.audit;

public enum AuditAction {
    TOKEN_ISSUED,
    TOKEN_VALIDATED,
    TOKEN_REVOKED,
    QR_DECODED,
    BATCH_TAGGED,
    ASSIGNMENT_REMOVED,
    DOWNLOAD_URL_ISSUED
}
