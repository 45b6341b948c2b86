package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.TokenStatus;

/**
 * Internal outcome of a token check. Callers outside the service only ever see
 * valid or invalid; the reason goes to the audit log.
 */
public enum ValidationReason {
    VALID,
    NOT_FOUND,
    EXPIRED,
    REVOKED,
    EXHAUSTED;

    static ValidationReason from(TokenStatus status) {
        switch (status) {
            case ACTIVE:
                return VALID;
            case EXPIRED:
                return EXPIRED;
            case REVOKED:
                return REVOKED;
            case EXHAUSTED:
                return EXHAUSTED;
            default:
                throw new IllegalArgumentException("Unhandled token status: " + status);
        }
    }
}
