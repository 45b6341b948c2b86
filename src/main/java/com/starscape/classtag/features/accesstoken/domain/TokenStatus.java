package com.starscape.classtag.features.accesstoken.domain;

/**
 * Lifecycle of an access token. Every state other than ACTIVE is terminal.
 */
public enum TokenStatus {
    ACTIVE,
    EXPIRED,
    REVOKED,
    EXHAUSTED;

    public boolean isUsable() {
        return this == ACTIVE;
    }
}
