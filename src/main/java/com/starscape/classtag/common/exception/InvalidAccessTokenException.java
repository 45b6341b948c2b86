package com.starscape.classtag.common.exception;

/**
 * Single public outcome for every unusable access token. The concrete reason
 * (unknown, expired, revoked, exhausted) is kept in the audit log only.
 */
public class InvalidAccessTokenException extends RuntimeException {

    public InvalidAccessTokenException() {
        super("Invalid or expired access token");
    }
}
