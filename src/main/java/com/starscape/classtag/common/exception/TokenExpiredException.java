package com.starscape.classtag.common.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Raised when a subject's QR token window has closed.
 */
public class TokenExpiredException extends DomainValidationException {

    public TokenExpiredException(Instant expiresAt) {
        super("Token expired", Map.of("expiresAt", expiresAt.toString()));
    }
}
