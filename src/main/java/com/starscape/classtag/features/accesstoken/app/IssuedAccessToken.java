package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;

import java.time.Instant;
import java.util.UUID;

/**
 * Issuance result. {@code token} is the only copy of the plaintext that will ever exist.
 */
public record IssuedAccessToken(
    String tokenId,
    String token,
    String maskedToken,
    TokenScope scope,
    UUID resourceId,
    AccessLevel accessLevel,
    boolean canDownload,
    Integer maxUses,
    Instant expiresAt
) {

    @Override
    public String toString() {
        return "IssuedAccessToken[tokenId=" + tokenId + ", token=" + maskedToken + "]";
    }
}
