package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import com.starscape.classtag.features.accesstoken.domain.TokenStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Admin view of a token. Never carries hash, salt or plaintext.
 */
public record AccessTokenSummary(
    String tokenId,
    String maskedToken,
    TokenScope scope,
    UUID resourceId,
    AccessLevel accessLevel,
    boolean canDownload,
    TokenStatus status,
    int usedCount,
    Integer maxUses,
    Instant expiresAt,
    Instant revokedAt,
    Instant lastUsedAt,
    Instant createdAt,
    String createdBy
) {

    public static AccessTokenSummary from(AccessToken token, Instant now) {
        return new AccessTokenSummary(
            token.getTokenId(),
            TokenCrypto.mask(token.getTokenPrefix()),
            token.getScope(),
            token.getResourceId(),
            token.getAccessLevel(),
            token.isCanDownload(),
            token.statusAt(now),
            token.getUsedCount(),
            token.getMaxUses(),
            token.getExpiresAt(),
            token.getRevokedAt(),
            token.getLastUsedAt(),
            token.getCreatedAt(),
            token.getCreatedBy()
        );
    }
}
