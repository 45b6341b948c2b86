package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;

import java.util.UUID;

public record TokenValidationResult(
    boolean valid,
    String tokenId,
    TokenScope scope,
    UUID resourceId,
    AccessLevel accessLevel,
    boolean canDownload,
    ValidationReason reason
) {

    static TokenValidationResult valid(AccessToken token) {
        return new TokenValidationResult(true, token.getTokenId(), token.getScope(), token.getResourceId(),
                token.getAccessLevel(), token.isCanDownload(), ValidationReason.VALID);
    }

    static TokenValidationResult invalid(String tokenId, ValidationReason reason) {
        return new TokenValidationResult(false, tokenId, null, null, null, false, reason);
    }
}
