package com.starscape.classtag.features.accesstoken.api.dto;

import com.starscape.classtag.features.accesstoken.app.TokenValidationResult;
import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;

import java.util.UUID;

public record ValidateTokenResponse(
    boolean valid,
    TokenScope scope,
    UUID resourceId,
    AccessLevel accessLevel,
    boolean canDownload
) {

    public static ValidateTokenResponse from(TokenValidationResult result) {
        return new ValidateTokenResponse(true, result.scope(), result.resourceId(),
                result.accessLevel(), result.canDownload());
    }
}
