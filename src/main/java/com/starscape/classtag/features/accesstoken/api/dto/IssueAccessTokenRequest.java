package com.starscape.classtag.features.accesstoken.api.dto;

import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.UUID;

public record IssueAccessTokenRequest(
    @NotNull(message = "scope is required")
    TokenScope scope,

    @NotNull(message = "resourceId is required")
    UUID resourceId,

    AccessLevel accessLevel,

    Boolean canDownload,

    @Positive(message = "maxUses must be greater than 0")
    Integer maxUses,

    @Future(message = "expiresAt must be in the future")
    Instant expiresAt
) {}
