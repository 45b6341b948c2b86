package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;

import java.time.Instant;
import java.util.UUID;

public record IssueAccessTokenCommand(
    TokenScope scope,
    UUID resourceId,
    AccessLevel accessLevel,
    Boolean canDownload,
    Integer maxUses,
    Instant expiresAt
) {}
