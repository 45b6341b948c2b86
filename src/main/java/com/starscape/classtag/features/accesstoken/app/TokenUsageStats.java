package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.TokenStatus;

import java.time.Instant;

public record TokenUsageStats(
    String tokenId,
    TokenStatus status,
    int usedCount,
    Integer maxUses,
    long totalValidations,
    long successfulValidations,
    long failedValidations,
    Instant lastAccessAt
) {}
