package com.starscape.classtag.features.qrdecode.app;

import java.time.Instant;
import java.util.UUID;

/**
 * Subject identified by a scanned QR code, with the facts the tagging screen needs.
 */
public record DecodedStudent(
    UUID id,
    String name,
    String grade,
    UUID eventId,
    long photoCount,
    String maskedToken,
    String tokenStatus,
    Instant decodedAt
) {}
