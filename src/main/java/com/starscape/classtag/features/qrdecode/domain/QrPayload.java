package com.starscape.classtag.features.qrdecode.domain;

import java.util.UUID;

/**
 * Parsed {@code STUDENT:<subjectId>:<subjectName>:<eventId>} payload.
 * Carries claims only; nothing here has been checked against storage.
 */
public record QrPayload(UUID subjectId, String subjectName, UUID eventId) {}
