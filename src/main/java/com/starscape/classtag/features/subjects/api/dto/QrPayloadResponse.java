package com.starscape.classtag.features.subjects.api.dto;

import java.util.UUID;

public record QrPayloadResponse(
    UUID subjectId,
    UUID eventId,
    String payload
) {}
