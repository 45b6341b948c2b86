package com.starscape.classtag.features.qrdecode.api.dto;

import com.starscape.classtag.features.qrdecode.app.DecodedStudent;

import java.time.Instant;
import java.util.UUID;

public record DecodeQrResponse(
    boolean success,
    Student student,
    Metadata metadata
) {

    public static DecodeQrResponse from(DecodedStudent decoded) {
        return new DecodeQrResponse(
            true,
            new Student(decoded.id(), decoded.name(), decoded.grade(), decoded.eventId(),
                    decoded.photoCount(), decoded.maskedToken()),
            new Metadata(decoded.tokenStatus(), decoded.decodedAt())
        );
    }

    public record Student(UUID id, String name, String grade, UUID eventId, long photoCount, String token) {}

    public record Metadata(String tokenStatus, Instant decodedAt) {}
}
