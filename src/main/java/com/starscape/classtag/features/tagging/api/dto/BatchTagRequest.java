package com.starscape.classtag.features.tagging.api.dto;

import com.starscape.classtag.features.tagging.domain.TaggingWorkflow;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record BatchTagRequest(
    @NotNull(message = "eventId is required")
    UUID eventId,

    @NotNull(message = "photoIds is required")
    List<UUID> photoIds,

    @NotNull(message = "subjectId is required")
    UUID subjectId,

    TaggingWorkflow workflow
) {}
