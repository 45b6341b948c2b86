package com.starscape.classtag.features.tagging.api.dto;

import com.starscape.classtag.features.tagging.app.BatchTagResult;

public record BatchTagResponse(
    boolean success,
    int assignedCount,
    int duplicateCount,
    String workflowType,
    String message
) {

    public static BatchTagResponse from(BatchTagResult result) {
        return new BatchTagResponse(
            true,
            result.assignedCount(),
            result.duplicateCount(),
            result.workflow().getWireName(),
            result.message()
        );
    }
}
