package com.starscape.classtag.features.tagging.app;

import com.starscape.classtag.features.tagging.domain.TaggingWorkflow;

/**
 * Outcome of a batch. {@code assignedCount + duplicateCount} equals the number
 * of distinct photos in the request.
 */
public record BatchTagResult(
    int assignedCount,
    int duplicateCount,
    TaggingWorkflow workflow,
    String subjectName
) {

    public String message() {
        if (assignedCount == 0) {
            return "All " + duplicateCount + " photos were already assigned to " + subjectName;
        }
        String message = assignedCount + " photos assigned to " + subjectName;
        if (duplicateCount > 0) {
            message += " (" + duplicateCount + " already assigned)";
        }
        return message;
    }
}
